package com.narrateplus.tts;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import com.narrateplus.TestConfigs;
import com.narrateplus.model.EngineKind;
import java.util.EnumSet;
import okhttp3.OkHttpClient;
import org.junit.Test;

public class SpeechEngineFactoryTest
{
    private final OkHttpClient http = new OkHttpClient();

    @Test
    public void backendSelectsTheEngine()
    {
        SpeechEngine bridge = new SpeechEngineFactory(http, TestConfigs.with()).create();
        SpeechEngine piper = new SpeechEngineFactory(http, TestConfigs.with("speechBackend", "PIPER")).create();
        SpeechEngine none = new SpeechEngineFactory(http, TestConfigs.with("speechBackend", "NONE")).create();

        try
        {
            assertTrue(bridge instanceof BridgeSpeechEngine);
            assertTrue(piper instanceof PiperSpeechEngine);
            assertTrue(none instanceof NoopSpeechEngine);
        }
        finally
        {
            bridge.shutdown();
            piper.shutdown();
        }
    }

    @Test
    public void everyCreateIsAFreshEngine()
    {
        SpeechEngineFactory factory = new SpeechEngineFactory(http, TestConfigs.with());
        SpeechEngine a = factory.create();
        SpeechEngine b = factory.create();

        assertNotSame(a, b);
        a.shutdown();
        assertTrue(b.isAvailable());
        b.shutdown();
    }

    @Test
    public void piperBackendOnlyRendersPiperAndSystemVoices()
    {
        assertEquals(EnumSet.of(EngineKind.SYSTEM, EngineKind.PIPER),
                new SpeechEngineFactory(http, TestConfigs.with("speechBackend", "PIPER")).supportedEngines());
        assertEquals(EnumSet.allOf(EngineKind.class),
                new SpeechEngineFactory(http, TestConfigs.with()).supportedEngines());
    }

    @Test
    public void baseUrlIsNormalized()
    {
        assertEquals("http://127.0.0.1:59125", SpeechEngineFactory.normalizeBaseUrl("  "));
        assertEquals("http://127.0.0.1:59125", SpeechEngineFactory.normalizeBaseUrl(null));
        assertEquals("http://host:1", SpeechEngineFactory.normalizeBaseUrl("http://host:1///"));
        assertEquals("http://host:1", SpeechEngineFactory.normalizeBaseUrl("http://host:1/synthesize"));
        assertEquals("http://host:1", SpeechEngineFactory.normalizeBaseUrl(" http://host:1/health/ "));
    }
}
