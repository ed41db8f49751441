package com.narrateplus.tts;

import com.narrateplus.NarratePlusConfig;
import com.narrateplus.model.EngineKind;
import java.util.EnumSet;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import okhttp3.OkHttpClient;

/**
 * Creates a SpeechEngine from config. Called again whenever the generation layer
 * discards an engine, so every call returns a fresh instance.
 */
@Singleton
public class SpeechEngineFactory
{
    private static final String DEFAULT_BASE_URL = "http://127.0.0.1:59125";

    private final OkHttpClient http;
    private final NarratePlusConfig config;

    @Inject
    public SpeechEngineFactory(OkHttpClient http, NarratePlusConfig config)
    {
        this.http = http;
        this.config = config;
    }

    public SpeechEngine create()
    {
        if (config == null)
        {
            return new NoopSpeechEngine();
        }

        switch (config.speechBackend())
        {
            case BRIDGE:
                return new BridgeSpeechEngine(http, normalizeBaseUrl(config.bridgeBaseUrl()), config.bridgeTimeoutMs());
            case PIPER:
                return new PiperSpeechEngine(config.piperPath(), config.piperModelDir(), config.piperDefaultVoice(),
                        config.requestTimeoutMs(), config.generationThreads());
            default:
                return new NoopSpeechEngine();
        }
    }

    /**
     * Engine families the configured backend can render, without creating an engine.
     */
    public Set<EngineKind> supportedEngines()
    {
        if (config != null && config.speechBackend() == NarratePlusConfig.SpeechBackend.PIPER)
        {
            return EnumSet.of(EngineKind.SYSTEM, EngineKind.PIPER);
        }
        return EnumSet.allOf(EngineKind.class);
    }

    static String normalizeBaseUrl(String baseUrl)
    {
        if (baseUrl == null || baseUrl.trim().isEmpty())
        {
            return DEFAULT_BASE_URL;
        }

        String endpoint = baseUrl.trim();

        // Normalize trailing slash
        while (endpoint.endsWith("/"))
        {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }

        // Users tend to paste the full endpoint.
        for (String suffix : new String[]{"/synthesize", "/health"})
        {
            if (endpoint.endsWith(suffix))
            {
                endpoint = endpoint.substring(0, endpoint.length() - suffix.length());
            }
        }

        return endpoint.isEmpty() ? DEFAULT_BASE_URL : endpoint;
    }
}
