package com.narrateplus.tts;

import com.narrateplus.generation.PermanentGenerationException;
import com.narrateplus.model.EngineKind;
import com.narrateplus.model.TierConfig;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * SpeechEngine used when speech is disabled. Every request fails permanently.
 */
public final class NoopSpeechEngine implements SpeechEngine
{
    @Override
    public boolean isAvailable()
    {
        return false;
    }

    @Override
    public Set<EngineKind> supportedEngines()
    {
        return EnumSet.allOf(EngineKind.class);
    }

    @Override
    public CompletableFuture<byte[]> synthesize(String text, TierConfig tier)
    {
        return CompletableFuture.failedFuture(new PermanentGenerationException("Speech backend is disabled"));
    }

    @Override
    public void shutdown()
    {
        // nothing held
    }
}
