package com.narrateplus.tts;

import com.narrateplus.model.EngineKind;
import com.narrateplus.model.TierConfig;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Abstraction over the external speech generator so backends can be swapped.
 *
 * Contract:
 * - synthesize() must return quickly (do work off-thread) and complete with WAV bytes.
 * - shutdown() releases the backend and fails outstanding work with a transient error,
 *   so a replacement instance can pick the work up.
 */
public interface SpeechEngine
{
    boolean isAvailable();

    /**
     * Engine families this backend can render.
     */
    Set<EngineKind> supportedEngines();

    CompletableFuture<byte[]> synthesize(String text, TierConfig tier);

    void shutdown();
}
