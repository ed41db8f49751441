package com.narrateplus;

/**
 * Tunables for generation, buffering, upgrades and the speech backend.
 *
 * Every accessor has a default. {@link ConfigLoader} resolves a proxy that looks up
 * {@code narrateplus.<methodName>} and falls back to these defaults.
 */
public interface NarratePlusConfig
{
    String GROUP = "narrateplus";

    enum SpeechBackend
    {
        /**
         * HTTP synthesis bridge running next to the player (recommended).
         */
        BRIDGE,

        /**
         * Piper CLI run as a subprocess per segment.
         */
        PIPER,

        /**
         * No speech. Every request fails permanently.
         */
        NONE
    }

    // --------------------
    // Buffering
    // --------------------

    default int lookaheadSegments()
    {
        return 5;
    }

    default int evictionTrailSegments()
    {
        return 5;
    }

    default int prefetchConcurrency()
    {
        return 5;
    }

    default long positionReportIntervalMs()
    {
        return 250;
    }

    default int wordsPerMinute()
    {
        return 160;
    }

    // --------------------
    // Generation
    // --------------------

    default long requestTimeoutMs()
    {
        return 120_000;
    }

    default int maxInFlightRequests()
    {
        return 50;
    }

    default int maxRetries()
    {
        return 3;
    }

    default long initialBackoffMs()
    {
        return 1000;
    }

    default long maxBackoffMs()
    {
        return 5000;
    }

    default double backoffMultiplier()
    {
        return 2.0;
    }

    default int generationThreads()
    {
        return 2;
    }

    // --------------------
    // Quality upgrades
    // --------------------

    default long upgradeInitialDelayMs()
    {
        return 5000;
    }

    default long upgradeTickMs()
    {
        return 5000;
    }

    default int upgradeHorizonSegments()
    {
        return 10;
    }

    default boolean upgradePlayedSegments()
    {
        return true;
    }

    default double memoryFloorGb()
    {
        return 2.0;
    }

    default double lowBatteryThreshold()
    {
        return 0.2;
    }

    default double heapUtilizationCeiling()
    {
        return 0.8;
    }

    /**
     * Treat the host as a handheld device when classifying capability.
     */
    default boolean mobileHost()
    {
        return false;
    }

    // --------------------
    // Speech backend
    // --------------------

    default SpeechBackend speechBackend()
    {
        return SpeechBackend.BRIDGE;
    }

    default String bridgeBaseUrl()
    {
        return "http://127.0.0.1:59125";
    }

    default int bridgeTimeoutMs()
    {
        return 60_000;
    }

    /**
     * Full path to the piper binary.
     */
    default String piperPath()
    {
        return "";
    }

    /**
     * Directory holding {@code <voiceKey>.onnx} models.
     */
    default String piperModelDir()
    {
        return "";
    }

    /**
     * Voice used when a tier asks for the system voice and the backend is Piper.
     */
    default String piperDefaultVoice()
    {
        return "en_US-lessac-low";
    }

    /**
     * Comma separated {@code key:language:quality} entries, e.g.
     * {@code de_DE-thorsten-low:de:low,de_DE-thorsten-high:de:high}.
     */
    default String piperVoices()
    {
        return "";
    }

    default String kokoroVoice()
    {
        return "af_heart";
    }
}
