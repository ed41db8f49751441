package com.narrateplus.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Generator settings for one quality tier.
 */
@Value
public class TierConfig
{
    @NonNull
    EngineKind engine;

    /**
     * Engine-specific voice id. Empty for the system voice.
     */
    @NonNull
    String voice;

    /**
     * Null when the engine has no notion of precision.
     */
    Quantization quantization;

    /**
     * Null when the engine picks its own device.
     */
    ExecutionDevice device;

    public static TierConfig systemVoice()
    {
        return new TierConfig(EngineKind.SYSTEM, "", null, null);
    }

    public static TierConfig kokoro(String voice, Quantization quantization, ExecutionDevice device)
    {
        return new TierConfig(EngineKind.KOKORO, voice, quantization, device);
    }

    public static TierConfig piper(String voiceKey)
    {
        return new TierConfig(EngineKind.PIPER, voiceKey, null, null);
    }
}
