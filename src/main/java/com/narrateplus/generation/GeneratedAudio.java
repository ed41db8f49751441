package com.narrateplus.generation;

import com.narrateplus.model.Segment;
import com.narrateplus.model.TierConfig;
import com.narrateplus.tts.WavAudio;
import lombok.ToString;
import lombok.Value;

/**
 * Successful generation result.
 */
@Value
public class GeneratedAudio
{
    @ToString.Exclude
    byte[] audio;

    /**
     * Configuration the audio was actually produced with. A deduplicated caller may
     * receive audio produced for another caller's configuration.
     */
    TierConfig tier;

    /**
     * Dispatches it took, including the successful one.
     */
    int attempts;

    /**
     * The generated form of {@code base} at tier number {@code tier}, with its measured duration.
     */
    public Segment applyTo(Segment base, int tierNumber)
    {
        return base.withAudio(audio, tierNumber, WavAudio.durationSeconds(audio));
    }
}
