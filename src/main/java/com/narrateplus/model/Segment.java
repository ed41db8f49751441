package com.narrateplus.model;

import java.util.Objects;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One unit of speakable text within a chapter.
 *
 * Immutable. Index and text never change; audio, timing and quality tier are
 * filled in by producing a new instance once generation completes. The quality
 * tier only moves upward.
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Segment
{
    /**
     * Tier of a segment that has not been generated yet.
     */
    public static final int UNDEFINED_TIER = -1;

    private final int index;
    private final String text;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private final byte[] audio;

    @Getter(AccessLevel.NONE)
    private final Double durationSeconds;

    @Getter(AccessLevel.NONE)
    private final Double startOffsetSeconds;

    private final int qualityTier;

    public static Segment of(int index, String text)
    {
        if (index < 0)
        {
            throw new IllegalArgumentException("Segment index must be >= 0, got " + index);
        }
        return new Segment(index, Objects.requireNonNull(text, "text"), null, null, null, UNDEFINED_TIER);
    }

    public boolean hasAudio()
    {
        return audio != null && audio.length > 0;
    }

    /**
     * Raw audio bytes (WAV). Not copied; callers must not mutate the array.
     */
    public Optional<byte[]> getAudio()
    {
        return Optional.ofNullable(audio);
    }

    public Optional<Double> getDurationSeconds()
    {
        return Optional.ofNullable(durationSeconds);
    }

    public Optional<Double> getStartOffsetSeconds()
    {
        return Optional.ofNullable(startOffsetSeconds);
    }

    /**
     * Result of generating this segment at {@code tier}.
     *
     * @throws IllegalArgumentException if {@code tier} is not strictly above the current tier
     */
    public Segment withAudio(byte[] generated, int tier, double seconds)
    {
        if (generated == null || generated.length == 0)
        {
            throw new IllegalArgumentException("Generated audio for segment " + index + " is empty");
        }
        if (tier <= qualityTier)
        {
            throw new IllegalArgumentException("Quality tier for segment " + index
                    + " cannot move from " + qualityTier + " to " + tier);
        }
        return new Segment(index, text, generated, seconds > 0 ? seconds : null, startOffsetSeconds, tier);
    }

    public Segment withStartOffset(double offsetSeconds)
    {
        return new Segment(index, text, audio, durationSeconds, offsetSeconds, qualityTier);
    }

    /**
     * Same segment without its audio, for holders that only track text and tier.
     */
    public Segment withoutAudio()
    {
        return new Segment(index, text, null, durationSeconds, startOffsetSeconds, qualityTier);
    }
}
