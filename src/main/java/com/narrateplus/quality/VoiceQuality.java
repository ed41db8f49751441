package com.narrateplus.quality;

/**
 * Piper model quality levels, lowest first. The ordinal plus one is the tier the
 * voice occupies in a Piper ladder.
 */
public enum VoiceQuality
{
    LOW,
    MEDIUM,
    HIGH
}
