package com.narrateplus.model;

import lombok.Value;
import lombok.With;

/**
 * What is audible now. Snapshots are immutable; the player publishes a new one
 * on every change.
 */
@Value
@With
public class PlaybackCursor
{
    public static final PlaybackCursor INITIAL = new PlaybackCursor(-1, 0d, 0d, false, false);

    int currentSegmentIndex;

    /**
     * Position inside the current segment.
     */
    double currentTimeSeconds;

    /**
     * Length of the current segment, 0 until known.
     */
    double durationSeconds;

    boolean playing;

    boolean buffering;
}
