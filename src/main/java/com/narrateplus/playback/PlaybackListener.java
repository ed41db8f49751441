package com.narrateplus.playback;

import com.narrateplus.generation.GenerationException;
import com.narrateplus.model.PlaybackCursor;

/**
 * Observer of the player. Callbacks arrive on the player thread and must not block.
 */
public interface PlaybackListener
{
    default void onStateChanged(PlaybackState state)
    {
    }

    default void onCursorChanged(PlaybackCursor cursor)
    {
    }

    /**
     * @param exact true once every segment's duration was measured from real audio
     */
    default void onChapterDurationChanged(double seconds, boolean exact)
    {
    }

    default void onError(GenerationException error)
    {
    }
}
