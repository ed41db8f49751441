package com.narrateplus.playback;

public enum PlaybackState
{
    STOPPED,
    LOADING,
    PLAYING,
    PAUSED,
    /**
     * Playing, but waiting for the current segment's audio.
     */
    BUFFERING,
    ENDED,
    /**
     * The current segment could not be generated; playback stopped.
     */
    ERROR
}
