package com.narrateplus.playback;

/**
 * Host media session (lock screen, media keys) as seen from the player.
 */
public interface MediaSessionHost
{
    void setMetadata(String title, double durationSeconds);

    void setPlaybackState(PlaybackState state, double positionSeconds, double speed);

    void setCallbacks(MediaSessionCallbacks callbacks);

    /**
     * Commands the host forwards from its controls.
     */
    interface MediaSessionCallbacks
    {
        void onPlay();

        void onPause();

        void onSeekToSegment(int index);

        void onNext();

        void onPrevious();
    }
}
