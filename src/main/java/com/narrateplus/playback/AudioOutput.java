package com.narrateplus.playback;

/**
 * Sink that renders one segment's audio at a time.
 */
public interface AudioOutput
{
    /**
     * Stops whatever is playing and starts {@code handle} from the beginning.
     * {@code onFinished} runs once if the audio plays to its end; never after
     * {@link #stop()}, another start, or a swap away from it.
     *
     * @throws IllegalStateException when the audio cannot be opened
     */
    void start(AudioHandle handle, double speed, Runnable onFinished);

    void pause();

    void resume();

    void stop();

    /**
     * Replaces the current audio with {@code handle} at the same position without a
     * restart, keeping the paused or running state and the end callback.
     *
     * @return false when nothing is playing or the swap was not possible
     */
    boolean swap(AudioHandle handle);

    void setSpeed(double speed);

    /**
     * Position within the current segment.
     */
    double positionSeconds();

    void shutdown();
}
