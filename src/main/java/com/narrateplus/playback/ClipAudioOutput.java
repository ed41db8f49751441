package com.narrateplus.playback;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.LineEvent;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.UnsupportedAudioFileException;
import lombok.extern.slf4j.Slf4j;

/**
 * Java Sound {@link Clip} output.
 *
 * Speed is applied by replaying the PCM frames at a scaled sample rate. Swaps reopen
 * the new audio at the current frame position of the old one.
 */
@Slf4j
public class ClipAudioOutput implements AudioOutput
{
    /**
     * Invalidates end-of-audio callbacks from clips that were stopped or swapped out.
     */
    private final AtomicLong generation = new AtomicLong(0);

    private final Object clipLock = new Object();

    // guarded by clipLock
    private Clip currentClip;
    private AudioHandle currentHandle;
    private float currentFrameRate;
    private Runnable onFinished;
    private boolean paused;
    private double speed = 1.0d;

    @Override
    public void start(AudioHandle handle, double speed, Runnable onFinished)
    {
        synchronized (clipLock)
        {
            long gen = generation.incrementAndGet();
            stopCurrentClipLocked();

            this.speed = speed;
            this.onFinished = onFinished;
            this.paused = false;

            currentClip = open(handle, gen, 0d);
            currentHandle = handle;
            currentClip.start();
        }
    }

    @Override
    public void pause()
    {
        synchronized (clipLock)
        {
            if (currentClip != null && !paused)
            {
                paused = true;
                currentClip.stop();
            }
        }
    }

    @Override
    public void resume()
    {
        synchronized (clipLock)
        {
            if (currentClip != null && paused)
            {
                paused = false;
                currentClip.start();
            }
        }
    }

    @Override
    public void stop()
    {
        synchronized (clipLock)
        {
            generation.incrementAndGet();
            stopCurrentClipLocked();
            currentHandle = null;
            onFinished = null;
            paused = false;
        }
    }

    @Override
    public boolean swap(AudioHandle handle)
    {
        synchronized (clipLock)
        {
            if (currentClip == null)
            {
                return false;
            }
            return reopenLocked(handle);
        }
    }

    @Override
    public void setSpeed(double speed)
    {
        synchronized (clipLock)
        {
            if (this.speed == speed)
            {
                return;
            }
            this.speed = speed;

            if (currentClip != null && currentHandle != null && !currentHandle.isRevoked())
            {
                reopenLocked(currentHandle);
            }
        }
    }

    @Override
    public double positionSeconds()
    {
        synchronized (clipLock)
        {
            return positionLocked();
        }
    }

    @Override
    public void shutdown()
    {
        stop();
    }

    private boolean reopenLocked(AudioHandle handle)
    {
        double position = positionLocked();
        long gen = generation.get() + 1;

        Clip fresh;
        try
        {
            fresh = open(handle, gen, position);
        }
        catch (IllegalStateException e)
        {
            log.debug("Swap to segment {} not possible: {}", handle.getIndex(), e.toString());
            return false;
        }

        generation.set(gen);
        stopCurrentClipLocked();
        currentClip = fresh;
        currentHandle = handle;
        if (!paused)
        {
            fresh.start();
        }
        return true;
    }

    private Clip open(AudioHandle handle, long gen, double positionSeconds)
    {
        try (AudioInputStream src = AudioSystem.getAudioInputStream(new ByteArrayInputStream(handle.getAudio())))
        {
            AudioFormat format = src.getFormat();
            AudioFormat played = scaled(format, speed);
            AudioInputStream ais = new AudioInputStream(src, played, src.getFrameLength());

            Clip clip = newClip();
            try
            {
                clip.open(ais);
            }
            catch (LineUnavailableException | IOException | RuntimeException e)
            {
                clip.close();
                throw e;
            }

            int frame = (int) Math.min(clip.getFrameLength(), Math.round(positionSeconds * format.getFrameRate()));
            clip.setFramePosition(Math.max(0, frame));
            clip.addLineListener(event ->
            {
                if (event.getType() == LineEvent.Type.STOP)
                {
                    onClipStopped(clip, gen);
                }
            });

            currentFrameRate = format.getFrameRate();
            return clip;
        }
        // getClip() throws IllegalArgumentException on hosts without a mixer.
        catch (UnsupportedAudioFileException | IOException | LineUnavailableException | IllegalArgumentException e)
        {
            throw new IllegalStateException("Cannot open audio for segment " + handle.getIndex(), e);
        }
    }

    Clip newClip() throws LineUnavailableException
    {
        return AudioSystem.getClip();
    }

    private void onClipStopped(Clip clip, long gen)
    {
        Runnable callback;
        synchronized (clipLock)
        {
            if (generation.get() != gen || paused || clip != currentClip)
            {
                return;
            }
            if (clip.getFramePosition() < clip.getFrameLength())
            {
                return;
            }
            callback = onFinished;
            onFinished = null;
        }

        if (callback != null)
        {
            callback.run();
        }
    }

    private double positionLocked()
    {
        if (currentClip == null || currentFrameRate <= 0)
        {
            return 0d;
        }
        return currentClip.getLongFramePosition() / (double) currentFrameRate;
    }

    private void stopCurrentClipLocked()
    {
        if (currentClip != null)
        {
            try
            {
                currentClip.stop();
                currentClip.close();
            }
            catch (RuntimeException e)
            {
                log.debug("Closing clip failed: {}", e.toString());
            }

            currentClip = null;
        }
    }

    static AudioFormat scaled(AudioFormat format, double speed)
    {
        if (speed == 1.0d)
        {
            return format;
        }
        return new AudioFormat(
                format.getEncoding(),
                (float) (format.getSampleRate() * speed),
                format.getSampleSizeInBits(),
                format.getChannels(),
                format.getFrameSize(),
                (float) (format.getFrameRate() * speed),
                format.isBigEndian());
    }
}
