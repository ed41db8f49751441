package com.narrateplus.playback;

import com.narrateplus.model.Segment;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Reference-counted borrow of one segment's audio.
 *
 * Starts with one reference, held by whoever created it. Each consumer that
 * {@link #retain()}s must {@link #release()}; the handle is revoked exactly once,
 * when the last reference goes.
 */
@Slf4j
public final class AudioHandle
{
    @Getter
    private final int index;

    @Getter
    private final int qualityTier;

    @Getter
    private final double durationSeconds;

    private final byte[] audio;
    private final AtomicInteger refs = new AtomicInteger(1);
    private final AtomicBoolean revoked = new AtomicBoolean(false);
    private final Consumer<AudioHandle> onRevoke;

    AudioHandle(Segment segment, Consumer<AudioHandle> onRevoke)
    {
        this.index = segment.getIndex();
        this.qualityTier = segment.getQualityTier();
        this.durationSeconds = segment.getDurationSeconds().orElse(0d);
        this.audio = segment.getAudio()
                .orElseThrow(() -> new IllegalArgumentException("Segment " + segment.getIndex() + " has no audio"));
        this.onRevoke = onRevoke;
    }

    /**
     * @return false when the handle was already revoked
     */
    public boolean retain()
    {
        while (true)
        {
            int r = refs.get();
            if (r <= 0)
            {
                return false;
            }
            if (refs.compareAndSet(r, r + 1))
            {
                return true;
            }
        }
    }

    public void release()
    {
        int r = refs.decrementAndGet();
        if (r == 0)
        {
            if (revoked.compareAndSet(false, true))
            {
                onRevoke.accept(this);
            }
        }
        else if (r < 0)
        {
            refs.set(0);
            log.warn("Audio handle for segment {} released more often than retained", index);
        }
    }

    public boolean isRevoked()
    {
        return revoked.get();
    }

    /**
     * WAV bytes. Not copied.
     *
     * @throws IllegalStateException once revoked
     */
    public byte[] getAudio()
    {
        if (revoked.get())
        {
            throw new IllegalStateException("Audio handle for segment " + index + " was revoked");
        }
        return audio;
    }

    @Override
    public String toString()
    {
        return "AudioHandle{index=" + index + ", tier=" + qualityTier + ", refs=" + refs.get() + "}";
    }
}
