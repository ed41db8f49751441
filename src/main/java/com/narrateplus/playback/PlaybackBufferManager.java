package com.narrateplus.playback;

import com.narrateplus.generation.GeneratedAudio;
import com.narrateplus.generation.GenerationCoordinator;
import com.narrateplus.generation.GenerationErrors;
import com.narrateplus.generation.GenerationException;
import com.narrateplus.model.Segment;
import com.narrateplus.model.TierConfig;
import com.narrateplus.model.TierLadder;
import com.narrateplus.progress.ChapterProgress;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps audio ready for the segments just ahead of the playback cursor.
 *
 * On every cursor move the window {@code (cursor, cursor + lookahead]} is topped up
 * with generation requests, at most {@code prefetchConcurrency} at a time, and handles
 * further than the trail distance behind the cursor are released. A segment the
 * cursor needs before it is ready is awaited through the coordinator, joining any
 * request already in flight for it.
 */
@Slf4j
public class PlaybackBufferManager
{
    private final String chapterId;
    private final ChapterProgress progress;
    private final GenerationCoordinator coordinator;
    private final TierLadder ladder;
    private final int fastTier;
    private final TierConfig fastConfig;
    private final int lookahead;
    private final int trail;
    private final int concurrency;
    private final Consumer<Segment> onRecorded;

    private final AudioHandleTable table = new AudioHandleTable();

    // guarded by this
    private final Deque<Integer> pending = new ArrayDeque<>();
    private final Set<Integer> inFlight = new HashSet<>();
    private int cursor = -1;
    private boolean closed;

    /**
     * @param onRecorded called once per index when its first generated result is recorded
     */
    public PlaybackBufferManager(
            String chapterId,
            ChapterProgress progress,
            GenerationCoordinator coordinator,
            TierLadder ladder,
            int fastTier,
            int lookahead,
            int trail,
            int concurrency,
            Consumer<Segment> onRecorded)
    {
        this.chapterId = chapterId;
        this.progress = progress;
        this.coordinator = coordinator;
        this.ladder = ladder;
        this.fastTier = fastTier;
        this.fastConfig = ladder.tier(fastTier)
                .orElseThrow(() -> new IllegalArgumentException("Tier " + fastTier + " is not available"));
        this.lookahead = Math.max(0, lookahead);
        this.trail = Math.max(0, trail);
        this.concurrency = Math.max(1, concurrency);
        this.onRecorded = onRecorded;
    }

    /**
     * Moves the window to {@code index}: evicts old handles, installs handles for
     * generated segments in the window and queues generation for the missing ones.
     */
    public void onCursor(int index)
    {
        int evicted;
        synchronized (this)
        {
            if (closed)
            {
                return;
            }
            cursor = index;
            pending.removeIf(i -> !inWindow(i));
            evicted = table.evictBefore(index - trail);

            int last = Math.min(index + lookahead, progress.getTotalSegments() - 1);
            for (int i = Math.max(0, index); i <= last; i++)
            {
                Optional<Segment> generated = progress.getSegment(i);
                if (generated.isPresent())
                {
                    table.putIfAbsent(generated.get());
                }
                else if (i > index && !inFlight.contains(i) && !pending.contains(i))
                {
                    pending.addLast(i);
                }
            }
        }

        if (evicted > 0)
        {
            log.debug("Evicted {} segment(s) of {} behind {}", evicted, chapterId, index);
        }
        pump();
    }

    /**
     * Records a generated segment (first result wins) and buffers it if it falls in the window.
     *
     * @return true when this call recorded the index for the first time
     */
    public boolean offer(Segment segment)
    {
        boolean fresh = progress.markGenerated(segment);
        Segment winner = progress.getSegment(segment.getIndex()).orElse(segment);

        synchronized (this)
        {
            if (!closed && inWindow(segment.getIndex()))
            {
                table.putIfAbsent(winner);
            }
        }

        if (fresh)
        {
            try
            {
                onRecorded.accept(winner);
            }
            catch (RuntimeException e)
            {
                log.warn("Recording listener failed for {}#{}", chapterId, segment.getIndex(), e);
            }
        }
        return fresh;
    }

    /**
     * Replaces a buffered handle with an upgraded one. Segments outside the buffer are
     * left alone; they pick up the upgrade from progress when they re-enter the window.
     *
     * @return true when a buffered handle was replaced
     */
    public synchronized boolean applyUpgrade(Segment upgraded)
    {
        return !closed && table.replace(upgraded);
    }

    /**
     * Borrows the audio for {@code index}, generating it first on underrun. The caller
     * must release the handle.
     */
    public CompletableFuture<AudioHandle> acquire(int index)
    {
        Optional<AudioHandle> buffered = table.acquire(index);
        if (buffered.isPresent())
        {
            return CompletableFuture.completedFuture(buffered.get());
        }

        Optional<Segment> generated = progress.getSegment(index);
        if (generated.isPresent())
        {
            return CompletableFuture.completedFuture(install(generated.get()));
        }

        Optional<String> text = progress.segmentText(index);
        if (text.isEmpty())
        {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Segment " + index + " is not part of " + chapterId));
        }

        log.debug("Buffer underrun at {}#{}", chapterId, index);
        Segment base = Segment.of(index, text.get());
        return coordinator.generate(chapterId, base, fastConfig)
                .thenApply(audio ->
                {
                    offer(toSegment(base, audio));
                    return install(progress.getSegment(index).orElseThrow(IllegalStateException::new));
                });
    }

    /**
     * Drops queued prefetch requests that were not dispatched yet.
     */
    public synchronized void clearPending()
    {
        pending.clear();
    }

    /**
     * Releases every buffered handle and stops queuing. Outstanding borrows stay valid
     * until their holders release them.
     */
    public void close()
    {
        synchronized (this)
        {
            closed = true;
            pending.clear();
        }
        table.releaseAll();
    }

    public Set<Integer> bufferedIndices()
    {
        return table.indices();
    }

    public synchronized List<Integer> pendingIndices()
    {
        return Collections.unmodifiableList(new ArrayList<>(pending));
    }

    public synchronized Set<Integer> inFlightIndices()
    {
        return Collections.unmodifiableSet(new HashSet<>(inFlight));
    }

    int revokedCount()
    {
        return table.revokedCount();
    }

    private AudioHandle install(Segment segment)
    {
        synchronized (this)
        {
            table.putIfAbsent(segment);
            Optional<AudioHandle> h = table.acquire(segment.getIndex());
            if (h.isPresent())
            {
                return h.get();
            }
        }
        // Closed or already evicted: hand out a handle the caller alone owns.
        return new AudioHandle(segment, r -> log.debug("Revoked detached handle for segment {}", r.getIndex()));
    }

    private void pump()
    {
        List<Integer> dispatch = new ArrayList<>();
        synchronized (this)
        {
            while (!closed && inFlight.size() < concurrency && !pending.isEmpty())
            {
                int i = pending.pollFirst();
                Optional<Segment> generated = progress.getSegment(i);
                if (generated.isPresent())
                {
                    table.putIfAbsent(generated.get());
                    continue;
                }
                inFlight.add(i);
                dispatch.add(i);
            }
        }

        for (int i : dispatch)
        {
            prefetch(i);
        }
    }

    private void prefetch(int index)
    {
        Optional<String> text = progress.segmentText(index);
        if (text.isEmpty())
        {
            finishPrefetch(index);
            return;
        }

        Segment base = Segment.of(index, text.get());
        coordinator.generate(chapterId, base, fastConfig).whenComplete((audio, err) ->
        {
            if (err == null)
            {
                offer(toSegment(base, audio));
            }
            else
            {
                GenerationException e = GenerationErrors.normalize(err, null);
                if (e.isCancellation())
                {
                    log.debug("Prefetch of {}#{} cancelled", chapterId, index);
                }
                else
                {
                    log.warn("Prefetch of {}#{} failed: {}", chapterId, index, e.getMessage());
                }
            }
            finishPrefetch(index);
        });
    }

    private void finishPrefetch(int index)
    {
        synchronized (this)
        {
            inFlight.remove(index);
        }
        pump();
    }

    private Segment toSegment(Segment base, GeneratedAudio audio)
    {
        int produced = ladder.indexOf(audio.getTier());
        return audio.applyTo(base, produced < 0 ? fastTier : produced);
    }

    private boolean inWindow(int index)
    {
        return index >= cursor && index <= cursor + lookahead;
    }
}
