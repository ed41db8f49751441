package com.narrateplus.playback;

import com.narrateplus.NarratePlusConfig;
import com.narrateplus.chapter.ChapterProvider;
import com.narrateplus.generation.GenerationCoordinator;
import com.narrateplus.generation.GenerationErrors;
import com.narrateplus.generation.GenerationException;
import com.narrateplus.generation.PermanentGenerationException;
import com.narrateplus.model.Chapter;
import com.narrateplus.model.PlaybackCursor;
import com.narrateplus.model.Segment;
import com.narrateplus.model.TierLadder;
import com.narrateplus.progress.ChapterDurationTracker;
import com.narrateplus.progress.ChapterProgress;
import com.narrateplus.progress.ChapterProgressRegistry;
import com.narrateplus.quality.AdaptiveQualityScheduler;
import com.narrateplus.quality.TierLadderResolver;
import com.narrateplus.storage.SegmentStore;
import com.narrateplus.text.TextSegmenter;
import com.narrateplus.text.TextStats;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * The player: owns the cursor and answers the transport verbs.
 *
 * All state lives on a single player thread. Verbs are queued onto it and return a
 * future that completes once the verb was applied. Continuations of asynchronous
 * work carry the playback token current when they were started and are dropped when
 * a later verb bumped it.
 */
@Slf4j
@Singleton
public class PlaybackStateMachine
{
    private static final double MIN_SPEED = 0.25d;
    private static final double MAX_SPEED = 4.0d;

    private final ChapterProvider chapters;
    private final SegmentStore store;
    private final ChapterProgressRegistry registry;
    private final GenerationCoordinator coordinator;
    private final AdaptiveQualityScheduler scheduler;
    private final TierLadderResolver ladders;
    private final AudioOutput output;
    private final NarratePlusConfig config;

    private final ScheduledExecutorService loop;
    private final List<PlaybackListener> listeners = new CopyOnWriteArrayList<>();

    private volatile PlaybackState state = PlaybackState.STOPPED;
    private volatile PlaybackCursor cursor = PlaybackCursor.INITIAL;
    private volatile Session session;

    // player thread only
    private long playbackToken;
    private AudioHandle current;
    private boolean loadedInOutput;
    private volatile double speed = 1.0d;
    private ScheduledFuture<?> ticker;

    @Inject
    public PlaybackStateMachine(
            ChapterProvider chapters,
            SegmentStore store,
            ChapterProgressRegistry registry,
            GenerationCoordinator coordinator,
            AdaptiveQualityScheduler scheduler,
            TierLadderResolver ladders,
            AudioOutput output,
            NarratePlusConfig config)
    {
        this.chapters = chapters;
        this.store = store;
        this.registry = registry;
        this.coordinator = coordinator;
        this.scheduler = scheduler;
        this.ladders = ladders;
        this.output = output;
        this.config = config;

        this.loop = Executors.newSingleThreadScheduledExecutor(r ->
        {
            Thread t = new Thread(r, "narrateplus-playback");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(PlaybackListener listener)
    {
        listeners.add(listener);
    }

    public void removeListener(PlaybackListener listener)
    {
        listeners.remove(listener);
    }

    public PlaybackState getState()
    {
        return state;
    }

    public PlaybackCursor getCursor()
    {
        return cursor;
    }

    public double getSpeed()
    {
        return speed;
    }

    public String getChapterId()
    {
        Session s = session;
        return s == null ? null : s.chapter.getId();
    }

    public int getSegmentCount()
    {
        Session s = session;
        return s == null ? 0 : s.segmentCount;
    }

    /**
     * Position from the start of the chapter, using measured durations where known.
     */
    public double getChapterPositionSeconds()
    {
        Session s = session;
        PlaybackCursor c = cursor;
        if (s == null || c.getCurrentSegmentIndex() < 0)
        {
            return 0d;
        }
        return s.durations.startOffsetOf(c.getCurrentSegmentIndex()) + c.getCurrentTimeSeconds();
    }

    public double getChapterDurationSeconds()
    {
        Session s = session;
        return s == null ? 0d : s.durations.totalSeconds();
    }

    // --------------------
    // Transport verbs
    // --------------------

    public CompletableFuture<Void> loadChapter(String bookId, String chapterId, LoadOptions options)
    {
        return submit("load", () ->
        {
            Chapter chapter;
            try
            {
                chapter = chapters.getChapter(chapterId);
            }
            catch (IOException e)
            {
                throw new IllegalStateException("Cannot read chapter " + chapterId, e);
            }
            doLoad(bookId, chapter, options);
        });
    }

    public CompletableFuture<Void> loadChapter(String bookId, Chapter chapter, LoadOptions options)
    {
        return submit("load", () -> doLoad(bookId, chapter, options));
    }

    public CompletableFuture<Void> play()
    {
        return submit("play", this::doPlay);
    }

    public CompletableFuture<Void> pause()
    {
        return submit("pause", this::doPause);
    }

    public CompletableFuture<Void> toggle()
    {
        return submit("toggle", () ->
        {
            if (state == PlaybackState.PLAYING || state == PlaybackState.BUFFERING)
            {
                doPause();
            }
            else
            {
                doPlay();
            }
        });
    }

    /**
     * Moves to a segment. Keeps playing if the player was playing, otherwise stays paused there.
     */
    public CompletableFuture<Void> skipTo(int index)
    {
        return submit("skipTo", () -> doSkipTo(index));
    }

    public CompletableFuture<Void> seekToSegment(int index)
    {
        return skipTo(index);
    }

    public CompletableFuture<Void> skipNext()
    {
        return submit("skipNext", () ->
        {
            Session s = requireSession();
            int next = cursor.getCurrentSegmentIndex() + 1;
            if (next < s.segmentCount)
            {
                doSkipTo(next);
            }
        });
    }

    public CompletableFuture<Void> skipPrevious()
    {
        return submit("skipPrevious", () ->
        {
            requireSession();
            doSkipTo(Math.max(0, cursor.getCurrentSegmentIndex() - 1));
        });
    }

    public CompletableFuture<Void> setSpeed(double newSpeed)
    {
        return submit("setSpeed", () ->
        {
            if (!Double.isFinite(newSpeed) || newSpeed <= 0)
            {
                throw new IllegalArgumentException("Invalid playback speed: " + newSpeed);
            }
            speed = Math.max(MIN_SPEED, Math.min(MAX_SPEED, newSpeed));
            output.setSpeed(speed);
        });
    }

    /**
     * Stops playback and unloads the chapter: cancels its upgrade loop and fast pass,
     * cancels pending generation, releases every audio handle and clears its progress.
     */
    public CompletableFuture<Void> stop()
    {
        return submit("stop", () ->
        {
            unload();
            cursor = PlaybackCursor.INITIAL;
            publishCursor();
            setState(PlaybackState.STOPPED);
        });
    }

    public void shutdown()
    {
        try
        {
            stop().get(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        catch (Exception e)
        {
            log.warn("Player did not stop cleanly", e);
        }
        loop.shutdownNow();
        output.shutdown();
    }

    // --------------------
    // Player thread
    // --------------------

    private void doLoad(String bookId, Chapter chapter, LoadOptions options)
    {
        unload();
        setState(PlaybackState.LOADING);

        String chapterId = chapter.getId();
        List<Segment> stored = readStored(bookId, chapterId);

        List<Segment> segments = TextSegmenter.split(chapter.getText());
        ChapterProgress progress;
        if (!stored.isEmpty() && coversChapter(stored, segments))
        {
            segments = stored;
            progress = registry.loadFromStorage(chapterId, stored);
            log.info("Resuming {} from storage: {}/{} segments generated", chapterId,
                    progress.generatedCount(), progress.getTotalSegments());
        }
        else
        {
            progress = registry.init(chapterId, segments);
            int restored = 0;
            for (Segment st : stored)
            {
                if (st.hasAudio() && st.getIndex() < segments.size()
                        && segments.get(st.getIndex()).getText().equals(st.getText())
                        && progress.markGenerated(st))
                {
                    restored++;
                }
            }
            if (restored > 0)
            {
                log.info("Restored {} stored segment(s) of {}", restored, chapterId);
            }
        }

        if (segments.isEmpty())
        {
            log.info("Chapter {} has nothing to speak", chapterId);
            progress.markGenerationComplete();
            cursor = PlaybackCursor.INITIAL;
            publishCursor();
            setState(PlaybackState.ENDED);
            return;
        }

        TierLadder ladder = ladders.resolve(chapter.getLanguageOrDefault());
        int fastTier = scheduler.fastTier(ladder);
        if (fastTier < 0)
        {
            registry.clear(chapterId);
            fail(new PermanentGenerationException("No voice available for language " + chapter.getLanguageOrDefault()));
            return;
        }

        ChapterDurationTracker durations = new ChapterDurationTracker(segments, config.wordsPerMinute());
        Session s = new Session(bookId, chapter, durations, segments.size());
        s.buffer = new PlaybackBufferManager(chapterId, progress, coordinator, ladder, fastTier,
                config.lookaheadSegments(), config.evictionTrailSegments(), config.prefetchConcurrency(),
                seg -> onRecorded(s, seg));
        session = s;

        speed = Math.max(MIN_SPEED, Math.min(MAX_SPEED, options.getSpeed()));
        output.setSpeed(speed);

        int start = Math.max(0, Math.min(options.getStartSegmentIndex(), segments.size() - 1));
        cursor = new PlaybackCursor(start, 0d, durations.durationOf(start), false, false);
        publishCursor();
        publishDuration(s);

        log.info("Loaded chapter {} ({} segments, ~{})", chapterId, segments.size(),
                TextStats.formatDurationShort(durations.totalSeconds()));

        scheduler.startFastPass(chapterId, ladder, s.buffer::offer);
        scheduler.scheduleUpgradePass(bookId, chapterId, ladder,
                () -> cursor.getCurrentSegmentIndex(), seg -> onUpgraded(s, seg));

        if (options.isStartPlaying())
        {
            startSegment(start);
        }
        else
        {
            s.buffer.onCursor(start);
            setState(PlaybackState.PAUSED);
        }
    }

    private void doPlay()
    {
        Session s = requireSession();
        switch (state)
        {
            case PLAYING:
            case BUFFERING:
                return;
            case ENDED:
                startSegment(0);
                return;
            case PAUSED:
                if (loadedInOutput && current != null)
                {
                    output.resume();
                    cursor = cursor.withPlaying(true).withBuffering(false);
                    publishCursor();
                    setState(PlaybackState.PLAYING);
                    startTicker();
                    return;
                }
                break;
            default:
                break;
        }
        startSegment(Math.max(0, Math.min(cursor.getCurrentSegmentIndex(), s.segmentCount - 1)));
    }

    private void doPause()
    {
        Session s = session;
        if (state == PlaybackState.PLAYING)
        {
            output.pause();
            cursor = cursor.withPlaying(false).withCurrentTimeSeconds(output.positionSeconds());
        }
        else if (state == PlaybackState.BUFFERING)
        {
            // The segment keeps generating; only the wait for it is dropped.
            playbackToken++;
            cursor = cursor.withPlaying(false).withBuffering(false);
        }
        else
        {
            return;
        }

        stopTicker();
        if (s != null)
        {
            s.buffer.clearPending();
        }
        publishCursor();
        setState(PlaybackState.PAUSED);
    }

    private void doSkipTo(int index)
    {
        Session s = requireSession();
        if (index < 0 || index >= s.segmentCount)
        {
            throw new IllegalArgumentException("Segment " + index + " out of range 0.." + (s.segmentCount - 1));
        }

        boolean wasPlaying = state == PlaybackState.PLAYING || state == PlaybackState.BUFFERING;
        if (wasPlaying)
        {
            startSegment(index);
            return;
        }

        playbackToken++;
        stopTicker();
        output.stop();
        releaseCurrent();
        loadedInOutput = false;

        cursor = new PlaybackCursor(index, 0d, s.durations.durationOf(index), false, false);
        publishCursor();
        s.buffer.onCursor(index);
        scheduler.ensureUpgradePass(s.chapter.getId());
        setState(PlaybackState.PAUSED);
    }

    private void startSegment(int index)
    {
        Session s = requireSession();
        long token = ++playbackToken;

        stopTicker();
        output.stop();
        releaseCurrent();
        loadedInOutput = false;

        cursor = new PlaybackCursor(index, 0d, s.durations.durationOf(index), false, false);
        s.buffer.onCursor(index);
        scheduler.ensureUpgradePass(s.chapter.getId());

        CompletableFuture<AudioHandle> ready = s.buffer.acquire(index);
        if (!ready.isDone())
        {
            cursor = cursor.withBuffering(true);
            publishCursor();
            setState(PlaybackState.BUFFERING);
        }

        ready.whenComplete((handle, err) ->
        {
            if (!post(() -> onSegmentReady(token, index, handle, err)) && handle != null)
            {
                handle.release();
            }
        });
    }

    private void onSegmentReady(long token, int index, AudioHandle handle, Throwable err)
    {
        if (token != playbackToken)
        {
            if (handle != null)
            {
                handle.release();
            }
            return;
        }

        if (err != null)
        {
            GenerationException e = GenerationErrors.normalize(err, "Segment " + index);
            if (e.isCancellation())
            {
                log.debug("Wait for segment {} cancelled", index);
                return;
            }
            log.error("Segment {} of {} could not be generated", index, getChapterId(), e);
            fail(e);
            return;
        }

        try
        {
            output.start(handle, speed, () -> post(() -> onSegmentFinished(token, index)));
        }
        catch (RuntimeException e)
        {
            handle.release();
            log.error("Audio output failed for segment {}", index, e);
            fail(new PermanentGenerationException("Audio output failed for segment " + index, e));
            return;
        }

        current = handle;
        loadedInOutput = true;

        double duration = handle.getDurationSeconds() > 0 ? handle.getDurationSeconds() : cursor.getDurationSeconds();
        cursor = new PlaybackCursor(index, 0d, duration, true, false);
        publishCursor();
        setState(PlaybackState.PLAYING);
        startTicker();
    }

    private void onSegmentFinished(long token, int index)
    {
        if (token != playbackToken)
        {
            return;
        }

        Session s = session;
        releaseCurrent();
        loadedInOutput = false;

        int next = index + 1;
        if (s == null || next >= s.segmentCount)
        {
            stopTicker();
            cursor = cursor.withPlaying(false).withCurrentTimeSeconds(cursor.getDurationSeconds());
            publishCursor();
            setState(PlaybackState.ENDED);
            return;
        }
        startSegment(next);
    }

    private void onRecorded(Session s, Segment segment)
    {
        try
        {
            store.putSegment(s.bookId, s.chapter.getId(), segment);
        }
        catch (IOException | RuntimeException e)
        {
            log.warn("Failed to persist segment {}#{}", s.chapter.getId(), segment.getIndex(), e);
        }

        segment.getDurationSeconds().ifPresent(d -> s.durations.record(segment.getIndex(), d));
        scheduler.ensureUpgradePass(s.chapter.getId());
        post(() ->
        {
            if (session == s)
            {
                publishDuration(s);
            }
        });
    }

    private void onUpgraded(Session s, Segment upgraded)
    {
        post(() ->
        {
            if (session != s)
            {
                return;
            }

            upgraded.getDurationSeconds().ifPresent(d -> s.durations.record(upgraded.getIndex(), d));
            s.buffer.applyUpgrade(upgraded);
            publishDuration(s);

            if (current == null || current.getIndex() != upgraded.getIndex() || !loadedInOutput)
            {
                return;
            }

            // Playing or paused inside the upgraded segment: swap in place if the output can.
            AudioHandle fresh = s.buffer.acquire(upgraded.getIndex()).getNow(null);
            if (fresh == null || fresh.getQualityTier() <= current.getQualityTier())
            {
                if (fresh != null)
                {
                    fresh.release();
                }
                return;
            }

            if (output.swap(fresh))
            {
                releaseCurrent();
                current = fresh;
                log.debug("Hot-swapped segment {} to tier {}", upgraded.getIndex(), upgraded.getQualityTier());
            }
            else
            {
                fresh.release();
                log.debug("Swap of segment {} deferred to its next start", upgraded.getIndex());
            }
        });
    }

    private void unload()
    {
        playbackToken++;
        stopTicker();
        output.stop();
        releaseCurrent();
        loadedInOutput = false;

        Session s = session;
        session = null;
        if (s == null)
        {
            return;
        }

        String chapterId = s.chapter.getId();
        scheduler.cancelUpgrade(chapterId);
        scheduler.cancelFastPass(chapterId);
        s.buffer.close();
        coordinator.cancelAll();
        registry.clear(chapterId);
        log.info("Unloaded chapter {}", chapterId);
    }

    private void fail(GenerationException error)
    {
        playbackToken++;
        stopTicker();
        output.stop();
        releaseCurrent();
        loadedInOutput = false;

        cursor = cursor.withPlaying(false).withBuffering(false);
        publishCursor();
        setState(PlaybackState.ERROR);

        for (PlaybackListener l : listeners)
        {
            try
            {
                l.onError(error);
            }
            catch (RuntimeException e)
            {
                log.warn("Playback listener failed", e);
            }
        }
    }

    private void releaseCurrent()
    {
        if (current != null)
        {
            current.release();
            current = null;
        }
    }

    private void startTicker()
    {
        stopTicker();
        long interval = Math.max(10, config.positionReportIntervalMs());
        ticker = loop.scheduleAtFixedRate(() ->
        {
            if (state == PlaybackState.PLAYING)
            {
                cursor = cursor.withCurrentTimeSeconds(output.positionSeconds());
                publishCursor();
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void stopTicker()
    {
        if (ticker != null)
        {
            ticker.cancel(false);
            ticker = null;
        }
    }

    private Session requireSession()
    {
        Session s = session;
        if (s == null)
        {
            throw new IllegalStateException("No chapter loaded");
        }
        return s;
    }

    private List<Segment> readStored(String bookId, String chapterId)
    {
        try
        {
            return store.getSegments(bookId, chapterId);
        }
        catch (IOException | RuntimeException e)
        {
            log.warn("Failed to read stored segments of {}", chapterId, e);
            return Collections.emptyList();
        }
    }

    /**
     * Stored segments stand in for segmentation only when they are the same segments,
     * index for index.
     */
    private static boolean coversChapter(List<Segment> stored, List<Segment> segments)
    {
        if (stored.size() != segments.size())
        {
            return false;
        }
        for (int i = 0; i < stored.size(); i++)
        {
            Segment st = stored.get(i);
            if (st.getIndex() != i || !st.getText().equals(segments.get(i).getText()))
            {
                return false;
            }
        }
        return true;
    }

    private void setState(PlaybackState next)
    {
        if (state == next)
        {
            return;
        }
        log.debug("Playback {} -> {}", state, next);
        state = next;
        for (PlaybackListener l : listeners)
        {
            try
            {
                l.onStateChanged(next);
            }
            catch (RuntimeException e)
            {
                log.warn("Playback listener failed", e);
            }
        }
    }

    private void publishCursor()
    {
        PlaybackCursor c = cursor;
        for (PlaybackListener l : listeners)
        {
            try
            {
                l.onCursorChanged(c);
            }
            catch (RuntimeException e)
            {
                log.warn("Playback listener failed", e);
            }
        }
    }

    private void publishDuration(Session s)
    {
        double total = s.durations.totalSeconds();
        boolean exact = s.durations.isExact();
        for (PlaybackListener l : listeners)
        {
            try
            {
                l.onChapterDurationChanged(total, exact);
            }
            catch (RuntimeException e)
            {
                log.warn("Playback listener failed", e);
            }
        }
    }

    private CompletableFuture<Void> submit(String verb, Runnable action)
    {
        CompletableFuture<Void> done = new CompletableFuture<>();
        boolean queued = post(() ->
        {
            try
            {
                action.run();
                done.complete(null);
            }
            catch (RuntimeException e)
            {
                log.warn("Playback {} failed: {}", verb, e.getMessage());
                done.completeExceptionally(e);
            }
        });

        if (!queued)
        {
            done.completeExceptionally(new IllegalStateException("Player is shut down"));
        }
        return done;
    }

    private boolean post(Runnable task)
    {
        try
        {
            loop.execute(task);
            return true;
        }
        catch (RejectedExecutionException e)
        {
            log.debug("Player is shut down, dropping task");
            return false;
        }
    }

    private static final class Session
    {
        final String bookId;
        final Chapter chapter;
        final ChapterDurationTracker durations;
        final int segmentCount;
        PlaybackBufferManager buffer;

        Session(String bookId, Chapter chapter, ChapterDurationTracker durations, int segmentCount)
        {
            this.bookId = bookId;
            this.chapter = chapter;
            this.durations = durations;
            this.segmentCount = segmentCount;
        }
    }
}
