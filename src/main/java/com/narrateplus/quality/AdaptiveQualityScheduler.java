package com.narrateplus.quality;

import com.narrateplus.NarratePlusConfig;
import com.narrateplus.generation.GeneratedAudio;
import com.narrateplus.generation.GenerationCoordinator;
import com.narrateplus.generation.GenerationErrors;
import com.narrateplus.generation.GenerationException;
import com.narrateplus.generation.PermanentGenerationException;
import com.narrateplus.model.Segment;
import com.narrateplus.model.TierConfig;
import com.narrateplus.model.TierLadder;
import com.narrateplus.progress.ChapterProgress;
import com.narrateplus.progress.ChapterProgressRegistry;
import com.narrateplus.resource.ResourceMonitor;
import com.narrateplus.storage.SegmentStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Two-pass generation per chapter.
 *
 * The fast pass generates every missing segment in order at the lowest usable tier.
 * The upgrade loop then re-generates segments one tier at a time, on a timer, while
 * the host has headroom, until every candidate sits at the device's target tier.
 */
@Slf4j
@Singleton
public class AdaptiveQualityScheduler
{
    public enum TickOutcome
    {
        CANCELLED,
        SKIPPED,
        UPGRADED,
        FAILED,
        EXHAUSTED
    }

    private final GenerationCoordinator coordinator;
    private final ResourceMonitor resources;
    private final ChapterProgressRegistry progress;
    private final SegmentStore store;
    private final ScheduledExecutorService scheduler;
    private final NarratePlusConfig config;

    private final Map<String, FastPass> fastPasses = new ConcurrentHashMap<>();
    private final Map<String, UpgradeLoop> upgradeLoops = new ConcurrentHashMap<>();

    @Inject
    public AdaptiveQualityScheduler(
            GenerationCoordinator coordinator,
            ResourceMonitor resources,
            ChapterProgressRegistry progress,
            SegmentStore store,
            ScheduledExecutorService scheduler,
            NarratePlusConfig config)
    {
        this.coordinator = coordinator;
        this.resources = resources;
        this.progress = progress;
        this.store = store;
        this.scheduler = scheduler;
        this.config = config;
    }

    /**
     * Lowest usable tier of a ladder, or -1 when it has no voices at all.
     */
    public int fastTier(TierLadder ladder)
    {
        return ladder.walkUp(resources.startingTier());
    }

    // --------------------
    // Fast pass
    // --------------------

    /**
     * Generates every not-yet-generated segment of the chapter in index order and hands
     * each result to {@code sink} as soon as it is ready. Failures are logged and skipped.
     *
     * @return completes when the pass has visited every segment or was cancelled
     */
    public CompletableFuture<Void> startFastPass(String chapterId, TierLadder ladder, Consumer<Segment> sink)
    {
        cancelFastPass(chapterId);

        ChapterProgress p = progress.get(chapterId)
                .orElseThrow(() -> new IllegalStateException("No progress for chapter " + chapterId));

        int tier = fastTier(ladder);
        if (tier < 0)
        {
            return CompletableFuture.failedFuture(
                    new PermanentGenerationException("No voice available for chapter " + chapterId));
        }

        FastPass pass = new FastPass(chapterId, p, tier, ladder, sink);
        fastPasses.put(chapterId, pass);
        p.setGenerating(true);
        log.info("Fast pass for {} at tier {} ({} segments, {} already generated)",
                chapterId, tier, p.getTotalSegments(), p.generatedCount());

        pass.next(0);
        return pass.done;
    }

    public void cancelFastPass(String chapterId)
    {
        FastPass pass = fastPasses.remove(chapterId);
        if (pass != null)
        {
            pass.cancelled = true;
            pass.done.complete(null);
        }
    }

    public boolean isFastPassActive(String chapterId)
    {
        FastPass pass = fastPasses.get(chapterId);
        return pass != null && !pass.done.isDone();
    }

    private final class FastPass
    {
        final String chapterId;
        final ChapterProgress chapter;
        final int tier;
        final TierLadder ladder;
        final Consumer<Segment> sink;
        final List<Segment> segments;
        final CompletableFuture<Void> done = new CompletableFuture<>();
        volatile boolean cancelled;

        FastPass(String chapterId, ChapterProgress chapter, int tier, TierLadder ladder, Consumer<Segment> sink)
        {
            this.chapterId = chapterId;
            this.chapter = chapter;
            this.tier = tier;
            this.ladder = ladder;
            this.sink = sink;
            this.segments = chapter.segments();
        }

        /**
         * Walks forward from {@code from}. Results that are already complete are settled
         * in this loop; the walk only leaves it to wait on a pending generation and comes
         * back through {@link #next} when that one lands.
         */
        void next(int from)
        {
            TierConfig cfg = ladder.tier(tier).orElseThrow(IllegalStateException::new);
            int i = from;
            while (true)
            {
                while (i < segments.size() && chapter.isGenerated(segments.get(i).getIndex()))
                {
                    i++;
                }

                if (cancelled)
                {
                    return;
                }
                if (i >= segments.size())
                {
                    finish();
                    return;
                }

                Segment base = segments.get(i);
                int following = i + 1;

                CompletableFuture<Boolean> step = coordinator.generate(chapterId, base, cfg)
                        .handle((audio, err) -> settle(base, audio, err));
                if (!step.isDone())
                {
                    step.thenAccept(proceed ->
                    {
                        if (proceed)
                        {
                            next(following);
                        }
                    });
                    return;
                }
                if (!step.join())
                {
                    return;
                }
                i = following;
            }
        }

        /**
         * @return whether the walk goes on to the next segment
         */
        private boolean settle(Segment base, GeneratedAudio audio, Throwable err)
        {
            if (cancelled)
            {
                return false;
            }

            if (err != null)
            {
                GenerationException e = GenerationErrors.normalize(err, null);
                if (e.isCancellation())
                {
                    log.debug("Fast pass for {} stopped at segment {}", chapterId, base.getIndex());
                    finish();
                    return false;
                }
                log.warn("Fast pass skipped segment {} of {}: {}", base.getIndex(), chapterId, e.getMessage());
            }
            else
            {
                deliver(base, audio);
            }
            return true;
        }

        private void deliver(Segment base, GeneratedAudio audio)
        {
            int produced = ladder.indexOf(audio.getTier());
            try
            {
                sink.accept(audio.applyTo(base, produced < 0 ? tier : produced));
            }
            catch (RuntimeException e)
            {
                log.warn("Fast pass consumer failed for segment {} of {}", base.getIndex(), chapterId, e);
            }
        }

        private void finish()
        {
            fastPasses.remove(chapterId, this);
            chapter.markGenerationComplete();
            if (!cancelled)
            {
                log.info("Fast pass for {} complete: {}/{} segments", chapterId,
                        chapter.generatedCount(), chapter.getTotalSegments());
            }
            done.complete(null);
        }
    }

    // --------------------
    // Upgrade loop
    // --------------------

    /**
     * Starts the background upgrade loop for a chapter, replacing any loop already
     * running for it. The first tick runs after the configured initial delay.
     *
     * @param cursor current playback index, read on every tick
     * @param onUpgraded receives each segment after it was upgraded and persisted
     * @return false when the device target is not above the fast tier, so there is nothing to do
     */
    public boolean scheduleUpgradePass(String bookId, String chapterId, TierLadder ladder,
                                       IntSupplier cursor, Consumer<Segment> onUpgraded)
    {
        cancelUpgrade(chapterId);

        int fast = fastTier(ladder);
        int target = ladder.walkDown(resources.targetTier());
        if (fast < 0 || target <= fast)
        {
            log.info("No upgrade pass for {}: target tier {} is not above fast tier {}", chapterId, target, fast);
            return false;
        }

        UpgradeLoop loop = new UpgradeLoop(bookId, chapterId, ladder, target, cursor, onUpgraded);
        upgradeLoops.put(chapterId, loop);
        log.info("Upgrade pass for {} scheduled, target tier {}", chapterId, target);
        loop.schedule(config.upgradeInitialDelayMs());
        return true;
    }

    /**
     * Stops the chapter's upgrade loop. Safe to call repeatedly or when none is running.
     */
    public void cancelUpgrade(String chapterId)
    {
        UpgradeLoop loop = upgradeLoops.remove(chapterId);
        if (loop != null)
        {
            loop.cancel();
            log.debug("Upgrade pass for {} cancelled", chapterId);
        }
    }

    public boolean isUpgradeActive(String chapterId)
    {
        UpgradeLoop loop = upgradeLoops.get(chapterId);
        return loop != null && !loop.cancelled && !loop.exhausted;
    }

    /**
     * Restarts an exhausted loop; new candidates appear as the cursor moves and as
     * first generations land.
     */
    public void ensureUpgradePass(String chapterId)
    {
        UpgradeLoop loop = upgradeLoops.get(chapterId);
        if (loop != null)
        {
            loop.resumeIfExhausted();
        }
    }

    /**
     * Runs one tick now, outside the timer.
     */
    CompletableFuture<TickOutcome> tickNow(String chapterId)
    {
        UpgradeLoop loop = upgradeLoops.get(chapterId);
        return loop == null ? CompletableFuture.completedFuture(TickOutcome.CANCELLED) : loop.tick();
    }

    List<Integer> upgradeCandidates(String chapterId)
    {
        UpgradeLoop loop = upgradeLoops.get(chapterId);
        if (loop == null)
        {
            return new ArrayList<>();
        }
        return progress.get(chapterId)
                .map(p -> loop.candidates(p, loop.cursor.getAsInt()))
                .orElseGet(ArrayList::new);
    }

    private final class UpgradeLoop
    {
        final String bookId;
        final String chapterId;
        final TierLadder ladder;
        final int targetTier;
        final IntSupplier cursor;
        final Consumer<Segment> onUpgraded;
        final Set<Integer> failed = ConcurrentHashMap.newKeySet();

        volatile boolean cancelled;
        volatile boolean exhausted;

        // guarded by this
        private ScheduledFuture<?> timer;
        private boolean ticking;

        UpgradeLoop(String bookId, String chapterId, TierLadder ladder, int targetTier,
                    IntSupplier cursor, Consumer<Segment> onUpgraded)
        {
            this.bookId = bookId;
            this.chapterId = chapterId;
            this.ladder = ladder;
            this.targetTier = targetTier;
            this.cursor = cursor;
            this.onUpgraded = onUpgraded;
        }

        synchronized void schedule(long delayMs)
        {
            if (cancelled || ticking)
            {
                return;
            }
            try
            {
                timer = scheduler.schedule(this::run, delayMs, TimeUnit.MILLISECONDS);
            }
            catch (RejectedExecutionException e)
            {
                log.debug("Upgrade pass for {} not rescheduled, executor shut down", chapterId);
            }
        }

        synchronized void cancel()
        {
            cancelled = true;
            if (timer != null)
            {
                timer.cancel(false);
                timer = null;
            }
        }

        void resumeIfExhausted()
        {
            synchronized (this)
            {
                if (!exhausted || cancelled)
                {
                    return;
                }
                exhausted = false;
            }
            schedule(config.upgradeTickMs());
        }

        private void run()
        {
            synchronized (this)
            {
                if (cancelled)
                {
                    return;
                }
                timer = null;
                ticking = true;
            }

            tick().whenComplete((outcome, err) ->
            {
                synchronized (this)
                {
                    ticking = false;
                }
                if (err != null)
                {
                    log.warn("Upgrade tick for {} failed", chapterId, err);
                }
                // An exhausted loop may have been resumed while this tick ran.
                if (outcome == TickOutcome.CANCELLED || (outcome == TickOutcome.EXHAUSTED && exhausted))
                {
                    return;
                }
                schedule(config.upgradeTickMs());
            });
        }

        CompletableFuture<TickOutcome> tick()
        {
            if (cancelled)
            {
                return CompletableFuture.completedFuture(TickOutcome.CANCELLED);
            }

            if (!resources.canRunUpgradeNow())
            {
                log.debug("Upgrade tick for {} skipped, host busy", chapterId);
                return CompletableFuture.completedFuture(TickOutcome.SKIPPED);
            }

            Optional<ChapterProgress> chapter = progress.get(chapterId);
            if (chapter.isEmpty())
            {
                return CompletableFuture.completedFuture(TickOutcome.CANCELLED);
            }

            ChapterProgress p = chapter.get();
            List<Integer> candidates = candidates(p, cursor.getAsInt());
            if (candidates.isEmpty())
            {
                exhausted = true;
                log.info("Upgrade pass for {} complete", chapterId);
                return CompletableFuture.completedFuture(TickOutcome.EXHAUSTED);
            }

            int index = candidates.get(0);
            int current = p.qualityOf(index);
            int next = ladder.walkUp(current + 1);
            Optional<String> text = p.segmentText(index);
            if (next < 0 || next > targetTier || text.isEmpty())
            {
                failed.add(index);
                return CompletableFuture.completedFuture(TickOutcome.FAILED);
            }

            Segment base = Segment.of(index, text.get());
            TierConfig cfg = ladder.tier(next).orElseThrow(IllegalStateException::new);
            log.debug("Upgrading {}#{} from tier {} to {}", chapterId, index, current, next);

            return coordinator.generate(chapterId, base, cfg)
                    .handle((audio, err) -> apply(p, base, current, audio, err));
        }

        private TickOutcome apply(ChapterProgress p, Segment base, int fromTier, GeneratedAudio audio, Throwable err)
        {
            int index = base.getIndex();
            if (cancelled)
            {
                return TickOutcome.CANCELLED;
            }

            if (err != null)
            {
                GenerationException e = GenerationErrors.normalize(err, null);
                if (e.isCancellation())
                {
                    return TickOutcome.CANCELLED;
                }
                if (!e.isRetryable())
                {
                    failed.add(index);
                }
                log.warn("Upgrade of {}#{} failed: {}", chapterId, index, e.getMessage());
                return TickOutcome.FAILED;
            }

            int produced = ladder.indexOf(audio.getTier());
            if (produced <= fromTier)
            {
                // Joined a lower-tier request for the same segment.
                log.debug("Upgrade of {}#{} produced tier {}, still at {}", chapterId, index, produced, fromTier);
                return TickOutcome.SKIPPED;
            }

            Segment upgraded = audio.applyTo(base, produced);
            if (!p.replaceUpgraded(upgraded))
            {
                return TickOutcome.SKIPPED;
            }

            try
            {
                store.putSegment(bookId, chapterId, upgraded);
            }
            catch (IOException | RuntimeException e)
            {
                log.warn("Failed to persist upgraded segment {}#{}", chapterId, index, e);
            }

            try
            {
                onUpgraded.accept(upgraded);
            }
            catch (RuntimeException e)
            {
                log.warn("Upgrade listener failed for {}#{}", chapterId, index, e);
            }

            log.debug("Segment {}#{} upgraded to tier {}", chapterId, index, produced);
            return TickOutcome.UPGRADED;
        }

        /**
         * Upcoming segments within the horizon in ascending order, then played segments
         * most recent first. Ungenerated, failed and on-target segments are left out.
         */
        List<Integer> candidates(ChapterProgress p, int cur)
        {
            List<Integer> out = new ArrayList<>();
            int total = p.getTotalSegments();
            int horizon = Math.max(0, config.upgradeHorizonSegments());

            for (int i = Math.max(0, cur + 1); i <= cur + horizon && i < total; i++)
            {
                if (eligible(p, i))
                {
                    out.add(i);
                }
            }

            if (config.upgradePlayedSegments())
            {
                for (int i = Math.min(cur, total) - 1; i >= 0; i--)
                {
                    if (eligible(p, i))
                    {
                        out.add(i);
                    }
                }
            }
            return out;
        }

        private boolean eligible(ChapterProgress p, int index)
        {
            return p.isGenerated(index) && p.qualityOf(index) < targetTier && !failed.contains(index);
        }
    }
}
