package com.narrateplus.generation;

import com.narrateplus.NarratePlusConfig;
import com.narrateplus.model.Segment;
import com.narrateplus.model.TierConfig;
import com.narrateplus.progress.ChapterProgressRegistry;
import com.narrateplus.tts.SpeechEngine;
import com.narrateplus.tts.SpeechEngineFactory;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches single segments to the speech engine.
 *
 * At most one request is in flight per (chapter, index); later callers share the
 * pending result. Each dispatch has a time budget, retryable failures are retried
 * with backoff, and memory failures replace the engine before the next attempt.
 */
@Slf4j
@Singleton
public class GenerationCoordinator
{
    private final SpeechEngineFactory engineFactory;
    private final ScheduledExecutorService scheduler;
    private final ChapterProgressRegistry progress;
    private final RetryPolicy retryPolicy;
    private final long timeoutMs;
    private final int maxInFlight;

    private final Object lock = new Object();

    // guarded by lock
    private final Map<SegmentKey, Request> inFlight = new HashMap<>();
    private SpeechEngine engine;
    private CompletableFuture<SpeechEngine> restart;

    private final AtomicLong dispatchCount = new AtomicLong();
    private final AtomicInteger restartCount = new AtomicInteger();

    @Inject
    public GenerationCoordinator(
            SpeechEngineFactory engineFactory,
            ScheduledExecutorService scheduler,
            ChapterProgressRegistry progress,
            RetryPolicy retryPolicy,
            NarratePlusConfig config)
    {
        this.engineFactory = engineFactory;
        this.scheduler = scheduler;
        this.progress = progress;
        this.retryPolicy = retryPolicy;
        this.timeoutMs = Math.max(1, config.requestTimeoutMs());
        this.maxInFlight = Math.max(1, config.maxInFlightRequests());
    }

    /**
     * Generates audio for one segment.
     *
     * The returned future fails with a {@link GenerationException}: rejected when the
     * in-flight ceiling is reached, cancelled after {@link #cancelAll()}, otherwise the
     * normalized last failure.
     */
    public CompletableFuture<GeneratedAudio> generate(String chapterId, Segment segment, TierConfig tier)
    {
        SegmentKey key = new SegmentKey(chapterId, segment.getIndex());
        Request req;

        synchronized (lock)
        {
            Request existing = inFlight.get(key);
            if (existing != null)
            {
                log.debug("Joining in-flight generation of {}", key);
                return existing.result.copy();
            }

            if (inFlight.size() >= maxInFlight)
            {
                log.warn("Rejecting generation of {}: {} requests in flight", key, inFlight.size());
                return CompletableFuture.failedFuture(new GenerationRejectedException(maxInFlight));
            }

            req = new Request(key, segment.getText(), tier);
            inFlight.put(key, req);
        }

        attempt(req);
        return req.result.copy();
    }

    /**
     * Fails every pending request as cancelled before returning and discards the
     * current engine. Nothing cancelled here is retried.
     */
    public void cancelAll()
    {
        List<Request> pending;
        SpeechEngine old;

        synchronized (lock)
        {
            pending = new ArrayList<>(inFlight.values());
            inFlight.clear();
            old = engine;
            engine = null;
        }

        for (Request r : pending)
        {
            Future<?> t = r.timer;
            if (t != null)
            {
                t.cancel(false);
            }
            progress.get(r.key.getChapterId()).ifPresent(p -> p.clearProcessingIndex(r.key.getIndex()));
            r.result.completeExceptionally(new GenerationCancelledException("Generation of " + r.key + " cancelled"));
        }

        if (!pending.isEmpty())
        {
            log.debug("Cancelled {} pending generation requests", pending.size());
        }

        if (old != null)
        {
            shutdownQuietly(old);
        }
    }

    public int inFlightCount()
    {
        synchronized (lock)
        {
            return inFlight.size();
        }
    }

    public boolean isInFlight(String chapterId, int index)
    {
        synchronized (lock)
        {
            return inFlight.containsKey(new SegmentKey(chapterId, index));
        }
    }

    /**
     * Engine dispatches issued so far, retries included.
     */
    public long getDispatchCount()
    {
        return dispatchCount.get();
    }

    /**
     * Engine replacements triggered by memory failures.
     */
    public int getRestartCount()
    {
        return restartCount.get();
    }

    private void attempt(Request req)
    {
        if (req.result.isDone())
        {
            return;
        }

        CompletableFuture<SpeechEngine> ready;
        try
        {
            synchronized (lock)
            {
                ready = restart != null ? restart : CompletableFuture.completedFuture(currentEngineLocked());
            }
        }
        catch (RuntimeException e)
        {
            complete(req, null, GenerationErrors.normalize(e, "Speech engine unavailable"));
            return;
        }

        ready.whenComplete((eng, err) ->
        {
            if (err != null)
            {
                handleFailure(req, null, err, req.attempts);
                return;
            }
            dispatch(req, eng);
        });
    }

    private void dispatch(Request req, SpeechEngine eng)
    {
        if (req.result.isDone())
        {
            return;
        }

        int attempt = ++req.attempts;
        dispatchCount.incrementAndGet();
        progress.get(req.key.getChapterId()).ifPresent(p -> p.setProcessingIndex(req.key.getIndex()));

        CompletableFuture<byte[]> call;
        try
        {
            call = eng.synthesize(req.text, req.tier);
        }
        catch (RuntimeException e)
        {
            call = CompletableFuture.failedFuture(e);
        }

        final CompletableFuture<byte[]> pending = call;
        // Engines abandon the request behind a future failed here.
        ScheduledFuture<?> timeout = scheduler.schedule(
                () -> pending.completeExceptionally(
                        new GenerationTimeoutException("Generation of " + req.key + " timed out", timeoutMs)),
                timeoutMs, TimeUnit.MILLISECONDS);
        req.timer = timeout;

        pending.whenComplete((bytes, err) ->
        {
            timeout.cancel(false);
            if (req.result.isDone())
            {
                return;
            }

            if (err != null)
            {
                handleFailure(req, eng, err, attempt);
            }
            else if (bytes == null || bytes.length == 0)
            {
                handleFailure(req, eng, new TransientGenerationException("Engine returned no audio"), attempt);
            }
            else
            {
                complete(req, new GeneratedAudio(bytes, req.tier, attempt), null);
            }
        });
    }

    private void handleFailure(Request req, SpeechEngine failedEngine, Throwable raw, int attempt)
    {
        GenerationException error = GenerationErrors.normalize(raw, "Generation of " + req.key);

        if (!error.isRetryable() || !retryPolicy.allowsRetryAfter(attempt))
        {
            if (!error.isCancellation())
            {
                log.warn("Generation of {} failed after {} attempt(s): {}", req.key, attempt, error.getMessage());
            }
            complete(req, null, error);
            return;
        }

        long delay = retryPolicy.delayAfter(attempt);
        log.warn("Generation of {} failed (attempt {}/{}), retrying in {}ms: {}",
                req.key, attempt, retryPolicy.getMaxRetries() + 1, delay, error.getMessage());

        if (failedEngine != null && GenerationErrors.isMemoryError(raw))
        {
            restartEngine(failedEngine);
        }

        try
        {
            req.timer = scheduler.schedule(() -> attempt(req), delay, TimeUnit.MILLISECONDS);
        }
        catch (RejectedExecutionException e)
        {
            complete(req, null, new GenerationCancelledException("Generation of " + req.key + " cancelled", e));
        }
    }

    /**
     * Replaces {@code failed} with a fresh engine. Concurrent callers share one restart,
     * and a caller whose engine was already replaced triggers nothing.
     */
    CompletableFuture<SpeechEngine> restartEngine(SpeechEngine failed)
    {
        CompletableFuture<SpeechEngine> pending;
        synchronized (lock)
        {
            if (restart != null)
            {
                return restart;
            }
            if (engine != failed)
            {
                return CompletableFuture.completedFuture(currentEngineLocked());
            }
            pending = new CompletableFuture<>();
            restart = pending;
        }

        restartCount.incrementAndGet();
        log.info("Restarting speech engine after memory failure");

        scheduler.execute(() ->
        {
            SpeechEngine fresh;
            try
            {
                fresh = engineFactory.create();
            }
            catch (RuntimeException e)
            {
                log.warn("Speech engine restart failed", e);
                synchronized (lock)
                {
                    restart = null;
                }
                pending.completeExceptionally(e);
                return;
            }

            SpeechEngine old;
            synchronized (lock)
            {
                old = engine;
                engine = fresh;
                restart = null;
            }

            if (old != null)
            {
                shutdownQuietly(old);
            }
            pending.complete(fresh);
        });

        return pending;
    }

    private SpeechEngine currentEngineLocked()
    {
        if (engine == null)
        {
            engine = engineFactory.create();
        }
        return engine;
    }

    private void complete(Request req, GeneratedAudio value, GenerationException error)
    {
        synchronized (lock)
        {
            inFlight.remove(req.key, req);
        }
        progress.get(req.key.getChapterId()).ifPresent(p -> p.clearProcessingIndex(req.key.getIndex()));

        if (error != null)
        {
            req.result.completeExceptionally(error);
        }
        else
        {
            req.result.complete(value);
        }
    }

    private static void shutdownQuietly(SpeechEngine e)
    {
        try
        {
            e.shutdown();
        }
        catch (RuntimeException ex)
        {
            log.warn("Speech engine shutdown failed", ex);
        }
    }

    private static final class Request
    {
        final SegmentKey key;
        final String text;
        final TierConfig tier;
        final CompletableFuture<GeneratedAudio> result = new CompletableFuture<>();

        // Attempts run one after another, never concurrently.
        volatile int attempts;
        volatile Future<?> timer;

        Request(SegmentKey key, String text, TierConfig tier)
        {
            this.key = key;
            this.text = text;
            this.tier = tier;
        }
    }
}
