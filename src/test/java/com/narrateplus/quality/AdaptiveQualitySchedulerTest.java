package com.narrateplus.quality;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.narrateplus.NarratePlusConfig;
import com.narrateplus.TestConfigs;
import com.narrateplus.generation.GenerationCoordinator;
import com.narrateplus.generation.PermanentGenerationException;
import com.narrateplus.generation.RetryPolicy;
import com.narrateplus.model.ExecutionDevice;
import com.narrateplus.model.Quantization;
import com.narrateplus.model.Segment;
import com.narrateplus.model.TierConfig;
import com.narrateplus.model.TierLadder;
import com.narrateplus.progress.ChapterProgress;
import com.narrateplus.progress.ChapterProgressRegistry;
import com.narrateplus.quality.AdaptiveQualityScheduler.TickOutcome;
import com.narrateplus.resource.FixedHostResources;
import com.narrateplus.resource.ResourceMonitor;
import com.narrateplus.storage.InMemorySegmentStore;
import com.narrateplus.text.TextSegmenter;
import com.narrateplus.tts.NoopSpeechEngine;
import com.narrateplus.tts.ScriptedSpeechEngine;
import com.narrateplus.tts.StubEngineFactory;
import com.narrateplus.tts.Wav;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class AdaptiveQualitySchedulerTest
{
    private static final TierConfig Q4 = TierConfig.kokoro("af_heart", Quantization.Q4, ExecutionDevice.CPU);

    private static final TierLadder LADDER = new TierLadder(Arrays.asList(
            TierConfig.systemVoice(),
            Q4,
            TierConfig.kokoro("af_heart", Quantization.Q8, ExecutionDevice.CPU),
            TierConfig.kokoro("af_heart", Quantization.FP16, ExecutionDevice.AUTO)));

    private static final String TWELVE = "S0. S1. S2. S3. S4. S5. S6. S7. S8. S9. S10. S11.";

    private ScheduledExecutorService executor;
    private ChapterProgressRegistry registry;
    private InMemorySegmentStore store;
    private ScriptedSpeechEngine engine;
    private FixedHostResources host;

    @Before
    public void setUp()
    {
        executor = Executors.newScheduledThreadPool(2);
        registry = new ChapterProgressRegistry();
        store = new InMemorySegmentStore();
        engine = ScriptedSpeechEngine.succeeding();
        // 6 GB: medium device, target tier 2.
        host = FixedHostResources.withMemory(6);
    }

    @After
    public void tearDown()
    {
        executor.shutdownNow();
    }

    private AdaptiveQualityScheduler scheduler(String... config)
    {
        List<String> kv = new ArrayList<>(Arrays.asList(
                "upgradeInitialDelayMs", "600000",
                "upgradeTickMs", "600000"));
        Collections.addAll(kv, config);
        NarratePlusConfig cfg = TestConfigs.with(kv.toArray(new String[0]));

        GenerationCoordinator coordinator = new GenerationCoordinator(new StubEngineFactory(engine), executor,
                registry, new RetryPolicy(0, 10, 10, 2.0), cfg);
        return new AdaptiveQualityScheduler(coordinator, new ResourceMonitor(host, cfg), registry, store, executor, cfg);
    }

    private static String sentences(int count)
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++)
        {
            sb.append("S").append(i).append(". ");
        }
        return sb.toString();
    }

    private static Segment generated(ChapterProgress progress, int index, int tier)
    {
        Segment s = Segment.of(index, progress.segmentText(index).get()).withAudio(Wav.silence(0.5), tier, 0.5);
        progress.markGenerated(s);
        return s;
    }

    @Test
    public void tickUpgradesOneTierAtATime() throws Exception
    {
        AdaptiveQualityScheduler scheduler = scheduler();
        ChapterProgress progress = registry.init("ch", TextSegmenter.split("A. B. C. D. E."));
        generated(progress, 2, 0);

        List<Segment> upgraded = Collections.synchronizedList(new ArrayList<>());
        assertTrue(scheduler.scheduleUpgradePass("book", "ch", LADDER, () -> 0, upgraded::add));

        assertEquals(TickOutcome.UPGRADED, scheduler.tickNow("ch").get(5, TimeUnit.SECONDS));
        assertEquals(1, progress.qualityOf(2));
        assertEquals(Q4, engine.requestedTiers().get(0));
        assertEquals(1, upgraded.size());
        assertEquals(1, upgraded.get(0).getQualityTier());
        assertEquals(1, store.getSegments("book", "ch").get(0).getQualityTier());

        assertEquals(TickOutcome.UPGRADED, scheduler.tickNow("ch").get(5, TimeUnit.SECONDS));
        assertEquals(2, progress.qualityOf(2));

        assertEquals(TickOutcome.EXHAUSTED, scheduler.tickNow("ch").get(5, TimeUnit.SECONDS));
        assertFalse(scheduler.isUpgradeActive("ch"));
        assertEquals(2, engine.requestCount());
    }

    @Test
    public void upcomingSegmentsComeBeforePlayedOnes()
    {
        AdaptiveQualityScheduler scheduler = scheduler();
        ChapterProgress progress = registry.init("ch", TextSegmenter.split(TWELVE));
        for (int i = 0; i < 12; i++)
        {
            generated(progress, i, 0);
        }
        progress.replaceUpgraded(Segment.of(8, "S8.").withAudio(Wav.silence(0.5), 2, 0.5));

        scheduler.scheduleUpgradePass("book", "ch", LADDER, () -> 5, s -> { });

        assertEquals(Arrays.asList(6, 7, 9, 10, 11, 4, 3, 2, 1, 0), scheduler.upgradeCandidates("ch"));
    }

    @Test
    public void playedSegmentsCanBeLeftAlone()
    {
        AdaptiveQualityScheduler scheduler = scheduler("upgradePlayedSegments", "false", "upgradeHorizonSegments", "3");
        ChapterProgress progress = registry.init("ch", TextSegmenter.split(TWELVE));
        for (int i = 0; i < 12; i++)
        {
            generated(progress, i, 0);
        }

        scheduler.scheduleUpgradePass("book", "ch", LADDER, () -> 5, s -> { });

        assertEquals(Arrays.asList(6, 7, 8), scheduler.upgradeCandidates("ch"));
    }

    @Test
    public void busyHostSkipsTheTick() throws Exception
    {
        host.memoryGb = 2d;
        AdaptiveQualityScheduler scheduler = scheduler();
        ChapterProgress progress = registry.init("ch", TextSegmenter.split("A. B. C."));
        generated(progress, 1, 0);

        assertTrue(scheduler.scheduleUpgradePass("book", "ch", LADDER, () -> 0, s -> { }));

        assertEquals(TickOutcome.SKIPPED, scheduler.tickNow("ch").get(5, TimeUnit.SECONDS));
        assertEquals(0, engine.requestCount());
        assertEquals(0, progress.qualityOf(1));
        assertTrue(scheduler.isUpgradeActive("ch"));
    }

    @Test
    public void permanentUpgradeFailureDropsTheCandidate() throws Exception
    {
        engine.thenFail(new PermanentGenerationException("voice missing"));
        AdaptiveQualityScheduler scheduler = scheduler();
        ChapterProgress progress = registry.init("ch", TextSegmenter.split("A. B. C."));
        generated(progress, 1, 0);
        scheduler.scheduleUpgradePass("book", "ch", LADDER, () -> 0, s -> { });

        assertEquals(TickOutcome.FAILED, scheduler.tickNow("ch").get(5, TimeUnit.SECONDS));
        assertEquals(0, progress.qualityOf(1));
        assertEquals(TickOutcome.EXHAUSTED, scheduler.tickNow("ch").get(5, TimeUnit.SECONDS));
    }

    @Test
    public void cancelUpgradeIsIdempotent() throws Exception
    {
        AdaptiveQualityScheduler scheduler = scheduler();
        scheduler.cancelUpgrade("nothing-running");

        ChapterProgress progress = registry.init("ch", TextSegmenter.split("A. B."));
        generated(progress, 1, 0);
        scheduler.scheduleUpgradePass("book", "ch", LADDER, () -> 0, s -> { });
        assertTrue(scheduler.isUpgradeActive("ch"));

        scheduler.cancelUpgrade("ch");
        scheduler.cancelUpgrade("ch");

        assertFalse(scheduler.isUpgradeActive("ch"));
        assertEquals(TickOutcome.CANCELLED, scheduler.tickNow("ch").get(5, TimeUnit.SECONDS));
        assertEquals(0, engine.requestCount());
    }

    @Test
    public void noLoopWhenTheLadderCannotClimb()
    {
        AdaptiveQualityScheduler scheduler = scheduler();
        registry.init("ch", TextSegmenter.split("A. B."));
        TierLadder systemOnly = new TierLadder(Arrays.asList(TierConfig.systemVoice(), null, null, null));

        assertFalse(scheduler.scheduleUpgradePass("book", "ch", systemOnly, () -> 0, s -> { }));
        assertFalse(scheduler.isUpgradeActive("ch"));
    }

    @Test
    public void timerDrivenLoopReachesTheTargetAndStops() throws Exception
    {
        AdaptiveQualityScheduler scheduler = scheduler("upgradeInitialDelayMs", "10", "upgradeTickMs", "10");
        ChapterProgress progress = registry.init("ch", TextSegmenter.split("A. B. C."));
        for (int i = 0; i < 3; i++)
        {
            generated(progress, i, 0);
        }

        scheduler.scheduleUpgradePass("book", "ch", LADDER, () -> 0, s -> { });

        long deadline = System.currentTimeMillis() + 5000;
        while (scheduler.isUpgradeActive("ch") && System.currentTimeMillis() < deadline)
        {
            Thread.sleep(10);
        }

        assertFalse(scheduler.isUpgradeActive("ch"));
        assertEquals(0, progress.qualityOf(0));
        assertEquals(2, progress.qualityOf(1));
        assertEquals(2, progress.qualityOf(2));
        assertEquals(4, engine.requestCount());
    }

    @Test
    public void fastPassGeneratesMissingSegmentsInOrder() throws Exception
    {
        AdaptiveQualityScheduler scheduler = scheduler();
        ChapterProgress progress = registry.init("ch", TextSegmenter.split("A. B. C."));
        generated(progress, 1, 0);

        List<Segment> received = Collections.synchronizedList(new ArrayList<>());
        scheduler.startFastPass("ch", LADDER, s ->
        {
            progress.markGenerated(s);
            received.add(s);
        }).get(5, TimeUnit.SECONDS);

        assertEquals(Arrays.asList("A.", "C."), engine.requestedTexts());
        assertEquals(2, received.size());
        assertEquals(0, received.get(0).getIndex());
        assertEquals(2, received.get(1).getIndex());
        assertEquals(0, received.get(1).getQualityTier());
        assertEquals(0.5d, received.get(1).getDurationSeconds().get(), 0.01d);
        assertFalse(progress.isGenerating());
        assertFalse(scheduler.isFastPassActive("ch"));
        assertEquals(100, progress.percentComplete());
    }

    @Test
    public void fastPassSkipsFailedSegments() throws Exception
    {
        engine.thenFail(new PermanentGenerationException("bad text"));
        AdaptiveQualityScheduler scheduler = scheduler();
        ChapterProgress progress = registry.init("ch", TextSegmenter.split("A. B. C."));

        scheduler.startFastPass("ch", LADDER, progress::markGenerated).get(5, TimeUnit.SECONDS);

        assertFalse(progress.isGenerated(0));
        assertTrue(progress.isGenerated(1));
        assertTrue(progress.isGenerated(2));
        assertEquals(67, progress.percentComplete());
    }

    @Test
    public void fastPassUsesTheLowestAvailableTier() throws Exception
    {
        AdaptiveQualityScheduler scheduler = scheduler();
        ChapterProgress progress = registry.init("ch", TextSegmenter.split("A."));
        TierLadder noSystem = new TierLadder(Arrays.asList(null, Q4, null, null));

        scheduler.startFastPass("ch", noSystem, progress::markGenerated).get(5, TimeUnit.SECONDS);

        assertEquals(Q4, engine.requestedTiers().get(0));
        assertEquals(1, progress.qualityOf(0));
    }

    @Test
    public void fastPassCoversLongChaptersWhenResultsAreImmediate() throws Exception
    {
        AdaptiveQualityScheduler scheduler = scheduler();
        ChapterProgress progress = registry.init("ch", TextSegmenter.split(sentences(5000)));

        scheduler.startFastPass("ch", LADDER, progress::markGenerated).get(10, TimeUnit.SECONDS);

        assertEquals(5000, engine.requestCount());
        assertEquals(100, progress.percentComplete());
        assertFalse(progress.isGenerating());
        assertFalse(scheduler.isFastPassActive("ch"));
    }

    @Test
    public void fastPassFinishesLongChaptersWhenEveryRequestFailsAtOnce() throws Exception
    {
        NarratePlusConfig cfg = TestConfigs.with();
        GenerationCoordinator coordinator = new GenerationCoordinator(new StubEngineFactory(new NoopSpeechEngine()),
                executor, registry, new RetryPolicy(0, 10, 10, 2.0), cfg);
        AdaptiveQualityScheduler scheduler = new AdaptiveQualityScheduler(coordinator,
                new ResourceMonitor(host, cfg), registry, store, executor, cfg);
        ChapterProgress progress = registry.init("ch", TextSegmenter.split(sentences(5000)));

        scheduler.startFastPass("ch", LADDER, progress::markGenerated).get(10, TimeUnit.SECONDS);

        assertEquals(5000, coordinator.getDispatchCount());
        assertEquals(0, progress.percentComplete());
        assertFalse(progress.isGenerating());
        assertFalse(scheduler.isFastPassActive("ch"));
    }
}
