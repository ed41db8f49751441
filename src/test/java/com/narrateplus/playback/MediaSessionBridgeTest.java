package com.narrateplus.playback;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.narrateplus.NarratePlusConfig;
import com.narrateplus.TestConfigs;
import com.narrateplus.chapter.TextFileChapterProvider;
import com.narrateplus.generation.GenerationCoordinator;
import com.narrateplus.generation.RetryPolicy;
import com.narrateplus.model.Chapter;
import com.narrateplus.progress.ChapterProgressRegistry;
import com.narrateplus.quality.AdaptiveQualityScheduler;
import com.narrateplus.quality.TierLadderResolver;
import com.narrateplus.resource.FixedHostResources;
import com.narrateplus.resource.ResourceMonitor;
import com.narrateplus.storage.InMemorySegmentStore;
import com.narrateplus.tts.ScriptedSpeechEngine;
import com.narrateplus.tts.StubEngineFactory;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class MediaSessionBridgeTest
{
    private final ScheduledExecutorService executor = Executors.newScheduledThreadPool(2);
    private final RecordingAudioOutput output = new RecordingAudioOutput();
    private final RecordingHost host = new RecordingHost();

    private PlaybackStateMachine player;
    private MediaSessionBridge bridge;

    @Before
    public void setUp()
    {
        NarratePlusConfig cfg = TestConfigs.with("upgradeInitialDelayMs", "600000");
        ChapterProgressRegistry registry = new ChapterProgressRegistry();
        InMemorySegmentStore store = new InMemorySegmentStore();
        StubEngineFactory factory = new StubEngineFactory(ScriptedSpeechEngine.succeeding());
        GenerationCoordinator coordinator = new GenerationCoordinator(factory, executor, registry,
                new RetryPolicy(0, 10, 10, 2.0), cfg);
        AdaptiveQualityScheduler scheduler = new AdaptiveQualityScheduler(coordinator,
                new ResourceMonitor(FixedHostResources.withMemory(8), cfg), registry, store, executor, cfg);

        player = new PlaybackStateMachine(new TextFileChapterProvider(Paths.get("unused.txt"), "en"), store,
                registry, coordinator, scheduler, new TierLadderResolver(cfg, factory), output, cfg);
        bridge = new MediaSessionBridge(player, host);
    }

    @After
    public void tearDown()
    {
        player.shutdown();
        executor.shutdownNow();
    }

    private static void await(String what, BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean())
        {
            if (System.currentTimeMillis() > deadline)
            {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(5);
        }
    }

    @Test
    public void playerEventsReachTheHost() throws Exception
    {
        bridge.attach("Chapter One");
        assertSame(bridge, host.callbacks);
        assertEquals("Chapter One", host.title);

        player.loadChapter("book", Chapter.of("ch1", "Chapter One", "A. B."), LoadOptions.DEFAULT)
                .get(5, TimeUnit.SECONDS);

        await("playing reported", () -> host.states.contains(PlaybackState.PLAYING));
        await("exact duration", () -> Math.abs(host.durationSeconds - 1.0) < 0.01);
        assertTrue(host.states.contains(PlaybackState.LOADING));
    }

    @Test
    public void hostControlsDriveThePlayer() throws Exception
    {
        bridge.attach("Chapter One");
        player.loadChapter("book", Chapter.of("ch1", "Chapter One", "A. B. C."), LoadOptions.DEFAULT)
                .get(5, TimeUnit.SECONDS);
        await("playing", () -> player.getState() == PlaybackState.PLAYING);

        host.callbacks.onPause();
        await("paused", () -> player.getState() == PlaybackState.PAUSED);

        host.callbacks.onNext();
        await("next", () -> player.getCursor().getCurrentSegmentIndex() == 1);

        host.callbacks.onSeekToSegment(42);
        host.callbacks.onPrevious();
        await("previous", () -> player.getCursor().getCurrentSegmentIndex() == 0);

        host.callbacks.onPlay();
        await("playing again", () -> player.getState() == PlaybackState.PLAYING);
    }

    @Test
    public void detachStopsForwarding() throws Exception
    {
        bridge.attach("Chapter One");
        bridge.detach();
        assertNull(host.callbacks);

        player.loadChapter("book", Chapter.of("ch1", "Chapter One", "A."), LoadOptions.DEFAULT)
                .get(5, TimeUnit.SECONDS);
        player.stop().get(5, TimeUnit.SECONDS);

        assertTrue(host.states.isEmpty());
    }

    private static final class RecordingHost implements MediaSessionHost
    {
        final List<PlaybackState> states = Collections.synchronizedList(new ArrayList<>());
        volatile String title;
        volatile double durationSeconds;
        volatile MediaSessionCallbacks callbacks;

        @Override
        public void setMetadata(String title, double durationSeconds)
        {
            this.title = title;
            this.durationSeconds = durationSeconds;
        }

        @Override
        public void setPlaybackState(PlaybackState state, double positionSeconds, double speed)
        {
            states.add(state);
        }

        @Override
        public void setCallbacks(MediaSessionCallbacks callbacks)
        {
            this.callbacks = callbacks;
        }
    }
}
