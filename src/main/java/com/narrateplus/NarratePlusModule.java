package com.narrateplus;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.narrateplus.chapter.ChapterProvider;
import com.narrateplus.generation.RetryPolicy;
import com.narrateplus.playback.AudioOutput;
import com.narrateplus.playback.ClipAudioOutput;
import com.narrateplus.resource.HostResources;
import com.narrateplus.resource.JvmHostResources;
import com.narrateplus.storage.InMemorySegmentStore;
import com.narrateplus.storage.SegmentStore;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Singleton;
import okhttp3.OkHttpClient;

/**
 * Wires the pipeline. The embedding application supplies the config and the
 * chapter source; everything else has a default binding here.
 */
public class NarratePlusModule extends AbstractModule
{
    private final NarratePlusConfig config;
    private final ChapterProvider chapterProvider;

    public NarratePlusModule(NarratePlusConfig config, ChapterProvider chapterProvider)
    {
        this.config = config;
        this.chapterProvider = chapterProvider;
    }

    @Provides
    NarratePlusConfig provideConfig()
    {
        return config;
    }

    @Provides
    ChapterProvider provideChapterProvider()
    {
        return chapterProvider;
    }

    @Provides
    @Singleton
    OkHttpClient provideHttpClient()
    {
        return new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .build();
    }

    @Provides
    @Singleton
    ScheduledExecutorService provideGenerationExecutor()
    {
        AtomicInteger n = new AtomicInteger();
        return Executors.newScheduledThreadPool(Math.max(1, config.generationThreads()), r ->
        {
            Thread t = new Thread(r, "narrateplus-generation-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Provides
    @Singleton
    RetryPolicy provideRetryPolicy()
    {
        return RetryPolicy.fromConfig(config);
    }

    @Provides
    @Singleton
    HostResources provideHostResources()
    {
        return new JvmHostResources(config.mobileHost());
    }

    @Provides
    @Singleton
    SegmentStore provideSegmentStore()
    {
        return new InMemorySegmentStore();
    }

    @Provides
    @Singleton
    AudioOutput provideAudioOutput()
    {
        return new ClipAudioOutput();
    }
}
