package com.narrateplus;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.util.Modules;
import com.narrateplus.chapter.TextFileChapterProvider;
import com.narrateplus.generation.GenerationCoordinator;
import com.narrateplus.playback.AudioHandle;
import com.narrateplus.playback.AudioOutput;
import com.narrateplus.playback.ClipAudioOutput;
import com.narrateplus.playback.PlaybackStateMachine;
import com.narrateplus.playback.RecordingAudioOutput;
import com.narrateplus.progress.ChapterProgressRegistry;
import com.narrateplus.storage.SegmentStore;
import com.narrateplus.tts.ScriptedSpeechEngine;
import com.narrateplus.tts.SpeechEngineFactory;
import com.narrateplus.tts.StubEngineFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class NarratePlusModuleTest
{
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path chapterFile() throws IOException
    {
        Path file = tmp.getRoot().toPath().resolve("chapter-one.txt");
        Files.write(file, "Chapter One\nIt was late. The lamps were lit.".getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private Injector injector(NarratePlusConfig config, Path file, AudioOutput output, SpeechEngineFactory engines)
    {
        return Guice.createInjector(Modules.override(
                new NarratePlusModule(config, new TextFileChapterProvider(file, "en")))
                .with(binder ->
                {
                    binder.bind(AudioOutput.class).toInstance(output);
                    if (engines != null)
                    {
                        binder.bind(SpeechEngineFactory.class).toInstance(engines);
                    }
                }));
    }

    @Test
    public void componentsAreSharedSingletons() throws IOException
    {
        Injector injector = NarratePlusLauncher.createInjector(TestConfigs.with(), chapterFile(), "en");

        PlaybackStateMachine player = injector.getInstance(PlaybackStateMachine.class);
        assertSame(player, injector.getInstance(PlaybackStateMachine.class));
        assertSame(injector.getInstance(GenerationCoordinator.class), injector.getInstance(GenerationCoordinator.class));
        assertSame(injector.getInstance(ChapterProgressRegistry.class), injector.getInstance(ChapterProgressRegistry.class));
        assertSame(injector.getInstance(SegmentStore.class), injector.getInstance(SegmentStore.class));
        assertTrue(injector.getInstance(AudioOutput.class) instanceof ClipAudioOutput);
        player.shutdown();
    }

    @Test
    public void chapterPlaysToTheEnd() throws Exception
    {
        RecordingAudioOutput output = new RecordingAudioOutput()
        {
            @Override
            public void start(AudioHandle handle, double speed, Runnable onFinished)
            {
                super.start(handle, speed, onFinished);
                finish();
            }
        };
        Path file = chapterFile();
        Injector injector = injector(TestConfigs.with("upgradeInitialDelayMs", "600000"), file, output,
                new StubEngineFactory(ScriptedSpeechEngine.succeeding()));

        assertEquals(0, NarratePlusLauncher.run(injector, file));
        assertEquals(3, output.startedIndices().size());
        assertEquals(3, injector.getInstance(SegmentStore.class)
                .getSegments(file.toAbsolutePath().toString(), "chapter-one").size());
    }

    @Test
    public void disabledSpeechEndsInError() throws Exception
    {
        Path file = chapterFile();
        Injector injector = injector(TestConfigs.with("speechBackend", "NONE"), file, new RecordingAudioOutput(), null);

        assertEquals(1, NarratePlusLauncher.run(injector, file));
    }
}
