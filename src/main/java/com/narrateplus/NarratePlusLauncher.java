package com.narrateplus;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.narrateplus.chapter.ChapterProvider;
import com.narrateplus.chapter.TextFileChapterProvider;
import com.narrateplus.generation.GenerationException;
import com.narrateplus.playback.LoadOptions;
import com.narrateplus.playback.PlaybackListener;
import com.narrateplus.playback.PlaybackState;
import com.narrateplus.playback.PlaybackStateMachine;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a text file as one chapter and plays it through the configured backend.
 *
 * Usage: {@code NarratePlusLauncher <chapter.txt> [language] [config.properties]}
 */
@Slf4j
public final class NarratePlusLauncher
{
    private NarratePlusLauncher()
    {
    }

    public static void main(String[] args) throws Exception
    {
        if (args.length < 1)
        {
            System.err.println("Usage: NarratePlusLauncher <chapter.txt> [language] [config.properties]");
            System.exit(2);
            return;
        }

        Path file = Paths.get(args[0]);
        if (!Files.isRegularFile(file))
        {
            System.err.println("Not a file: " + file);
            System.exit(2);
            return;
        }

        String language = args.length > 1 ? args[1] : null;
        NarratePlusConfig config = ConfigLoader.load(args.length > 2 ? Paths.get(args[2]) : null);

        int exit = run(createInjector(config, file, language), file);
        System.exit(exit);
    }

    static Injector createInjector(NarratePlusConfig config, Path file, String language)
    {
        return Guice.createInjector(new NarratePlusModule(config, new TextFileChapterProvider(file, language)));
    }

    static int run(Injector injector, Path file) throws InterruptedException
    {
        PlaybackStateMachine player = injector.getInstance(PlaybackStateMachine.class);
        ChapterProvider chapters = injector.getInstance(ChapterProvider.class);

        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<PlaybackState> last = new AtomicReference<>(PlaybackState.STOPPED);

        player.addListener(new PlaybackListener()
        {
            @Override
            public void onStateChanged(PlaybackState state)
            {
                last.set(state);
                if (state == PlaybackState.ENDED || state == PlaybackState.ERROR)
                {
                    finished.countDown();
                }
            }

            @Override
            public void onError(GenerationException error)
            {
                log.error("Playback stopped: {}", error.getMessage());
            }
        });

        String chapterId = chapters.chapterIds().get(0);
        log.info("Narrating {}", file);

        try
        {
            player.loadChapter(file.toAbsolutePath().toString(), chapterId, LoadOptions.DEFAULT).join();
            finished.await();
        }
        finally
        {
            player.shutdown();
        }

        return last.get() == PlaybackState.ENDED ? 0 : 1;
    }
}
