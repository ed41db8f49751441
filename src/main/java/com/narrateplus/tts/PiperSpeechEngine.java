package com.narrateplus.tts;

import com.narrateplus.generation.PermanentGenerationException;
import com.narrateplus.generation.TransientGenerationException;
import com.narrateplus.model.EngineKind;
import com.narrateplus.model.TierConfig;
import java.io.File;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the Piper CLI locally, one process per segment.
 *
 * Tier voices map to {@code <modelDir>/<voiceKey>.onnx}. The system tier is rendered
 * with the configured default Piper voice. Kokoro tiers are not supported.
 */
@Slf4j
public final class PiperSpeechEngine implements SpeechEngine
{
    private final String piperPath;
    private final File modelDir;
    private final String defaultVoice;
    private final long timeoutMs;
    private final ExecutorService worker;

    private volatile boolean closed;

    public PiperSpeechEngine(String piperPath, String modelDir, String defaultVoice, long timeoutMs, int threads)
    {
        this.piperPath = piperPath == null ? "" : piperPath.trim();
        this.modelDir = new File(modelDir == null ? "" : modelDir.trim());
        this.defaultVoice = defaultVoice == null ? "" : defaultVoice.trim();
        this.timeoutMs = Math.max(1000, timeoutMs);

        AtomicInteger n = new AtomicInteger();
        this.worker = Executors.newFixedThreadPool(Math.max(1, threads), r ->
        {
            Thread t = new Thread(r, "narrateplus-piper-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public boolean isAvailable()
    {
        return !closed && !piperPath.isEmpty() && new File(piperPath).isFile() && modelDir.isDirectory();
    }

    @Override
    public Set<EngineKind> supportedEngines()
    {
        return EnumSet.of(EngineKind.SYSTEM, EngineKind.PIPER);
    }

    @Override
    public CompletableFuture<byte[]> synthesize(String text, TierConfig tier)
    {
        if (closed)
        {
            return CompletableFuture.failedFuture(new TransientGenerationException("Speech engine shut down"));
        }

        File model;
        try
        {
            model = modelFor(tier);
        }
        catch (PermanentGenerationException e)
        {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<byte[]> result = new CompletableFuture<>();
        try
        {
            Future<?> task = worker.submit(() ->
            {
                if (closed)
                {
                    result.completeExceptionally(new TransientGenerationException("Speech engine shut down"));
                    return;
                }

                try
                {
                    result.complete(PiperRunner.runToWav(piperPath, model.getAbsolutePath(), text, timeoutMs));
                }
                catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                    result.completeExceptionally(new TransientGenerationException("Speech engine shut down", e));
                }
                catch (IOException e)
                {
                    result.completeExceptionally(e);
                }
                catch (IllegalArgumentException e)
                {
                    result.completeExceptionally(new PermanentGenerationException(e.getMessage(), e));
                }
                catch (RuntimeException e)
                {
                    result.completeExceptionally(e);
                }
            });
            // A caller that gives up (timeout, cancel) stops the process as well.
            result.whenComplete((bytes, err) ->
            {
                if (err != null)
                {
                    task.cancel(true);
                }
            });
        }
        catch (RejectedExecutionException e)
        {
            result.completeExceptionally(new TransientGenerationException("Speech engine shut down", e));
        }
        return result;
    }

    @Override
    public void shutdown()
    {
        closed = true;
        // Interrupts running waits, which kills their Piper processes.
        worker.shutdownNow();
    }

    File modelFor(TierConfig tier)
    {
        String key;
        switch (tier.getEngine())
        {
            case PIPER:
                key = tier.getVoice();
                break;
            case SYSTEM:
                key = defaultVoice;
                break;
            default:
                throw new PermanentGenerationException("Piper backend cannot render " + tier.getEngine() + " voices");
        }

        if (key == null || key.trim().isEmpty())
        {
            throw new PermanentGenerationException("No Piper voice configured for " + tier);
        }

        File model = new File(modelDir, key.trim() + ".onnx");
        if (!model.isFile())
        {
            throw new PermanentGenerationException("Piper model not found: " + model.getAbsolutePath());
        }
        return model;
    }
}
