package com.narrateplus.tts;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.narrateplus.generation.GenerationErrors;
import com.narrateplus.generation.GenerationTimeoutException;
import com.narrateplus.generation.PermanentGenerationException;
import com.narrateplus.model.EngineKind;
import com.narrateplus.model.ExecutionDevice;
import com.narrateplus.model.Quantization;
import com.narrateplus.model.TierConfig;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.EnumSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class PiperSpeechEngineTest
{
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private PiperSpeechEngine engine;

    @Before
    public void setUp() throws IOException
    {
        tmp.newFile("de_DE-thorsten-low.onnx");
        File missingExe = new File(tmp.getRoot(), "no-such-piper");
        engine = new PiperSpeechEngine(missingExe.getAbsolutePath(), tmp.getRoot().getAbsolutePath(),
                "de_DE-thorsten-low", 5000, 1);
    }

    @After
    public void tearDown()
    {
        engine.shutdown();
    }

    private static Throwable failureOf(CompletableFuture<byte[]> f) throws Exception
    {
        try
        {
            f.get(5, TimeUnit.SECONDS);
            fail("expected failure");
            return null;
        }
        catch (ExecutionException e)
        {
            return e.getCause();
        }
    }

    @Test
    public void rendersOnlyPiperAndSystemVoices()
    {
        assertEquals(EnumSet.of(EngineKind.SYSTEM, EngineKind.PIPER), engine.supportedEngines());
    }

    @Test
    public void kokoroTierIsPermanentlyRejected() throws Exception
    {
        Throwable t = failureOf(engine.synthesize("Hallo.",
                TierConfig.kokoro("af_heart", Quantization.Q4, ExecutionDevice.CPU)));

        assertTrue(t instanceof PermanentGenerationException);
    }

    @Test
    public void missingModelIsPermanent() throws Exception
    {
        Throwable t = failureOf(engine.synthesize("Hallo.", TierConfig.piper("de_DE-karl-high")));

        assertTrue(t instanceof PermanentGenerationException);
        assertTrue(t.getMessage().contains("de_DE-karl-high.onnx"));
    }

    @Test
    public void systemTierUsesTheDefaultVoice()
    {
        assertEquals(new File(tmp.getRoot(), "de_DE-thorsten-low.onnx"), engine.modelFor(TierConfig.systemVoice()));
    }

    @Test
    public void processFailureIsRetryable() throws Exception
    {
        Throwable t = failureOf(engine.synthesize("Hallo.", TierConfig.piper("de_DE-thorsten-low")));

        assertTrue(t instanceof IOException);
        assertTrue(GenerationErrors.normalize(t, null).isRetryable());
    }

    /**
     * Stand-in for the Piper binary: marks that it started, then marks completion
     * two seconds later unless it was killed first.
     */
    private File slowPiper() throws IOException
    {
        Assume.assumeTrue(new File("/bin/sh").canExecute());
        File script = new File(tmp.getRoot(), "piper.sh");
        String body = "#!/bin/sh\n"
                + "touch '" + new File(tmp.getRoot(), "started").getAbsolutePath() + "'\n"
                + "sleep 2\n"
                + "touch '" + new File(tmp.getRoot(), "finished").getAbsolutePath() + "'\n";
        Files.write(script.toPath(), body.getBytes(StandardCharsets.UTF_8));
        assertTrue(script.setExecutable(true));
        return script;
    }

    private void awaitStart(CompletableFuture<byte[]> f) throws InterruptedException
    {
        File started = new File(tmp.getRoot(), "started");
        long deadline = System.currentTimeMillis() + 5000;
        while (!started.exists() && !f.isDone() && System.currentTimeMillis() < deadline)
        {
            Thread.sleep(20);
        }
        // Temp folders mounted noexec cannot run the script.
        Assume.assumeTrue(started.exists());
    }

    @Test
    public void shutdownKillsTheRunningProcess() throws Exception
    {
        PiperSpeechEngine slow = new PiperSpeechEngine(slowPiper().getAbsolutePath(), tmp.getRoot().getAbsolutePath(),
                "de_DE-thorsten-low", 10000, 1);
        try
        {
            CompletableFuture<byte[]> f = slow.synthesize("Hallo.", TierConfig.piper("de_DE-thorsten-low"));
            awaitStart(f);

            slow.shutdown();

            assertTrue(GenerationErrors.normalize(failureOf(f), null).isRetryable());
            Thread.sleep(3000);
            assertFalse(new File(tmp.getRoot(), "finished").exists());
        }
        finally
        {
            slow.shutdown();
        }
    }

    @Test
    public void abandonedRequestKillsTheRunningProcess() throws Exception
    {
        PiperSpeechEngine slow = new PiperSpeechEngine(slowPiper().getAbsolutePath(), tmp.getRoot().getAbsolutePath(),
                "de_DE-thorsten-low", 10000, 1);
        try
        {
            CompletableFuture<byte[]> f = slow.synthesize("Hallo.", TierConfig.piper("de_DE-thorsten-low"));
            awaitStart(f);

            f.completeExceptionally(new GenerationTimeoutException("Generation timed out", 100));

            Thread.sleep(3000);
            assertFalse(new File(tmp.getRoot(), "finished").exists());
        }
        finally
        {
            slow.shutdown();
        }
    }
}
