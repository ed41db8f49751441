package com.narrateplus.tts;

import java.io.BufferedWriter;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class PiperRunner
{
    private PiperRunner()
    {
    }

    /**
     * Runs Piper CLI and returns the synthesized WAV bytes.
     */
    public static byte[] runToWav(String piperExePath, String modelPath, String text, long timeoutMs)
            throws IOException, InterruptedException
    {
        if (isBlank(piperExePath) || isBlank(modelPath) || isBlank(text))
        {
            throw new IllegalArgumentException("Invalid piper arguments");
        }

        File wavOut = File.createTempFile("narrateplus-", ".wav");
        wavOut.deleteOnExit();

        Process p = null;
        try
        {
            ProcessBuilder pb = new ProcessBuilder(
                    piperExePath,
                    "--model", modelPath,
                    "--output_file", wavOut.getAbsolutePath()
            );

            pb.redirectErrorStream(true);

            p = pb.start();

            try (BufferedWriter writer = new BufferedWriter(
                    new OutputStreamWriter(p.getOutputStream(), StandardCharsets.UTF_8)))
            {
                writer.write(text);
                writer.newLine();
            }

            boolean finished = p.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished)
            {
                throw new IOException("Piper timed out");
            }

            if (p.exitValue() != 0)
            {
                String output = readAll(p.getInputStream());
                log.debug("Piper output: {}", output);
                // Piper's onnxruntime reports allocation failures on its console.
                throw new IOException("Piper exited with code " + p.exitValue() + ": " + lastLine(output));
            }

            if (!wavOut.isFile() || wavOut.length() == 0)
            {
                throw new IOException("Piper produced no audio output");
            }

            return Files.readAllBytes(wavOut.toPath());
        }
        finally
        {
            // Also reached when the waiting worker is interrupted.
            if (p != null && p.isAlive())
            {
                p.destroyForcibly();
            }
            if (!wavOut.delete())
            {
                log.debug("Could not delete {}", wavOut);
            }
        }
    }

    private static String readAll(InputStream in) throws IOException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        in.transferTo(out);
        return out.toString(StandardCharsets.UTF_8);
    }

    private static String lastLine(String output)
    {
        String trimmed = output == null ? "" : output.trim();
        int nl = trimmed.lastIndexOf('\n');
        return nl < 0 ? trimmed : trimmed.substring(nl + 1).trim();
    }

    private static boolean isBlank(String s)
    {
        return s == null || s.trim().isEmpty();
    }
}
