package com.narrateplus.generation;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw generator failures onto {@link GenerationException} kinds.
 */
public final class GenerationErrors
{
    private static final List<String> TRANSIENT_PATTERNS = List.of(
            "network",
            "timeout",
            "timed out",
            "econnrefused",
            "enotfound",
            "etimedout",
            "connection reset",
            "rate limit",
            "too many requests",
            "service unavailable",
            "temporarily unavailable",
            "failed to allocate",
            "can't create a session",
            "out of memory",
            "aborted()"
    );

    private static final List<String> MEMORY_PATTERNS = List.of(
            "failed to allocate",
            "can't create a session",
            "out of memory",
            "aborted()"
    );

    private GenerationErrors()
    {
    }

    /**
     * @param context prefix for the message of newly wrapped failures, may be null
     */
    public static GenerationException normalize(Throwable error, String context)
    {
        Throwable t = unwrap(error);
        if (t instanceof GenerationException)
        {
            return (GenerationException) t;
        }

        String message = prefix(context) + describe(t);

        if (t instanceof CancellationException || t instanceof InterruptedException)
        {
            return new GenerationCancelledException(message, t);
        }
        if (t instanceof TimeoutException)
        {
            return new GenerationTimeoutException(message, -1);
        }
        if (t instanceof OutOfMemoryError || t instanceof IOException || matchesAny(t, TRANSIENT_PATTERNS))
        {
            return new TransientGenerationException(message, t);
        }
        // Bad input, unsupported voice and anything unrecognised.
        return new PermanentGenerationException(message, t);
    }

    /**
     * True when the failure points at an exhausted or corrupted engine context that
     * a fresh engine instance is expected to cure.
     */
    public static boolean isMemoryError(Throwable error)
    {
        Throwable t = error;
        while (t != null)
        {
            if (t instanceof OutOfMemoryError || matchesAny(t, MEMORY_PATTERNS))
            {
                return true;
            }
            if (t.getCause() == t)
            {
                break;
            }
            t = t.getCause();
        }
        return false;
    }

    static Throwable unwrap(Throwable error)
    {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null)
        {
            t = t.getCause();
        }
        return t;
    }

    private static boolean matchesAny(Throwable t, List<String> patterns)
    {
        String msg = t.getMessage();
        if (msg == null)
        {
            return false;
        }

        String lower = msg.toLowerCase(Locale.ROOT);
        for (String p : patterns)
        {
            if (lower.contains(p))
            {
                return true;
            }
        }
        return false;
    }

    private static String prefix(String context)
    {
        return context == null || context.isEmpty() ? "" : context + ": ";
    }

    private static String describe(Throwable t)
    {
        String msg = t.getMessage();
        return msg == null || msg.trim().isEmpty() ? t.getClass().getSimpleName() : msg;
    }
}
