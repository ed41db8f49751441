package com.narrateplus.generation;

import lombok.Getter;

/**
 * Root of every failure the generation pipeline hands to its callers.
 */
@Getter
public class GenerationException extends RuntimeException
{
    private final ErrorKind kind;

    public GenerationException(ErrorKind kind, String message)
    {
        super(message);
        this.kind = kind;
    }

    public GenerationException(ErrorKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable()
    {
        return kind == ErrorKind.TRANSIENT || kind == ErrorKind.TIMEOUT;
    }

    public boolean isCancellation()
    {
        return kind == ErrorKind.CANCELLED;
    }
}
