package com.narrateplus.generation;

import lombok.Getter;

/**
 * A single dispatch ran past its budget.
 */
@Getter
public class GenerationTimeoutException extends TransientGenerationException
{
    private final long timeoutMs;

    public GenerationTimeoutException(String message, long timeoutMs)
    {
        super(ErrorKind.TIMEOUT, message + " (timeout: " + timeoutMs + "ms)", null);
        this.timeoutMs = timeoutMs;
    }
}
