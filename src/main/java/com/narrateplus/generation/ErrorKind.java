package com.narrateplus.generation;

/**
 * Normalized failure classes for speech generation.
 */
public enum ErrorKind
{
    /**
     * Network, rate limiting, memory pressure. Retried with backoff.
     */
    TRANSIENT,

    /**
     * Bad input or unsupported voice. Never retried.
     */
    PERMANENT,

    /**
     * A dispatch exceeded its time budget. Retried like a transient failure.
     */
    TIMEOUT,

    /**
     * Stopped on purpose. Never retried.
     */
    CANCELLED
}
