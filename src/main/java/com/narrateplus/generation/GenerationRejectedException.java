package com.narrateplus.generation;

import lombok.Getter;

/**
 * Admission refused because too many requests are already in flight. Surfaces
 * straight to the caller; the coordinator does not retry it.
 */
@Getter
public class GenerationRejectedException extends TransientGenerationException
{
    private final int limit;

    public GenerationRejectedException(int limit)
    {
        super("Generation queue full (max " + limit + " concurrent requests)");
        this.limit = limit;
    }
}
