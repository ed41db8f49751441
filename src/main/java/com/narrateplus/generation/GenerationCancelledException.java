package com.narrateplus.generation;

public class GenerationCancelledException extends GenerationException
{
    public GenerationCancelledException(String message)
    {
        super(ErrorKind.CANCELLED, message);
    }

    public GenerationCancelledException(String message, Throwable cause)
    {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
