package com.narrateplus.generation;

public class PermanentGenerationException extends GenerationException
{
    public PermanentGenerationException(String message)
    {
        super(ErrorKind.PERMANENT, message);
    }

    public PermanentGenerationException(String message, Throwable cause)
    {
        super(ErrorKind.PERMANENT, message, cause);
    }
}
