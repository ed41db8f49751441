package com.narrateplus.generation;

public class TransientGenerationException extends GenerationException
{
    public TransientGenerationException(String message)
    {
        super(ErrorKind.TRANSIENT, message);
    }

    public TransientGenerationException(String message, Throwable cause)
    {
        super(ErrorKind.TRANSIENT, message, cause);
    }

    TransientGenerationException(ErrorKind kind, String message, Throwable cause)
    {
        super(kind, message, cause);
    }
}
