package com.jarcadia.rollout.exception;

public class RolloutException extends RuntimeException {

    public RolloutException(String message)
    {
        super(message);
    }

    public RolloutException(Throwable cause)
    {
        super(cause);
    }

    public RolloutException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
