package com.jarcadia.rollout.exception;

public class LockTimeoutException extends RolloutException {

    public LockTimeoutException(String message)
    {
        super(message);
    }

    public LockTimeoutException(Throwable cause)
    {
        super(cause);
    }

    public LockTimeoutException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
