package com.jarcadia.rollout.exception;

public class DeployTimeoutException extends RolloutException {

    public DeployTimeoutException(String message)
    {
        super(message);
    }

    public DeployTimeoutException(Throwable cause)
    {
        super(cause);
    }

    public DeployTimeoutException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
