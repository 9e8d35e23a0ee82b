package com.jarcadia.rollout.exception;

public class DeploymentFailedException extends RolloutException {

    public DeploymentFailedException(String message)
    {
        super(message);
    }

    public DeploymentFailedException(Throwable cause)
    {
        super(cause);
    }

    public DeploymentFailedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
