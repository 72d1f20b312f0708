package com.nayem.courier.error;

/**
 * A delay strategy produced a negative delay.
 */
public class InvalidRetryDelayException extends DispatchException {
    private final long delay;

    public InvalidRetryDelayException(long delay, Throwable cause) {
        super("The retry delay '" + delay + "' should be greater than or equal to 0ms.", cause);
        this.delay = delay;
    }

    public long getDelay() {
        return delay;
    }
}
