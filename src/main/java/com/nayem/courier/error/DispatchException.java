package com.nayem.courier.error;

/**
 * Base type of the failures raised by the dispatcher itself, as opposed to the
 * errors raised by handlers.
 */
public class DispatchException extends RuntimeException {
    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
