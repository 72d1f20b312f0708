package com.nayem.courier.error;

/**
 * The resolved handler could not be invoked as expected, e.g. it returned no
 * future or does not accept the request type it was registered for.
 */
public class InvocationContractException extends DispatchException {
    public InvocationContractException(String message) {
        super(message);
    }
}
