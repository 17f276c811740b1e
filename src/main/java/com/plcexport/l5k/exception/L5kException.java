package com.plcexport.l5k.exception;

/**
 * Base type for every failure raised by the L5K core.
 */
public class L5kException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public L5kException(String message) {
        super(message);
    }

    public L5kException(String message, Throwable cause) {
        super(message, cause);
    }
}
