package com.questrail.stabilizer.api;

/**
 * Base type for every failure raised by the stabilizer library.
 *
 * All failures are synchronous and local; nothing is retried on the
 * caller's behalf.
 */
public class StabilizerException extends RuntimeException
{
    public StabilizerException(String message) {
        super(message);
    }

    public StabilizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
