package com.questrail.stabilizer.api;

/**
 * Indicates that a stabilization threshold was rejected.
 *
 * This typically reflects:
 * <ul>
 *   <li>A count threshold below 1</li>
 *   <li>A negative duration threshold</li>
 * </ul>
 * Validation happens at construction or assignment time, never during
 * {@code report}.
 */
public final class InvalidConfigurationException extends StabilizerException
{
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
