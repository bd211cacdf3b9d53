package com.questrail.stabilizer.api;

/**
 * Raised when a signal is added to a registry under a name that is already
 * registered. The caller must pick another name or remove the existing
 * signal first.
 */
public final class DuplicateSignalException extends StabilizerException
{
    private final String signalName;

    public DuplicateSignalException(String signalName) {
        super("Signal '" + signalName + "' already exists");
        this.signalName = signalName;
    }

    public String signalName() {
        return signalName;
    }
}
