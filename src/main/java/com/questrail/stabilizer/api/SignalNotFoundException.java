package com.questrail.stabilizer.api;

/**
 * Raised by any registry operation that names a signal the registry does not
 * hold.
 */
public final class SignalNotFoundException extends StabilizerException
{
    private final String signalName;

    public SignalNotFoundException(String signalName) {
        super("Signal '" + signalName + "' does not exist");
        this.signalName = signalName;
    }

    public String signalName() {
        return signalName;
    }
}
