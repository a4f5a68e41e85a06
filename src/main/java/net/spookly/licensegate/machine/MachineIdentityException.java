package net.spookly.licensegate.machine;

/**
 * Raised when no platform source yields a machine identifier.
 */
public class MachineIdentityException extends Exception {
    public MachineIdentityException(String message) {
        super(message);
    }

    public MachineIdentityException(String message, Throwable cause) {
        super(message, cause);
    }
}
