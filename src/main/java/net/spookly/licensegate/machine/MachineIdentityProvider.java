package net.spookly.licensegate.machine;

/**
 * Supplies the hashed fingerprint of the machine the process runs on.
 */
@FunctionalInterface
public interface MachineIdentityProvider {
    /**
     * @return lowercase hex SHA-256 of the platform identifier
     */
    String currentFingerprint() throws MachineIdentityException;
}
