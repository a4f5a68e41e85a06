package net.spookly.licensegate.remote;

/**
 * Reconciles a license with the remote licensing authority. Implementations make a single
 * attempt per call and never retry.
 */
@FunctionalInterface
public interface PhoneHomeClient {
    PhoneHomeResponse check(String token, String machineId) throws PhoneHomeException;
}
