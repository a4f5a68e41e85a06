package net.spookly.licensegate;

import net.spookly.licensegate.validation.ValidationResult;

/**
 * Raised by {@link LicenseGate} when the license is rejected or has not been initialized.
 */
public class LicenseException extends RuntimeException {
    private final ValidationResult result;

    public LicenseException(String message) {
        this(message, null);
    }

    public LicenseException(String message, ValidationResult result) {
        super(message);
        this.result = result;
    }

    /**
     * The rejected validation result, or {@code null} when no validation ran.
     */
    public ValidationResult result() {
        return result;
    }
}
