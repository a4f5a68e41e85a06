package net.spookly.licensegate.claims;

import java.util.List;

/**
 * Raised when decoded claims do not match the license schema.
 */
public class ClaimsSchemaException extends Exception {
    private final List<String> violations;

    public ClaimsSchemaException(List<String> violations) {
        super("invalid license claims: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ClaimsSchemaException(String violation, Throwable cause) {
        super("invalid license claims: " + violation, cause);
        this.violations = List.of(violation);
    }

    public List<String> violations() {
        return violations;
    }
}
