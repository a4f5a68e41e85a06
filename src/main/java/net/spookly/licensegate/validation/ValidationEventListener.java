package net.spookly.licensegate.validation;

/**
 * Listener for validation audit events.
 */
@FunctionalInterface
public interface ValidationEventListener {
    ValidationEventListener NOOP = event -> {
    };

    void onEvent(ValidationEvent event);
}
