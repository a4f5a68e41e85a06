package net.spookly.licensegate.validation;

import java.io.PrintStream;

/**
 * Audit logger that writes one {@code key=value} line per event.
 */
public final class ValidationAuditLogger implements ValidationEventListener {
    public static final ValidationAuditLogger INSTANCE = new ValidationAuditLogger(System.out);

    private final PrintStream out;

    ValidationAuditLogger(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onEvent(ValidationEvent event) {
        out.println(format(event));
    }

    static String format(ValidationEvent event) {
        StringBuilder builder = new StringBuilder("license_event");
        append(builder, "type", event.type());
        append(builder, "key", event.cacheKey());
        append(builder, "source", event.source());
        append(builder, "valid", event.valid());
        append(builder, "reason", event.reason());
        append(builder, "tier", event.tier());
        append(builder, "latencyMs", event.latencyMs());
        append(builder, "timestamp", event.timestamp());
        if (event.detail() != null) {
            builder.append(" detail=\"").append(event.detail().replace("\"", "'")).append('"');
        }
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
