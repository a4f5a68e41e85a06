package net.spookly.licensegate.validation;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Local counters for validations, phone-home calls and cache use. Nothing here leaves the process.
 */
public final class LicenseMetrics {
    static final int LATENCY_WINDOW = 1000;

    private final AtomicLong validations = new AtomicLong();
    private final AtomicLong validationSuccess = new AtomicLong();
    private final AtomicLong validationFailure = new AtomicLong();
    private final AtomicLong phoneHome = new AtomicLong();
    private final AtomicLong phoneHomeSuccess = new AtomicLong();
    private final AtomicLong phoneHomeFailure = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong offlineModeUsage = new AtomicLong();
    /**
     * Failure counts grouped by reason, including fallback reasons that did not end validation.
     */
    private final Map<ValidationReason, AtomicLong> failuresByReason = new ConcurrentHashMap<>();
    private final LatencyWindow validationLatency = new LatencyWindow();
    private final LatencyWindow phoneHomeLatency = new LatencyWindow();

    public void recordValidation(ValidationResult result, long latencyMs) {
        validations.incrementAndGet();
        if (result.valid()) {
            validationSuccess.incrementAndGet();
        } else {
            validationFailure.incrementAndGet();
            recordReason(result.reason());
        }
        validationLatency.add(latencyMs);
    }

    public void recordPhoneHome(boolean success, long latencyMs) {
        phoneHome.incrementAndGet();
        if (success) {
            phoneHomeSuccess.incrementAndGet();
        } else {
            phoneHomeFailure.incrementAndGet();
        }
        phoneHomeLatency.add(latencyMs);
    }

    public void recordCacheHit() {
        cacheHits.incrementAndGet();
    }

    public void recordCacheMiss() {
        cacheMisses.incrementAndGet();
    }

    public void recordOfflineMode() {
        offlineModeUsage.incrementAndGet();
    }

    public void recordReason(ValidationReason reason) {
        if (reason != null) {
            failuresByReason.computeIfAbsent(reason, ignored -> new AtomicLong()).incrementAndGet();
        }
    }

    public long validations() {
        return validations.get();
    }

    public long validationSuccess() {
        return validationSuccess.get();
    }

    public long validationFailure() {
        return validationFailure.get();
    }

    public long phoneHomeCalls() {
        return phoneHome.get();
    }

    public long phoneHomeSuccess() {
        return phoneHomeSuccess.get();
    }

    public long phoneHomeFailure() {
        return phoneHomeFailure.get();
    }

    public long cacheHits() {
        return cacheHits.get();
    }

    public long cacheMisses() {
        return cacheMisses.get();
    }

    public long offlineModeUsage() {
        return offlineModeUsage.get();
    }

    public Map<ValidationReason, Long> failureCountsByReason() {
        if (failuresByReason.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<ValidationReason, Long> snapshot = new TreeMap<>();
        for (Map.Entry<ValidationReason, AtomicLong> entry : failuresByReason.entrySet()) {
            snapshot.put(entry.getKey(), entry.getValue().get());
        }
        return snapshot;
    }

    /**
     * Validation latency percentile over the last {@value #LATENCY_WINDOW} validations.
     *
     * @param percentile between 0 and 1
     */
    public long validationLatencyPercentile(double percentile) {
        return validationLatency.percentile(percentile);
    }

    public long phoneHomeLatencyPercentile(double percentile) {
        return phoneHomeLatency.percentile(percentile);
    }

    public double validationSuccessRate() {
        return ratio(validationSuccess.get(), validations.get());
    }

    public double cacheHitRate() {
        return ratio(cacheHits.get(), cacheHits.get() + cacheMisses.get());
    }

    public void reset() {
        validations.set(0);
        validationSuccess.set(0);
        validationFailure.set(0);
        phoneHome.set(0);
        phoneHomeSuccess.set(0);
        phoneHomeFailure.set(0);
        cacheHits.set(0);
        cacheMisses.set(0);
        offlineModeUsage.set(0);
        failuresByReason.clear();
        validationLatency.clear();
        phoneHomeLatency.clear();
    }

    /**
     * Render the counters in the Prometheus text exposition format.
     */
    public String toPrometheus() {
        StringBuilder builder = new StringBuilder();
        counter(builder, "license_validation_total", "Total number of license validations", validations.get());
        counter(builder, "license_validation_success", "Total successful validations", validationSuccess.get());
        counter(builder, "license_validation_failure", "Total failed validations", validationFailure.get());
        gauge(builder, "license_validation_success_rate", "Success rate of validations",
                format4(validationSuccessRate()));
        gauge(builder, "license_validation_latency_p50", "P50 validation latency in ms", validationLatency.percentile(0.5));
        gauge(builder, "license_validation_latency_p95", "P95 validation latency in ms", validationLatency.percentile(0.95));
        gauge(builder, "license_validation_latency_p99", "P99 validation latency in ms", validationLatency.percentile(0.99));
        counter(builder, "license_phone_home_total", "Total phone-home attempts", phoneHome.get());
        gauge(builder, "license_phone_home_success_rate", "Phone-home success rate",
                format4(ratio(phoneHomeSuccess.get(), phoneHome.get())));
        gauge(builder, "license_phone_home_latency_p95", "P95 phone-home latency in ms", phoneHomeLatency.percentile(0.95));
        gauge(builder, "license_cache_hit_rate", "Cache hit rate", format4(cacheHitRate()));
        counter(builder, "license_offline_mode_usage", "Times validation fell back to offline mode", offlineModeUsage.get());
        builder.append("# HELP license_errors_by_reason Validation errors grouped by reason\n");
        builder.append("# TYPE license_errors_by_reason counter\n");
        for (Map.Entry<ValidationReason, Long> entry : failureCountsByReason().entrySet()) {
            builder.append("license_errors_by_reason{reason=\"")
                    .append(entry.getKey().name())
                    .append("\"} ")
                    .append(entry.getValue())
                    .append('\n');
        }
        return builder.toString();
    }

    private static void counter(StringBuilder builder, String name, String help, Object value) {
        metric(builder, name, help, "counter", value);
    }

    private static void gauge(StringBuilder builder, String name, String help, Object value) {
        metric(builder, name, help, "gauge", value);
    }

    private static void metric(StringBuilder builder, String name, String help, String type, Object value) {
        builder.append("# HELP ").append(name).append(' ').append(help).append('\n');
        builder.append("# TYPE ").append(name).append(' ').append(type).append('\n');
        builder.append(name).append(' ').append(value).append("\n\n");
    }

    private static String format4(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static double ratio(long part, long total) {
        return total == 0 ? 0.0 : (double) part / total;
    }

    private static final class LatencyWindow {
        private final Deque<Long> samples = new ArrayDeque<>();

        synchronized void add(long latencyMs) {
            samples.addLast(Math.max(latencyMs, 0L));
            while (samples.size() > LATENCY_WINDOW) {
                samples.removeFirst();
            }
        }

        synchronized void clear() {
            samples.clear();
        }

        /**
         * Nearest-rank percentile; 0 when no samples were recorded.
         */
        long percentile(double percentile) {
            long[] sorted;
            synchronized (this) {
                if (samples.isEmpty()) {
                    return 0L;
                }
                sorted = samples.stream().mapToLong(Long::longValue).toArray();
            }
            Arrays.sort(sorted);
            int index = (int) Math.ceil(sorted.length * percentile) - 1;
            return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
        }
    }
}
