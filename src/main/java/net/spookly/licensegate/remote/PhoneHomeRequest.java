package net.spookly.licensegate.remote;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /validate}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PhoneHomeRequest {
    public static final String PROTOCOL_VERSION = "1.0.0";

    @JsonProperty("license_key")
    public String licenseKey;
    /**
     * Hashed machine fingerprint, omitted when machine binding is disabled.
     */
    @JsonProperty("machine_id")
    public String machineId;
    /**
     * Client time in epoch milliseconds.
     */
    @JsonProperty("timestamp")
    public long timestamp;
    @JsonProperty("version")
    public String version = PROTOCOL_VERSION;
}
