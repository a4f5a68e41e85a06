package net.spookly.licensegate.config;

import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.licensegate.token.TokenRedactor;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with sensitive values redacted.
 */
public final class ConfigPrinter {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(LicenseGateConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        redactSensitiveValues(data);
        Yaml yaml = new Yaml();
        return yaml.dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redactSensitiveValues(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Object license = data.get("license");
        if (license instanceof Map) {
            Map<String, Object> licenseMap = (Map<String, Object>) license;
            Object key = licenseMap.get("key");
            if (key != null) {
                licenseMap.put("key", TokenRedactor.redact(key.toString()));
            }
        }
    }
}
