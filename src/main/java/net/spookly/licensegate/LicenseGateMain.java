package net.spookly.licensegate;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import net.spookly.licensegate.config.ConfigLoader;
import net.spookly.licensegate.config.ConfigPrinter;
import net.spookly.licensegate.config.ConfigWarnings;
import net.spookly.licensegate.config.LicenseGateConfig;
import net.spookly.licensegate.features.FeatureView;
import net.spookly.licensegate.machine.MachineIdentityException;
import net.spookly.licensegate.machine.PlatformMachineIdentityProvider;
import net.spookly.licensegate.remote.HttpPhoneHomeClient;
import net.spookly.licensegate.validation.LicenseValidator;
import net.spookly.licensegate.validation.ValidationAuditLogger;
import net.spookly.licensegate.validation.ValidationResult;

/**
 * Command line entry point: validates the configured license and prints a summary.
 */
public final class LicenseGateMain {
    private static final String DEFAULT_CONFIG = "config/licensegate.yaml";
    private static final int EXIT_INVALID_LICENSE = 2;

    private LicenseGateMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        if (options.printMachineId) {
            printMachineId();
            return;
        }
        Path configPath = options.configPath;
        LicenseGateConfig config = ConfigLoader.load(configPath);
        emitWarnings(config, configPath);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }

        LicenseValidator validator = new LicenseValidator(config, ValidationAuditLogger.INSTANCE);
        if (options.clearCache) {
            validator.clearCache();
            System.out.println("License cache cleared.");
            return;
        }
        if (config.phoneHome != null && config.phoneHome.serverUrl != null) {
            HttpPhoneHomeClient probe = new HttpPhoneHomeClient(config.phoneHome.serverUrl, 2000);
            if (!probe.isReachable()) {
                System.err.println("Licensing server " + config.phoneHome.serverUrl + " is not reachable, validating offline.");
            }
        }
        ValidationResult result = validator.validate(config.license.key);
        if (!result.valid()) {
            System.err.println("License invalid: " + result.reason()
                    + (result.detail() == null ? "" : " (" + result.detail() + ")"));
            System.exit(EXIT_INVALID_LICENSE);
            return;
        }
        printSummary(FeatureView.from(result));
    }

    private static void printSummary(FeatureView view) {
        FeatureView.CustomerInfo customer = view.customerInfo();
        System.out.println("License valid: tier=" + view.tier()
                + " company=" + customer.company()
                + " customer=" + customer.customerId());
        System.out.println("Expires: " + view.expiresAt() + " (" + view.daysUntilExpiration() + " days)");
        System.out.println("Features: " + String.join(", ", view.features()));
        for (Map.Entry<String, Long> limit : view.limits().entrySet()) {
            System.out.println("Limit " + limit.getKey() + "=" + limit.getValue());
        }
        if (view.isExpiringSoon()) {
            System.err.println("License expires in " + view.daysUntilExpiration() + " days, renew before "
                    + view.expiresAt() + ".");
        }
    }

    private static void printMachineId() {
        try {
            System.out.println(new PlatformMachineIdentityProvider().currentFingerprint());
        } catch (MachineIdentityException e) {
            System.err.println("Failed to determine machine id: " + e.getMessage());
            System.exit(1);
        }
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        boolean printMachineId = false;
        boolean clearCache = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig, printMachineId, clearCache);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
                continue;
            }
            if ("--print-machine-id".equals(arg)) {
                printMachineId = true;
                continue;
            }
            if ("--clear-cache".equals(arg)) {
                clearCache = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig, printMachineId, clearCache);
    }

    private static void emitWarnings(LicenseGateConfig config, Path configPath) {
        for (String warning : ConfigWarnings.collect(config, configPath)) {
            System.err.println("Config warning: " + warning);
        }
    }

    private record CliOptions(Path configPath,
                              boolean dryRun,
                              boolean printEffectiveConfig,
                              boolean printMachineId,
                              boolean clearCache) {
    }
}
