package net.spookly.licensegate.config;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects non-fatal configuration warnings (for example, a plain-text phone-home URL).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(LicenseGateConfig config, Path configPath) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        Path baseDir = configPath == null ? null : configPath.getParent();
        LicenseGateConfig.PhoneHomeConfig phoneHome = config.phoneHome;
        if (phoneHome != null && phoneHome.serverUrl != null && isPlainHttp(phoneHome.serverUrl)) {
            warnings.add("phoneHome.serverUrl uses plain http; license keys are sent in clear text");
        }
        LicenseGateConfig.CacheConfig cache = config.cache;
        if (cache != null) {
            warnIfWorldReadable(warnings, "cache.dir", cache.dir, baseDir);
        }
        return warnings;
    }

    private static boolean isPlainHttp(String serverUrl) {
        try {
            return "http".equalsIgnoreCase(URI.create(serverUrl.trim()).getScheme());
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    private static void warnIfWorldReadable(List<String> warnings, String label, String value, Path baseDir) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        Path resolved = resolvePath(baseDir, value.trim());
        if (resolved == null || !Files.exists(resolved)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(resolved, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            Set<PosixFilePermission> permissions = view.readAttributes().permissions();
            if (permissions.contains(PosixFilePermission.OTHERS_READ)) {
                warnings.add(label + " is world-readable: " + resolved);
            }
        } catch (IOException e) {
            warnings.add(label + " permissions could not be read: " + e.getMessage());
        }
    }

    private static Path resolvePath(Path baseDir, String rawValue) {
        try {
            Path path = Paths.get(rawValue);
            if (baseDir != null && !path.isAbsolute()) {
                return baseDir.resolve(path).normalize();
            }
            return path;
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
