package net.spookly.licensegate.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves relative file path settings against the config directory.
 */
final class ConfigPathResolver {
    private ConfigPathResolver() {
    }

    static void resolve(LicenseGateConfig config, Path baseDir) {
        if (config == null || baseDir == null) {
            return;
        }
        LicenseGateConfig.CacheConfig cache = config.cache;
        if (cache != null) {
            cache.dir = resolvePath(baseDir, cache.dir);
        }
    }

    private static String resolvePath(Path baseDir, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return rawValue;
        }
        try {
            Path path = Paths.get(rawValue);
            if (!path.isAbsolute()) {
                path = baseDir.resolve(path).normalize();
            }
            return path.toString();
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + rawValue, e);
        }
    }
}
