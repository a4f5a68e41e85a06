package net.spookly.licensegate.cache;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.spookly.licensegate.claims.ClaimsJson;
import net.spookly.licensegate.claims.ClaimsSchemaException;
import net.spookly.licensegate.claims.ClaimsValidator;
import net.spookly.licensegate.claims.LicenseClaims;
import net.spookly.licensegate.config.ConfigException;
import net.spookly.licensegate.token.TokenHashes;
import net.spookly.licensegate.token.TokenRedactor;
import net.spookly.licensegate.validation.ValidationReason;
import net.spookly.licensegate.validation.ValidationResult;

/**
 * Durable cache of validation results, one JSON file per token under the cache directory.
 *
 * <p>File names are the SHA-256 of the token, so the token itself never lands on disk. Entries
 * older than the offline window, and entries that cannot be parsed, are deleted when read.
 * I/O failures are reported on stderr and never reach the caller.
 */
public final class OfflineCacheStore {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String EXTENSION = ".json";

    private final Path cacheDir;
    private final Duration maxAge;
    private final Clock clock;

    public OfflineCacheStore(Path cacheDir, int offlineDays) {
        this(cacheDir, offlineDays, Clock.systemUTC());
    }

    public OfflineCacheStore(Path cacheDir, int offlineDays, Clock clock) {
        if (cacheDir == null) {
            throw new ConfigException("Cache directory is required");
        }
        if (offlineDays <= 0) {
            throw new ConfigException("Offline cache days must be greater than 0");
        }
        this.cacheDir = cacheDir;
        this.maxAge = Duration.ofDays(offlineDays);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Path cacheDir() {
        return cacheDir;
    }

    public Optional<ValidationResult> get(String token) {
        return lookup(token).asOptional();
    }

    /**
     * Read the entry for a token, removing it when it is expired or unreadable.
     */
    public CacheLookup lookup(String token) {
        Path path = pathFor(token);
        if (!Files.isRegularFile(path)) {
            return CacheLookup.miss();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            delete(path);
            return CacheLookup.corrupt();
        }
        if (root == null || !root.isObject()) {
            delete(path);
            return CacheLookup.corrupt();
        }
        JsonNode cachedAt = root.get("cachedAt");
        if (cachedAt == null || !cachedAt.isIntegralNumber()) {
            delete(path);
            return CacheLookup.corrupt();
        }
        long ageMs = clock.millis() - cachedAt.asLong();
        if (ageMs > maxAge.toMillis()) {
            delete(path);
            return CacheLookup.expired();
        }
        ValidationResult result;
        try {
            result = readResult(root.get("validationResult"));
        } catch (CorruptEntryException | ClaimsSchemaException e) {
            delete(path);
            return CacheLookup.corrupt();
        }
        return CacheLookup.hit(result);
    }

    /**
     * Store a result for a token, replacing any previous entry atomically.
     */
    public void put(String token, ValidationResult result) {
        if (result == null) {
            return;
        }
        Path path = pathFor(token);
        ObjectNode root = MAPPER.createObjectNode();
        root.set("validationResult", writeResult(result));
        root.put("cachedAt", clock.millis());
        Path temp = null;
        try {
            Files.createDirectories(cacheDir);
            temp = Files.createTempFile(cacheDir, path.getFileName().toString(), ".tmp");
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
            moveIntoPlace(temp, path);
            temp = null;
        } catch (IOException e) {
            System.err.println("Failed to write license cache entry "
                    + TokenRedactor.shortKey(keyFor(token)) + ": " + e.getMessage());
        } finally {
            if (temp != null) {
                delete(temp);
            }
        }
    }

    public void clear(String token) {
        delete(pathFor(token));
    }

    /**
     * Remove every cache entry in the cache directory. Other files are left untouched.
     */
    public void clearAll() {
        if (!Files.isDirectory(cacheDir)) {
            return;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(cacheDir, "*" + EXTENSION)) {
            for (Path entry : entries) {
                delete(entry);
            }
        } catch (IOException e) {
            System.err.println("Failed to clear license cache " + cacheDir + ": " + e.getMessage());
        }
    }

    Path pathFor(String token) {
        return cacheDir.resolve(keyFor(token) + EXTENSION);
    }

    private static String keyFor(String token) {
        return TokenHashes.sha256Hex(token == null ? "" : token);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("Failed to delete license cache entry " + path.getFileName() + ": " + e.getMessage());
        }
    }

    private static ObjectNode writeResult(ValidationResult result) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("valid", result.valid());
        if (result.reason() != null) {
            node.put("reason", result.reason().name());
        }
        if (result.detail() != null) {
            node.put("detail", result.detail());
        }
        if (result.claims() != null) {
            node.set("claims", ClaimsJson.toNode(result.claims()));
        }
        return node;
    }

    private static ValidationResult readResult(JsonNode node) throws CorruptEntryException, ClaimsSchemaException {
        if (node == null || !node.isObject()) {
            throw new CorruptEntryException("validationResult missing");
        }
        JsonNode valid = node.get("valid");
        if (valid == null || !valid.isBoolean()) {
            throw new CorruptEntryException("valid flag missing");
        }
        JsonNode claimsNode = node.get("claims");
        LicenseClaims claims = claimsNode == null || claimsNode.isNull() ? null : ClaimsValidator.validate(claimsNode);
        JsonNode detailNode = node.get("detail");
        String detail = detailNode == null || !detailNode.isTextual() ? null : detailNode.asText();
        if (valid.asBoolean()) {
            if (claims == null) {
                throw new CorruptEntryException("valid entry without claims");
            }
            return ValidationResult.valid(claims);
        }
        JsonNode reasonNode = node.get("reason");
        if (reasonNode == null || !reasonNode.isTextual()) {
            throw new CorruptEntryException("invalid entry without reason");
        }
        try {
            return ValidationResult.invalid(ValidationReason.valueOf(reasonNode.asText()), detail, claims);
        } catch (IllegalArgumentException e) {
            throw new CorruptEntryException("unknown reason " + reasonNode.asText());
        }
    }

    private static final class CorruptEntryException extends Exception {
        private CorruptEntryException(String message) {
            super(message);
        }
    }
}
