package net.spookly.licensegate.machine;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a hardware identifier per OS family and falls back to the host name.
 *
 * <p>Sources, in order: macOS {@code IOPlatformUUID} then hardware serial; Linux
 * {@code /etc/machine-id} then {@code /var/lib/dbus/machine-id}; Windows {@code MachineGuid};
 * then the host name on every platform.
 */
public final class PlatformMachineIdentityProvider implements MachineIdentityProvider {
    static final long COMMAND_TIMEOUT_SECONDS = 5;
    static final Path ETC_MACHINE_ID = Path.of("/etc/machine-id");
    static final Path DBUS_MACHINE_ID = Path.of("/var/lib/dbus/machine-id");

    private static final Pattern MAC_UUID = Pattern.compile("\"IOPlatformUUID\"\\s*=\\s*\"([^\"]+)\"");
    private static final Pattern MAC_SERIAL = Pattern.compile("Serial Number \\(system\\):\\s*(.+)");
    private static final Pattern WINDOWS_GUID = Pattern.compile("MachineGuid\\s+REG_SZ\\s+(.+)");

    private final String osName;
    private final CommandRunner commands;
    private final FileReader files;
    private final HostNameLookup localHost;

    public PlatformMachineIdentityProvider() {
        this(
                System.getProperty("os.name", ""),
                PlatformMachineIdentityProvider::runCommand,
                PlatformMachineIdentityProvider::readFile,
                () -> InetAddress.getLocalHost().getHostName()
        );
    }

    PlatformMachineIdentityProvider(String osName, CommandRunner commands, FileReader files, HostNameLookup localHost) {
        this.osName = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        this.commands = commands;
        this.files = files;
        this.localHost = localHost;
    }

    @Override
    public String currentFingerprint() throws MachineIdentityException {
        return MachineFingerprints.hash(rawIdentifier());
    }

    /**
     * Platform identifier before hashing. Package-private so it never leaves this package.
     */
    String rawIdentifier() throws MachineIdentityException {
        List<String> failures = new ArrayList<>();
        String value;
        if (osName.startsWith("mac") || osName.contains("darwin")) {
            value = firstMatch(List.of("ioreg", "-rd1", "-c", "IOPlatformExpertDevice"), MAC_UUID, failures);
            if (value == null) {
                value = firstMatch(List.of("system_profiler", "SPHardwareDataType"), MAC_SERIAL, failures);
            }
        } else if (osName.contains("linux")) {
            value = fileContent(ETC_MACHINE_ID, failures);
            if (value == null) {
                value = fileContent(DBUS_MACHINE_ID, failures);
            }
        } else if (osName.startsWith("windows")) {
            value = firstMatch(
                    List.of("reg", "query", "HKEY_LOCAL_MACHINE\\SOFTWARE\\Microsoft\\Cryptography", "/v", "MachineGuid"),
                    WINDOWS_GUID,
                    failures
            );
        } else {
            value = null;
        }
        if (value == null) {
            value = hostName(failures);
        }
        if (value == null) {
            throw new MachineIdentityException("No machine identifier available: " + String.join("; ", failures));
        }
        return value;
    }

    private String firstMatch(List<String> command, Pattern pattern, List<String> failures) {
        String output;
        try {
            output = commands.run(command);
        } catch (IOException e) {
            failures.add(command.get(0) + ": " + e.getMessage());
            return null;
        }
        if (output == null) {
            failures.add(command.get(0) + ": no output");
            return null;
        }
        Matcher matcher = pattern.matcher(output);
        if (matcher.find()) {
            String value = matcher.group(1).trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        failures.add(command.get(0) + ": identifier not found in output");
        return null;
    }

    private String fileContent(Path path, List<String> failures) {
        try {
            String content = files.read(path);
            if (content != null && !content.isBlank()) {
                return content.trim();
            }
            failures.add(path + ": empty");
        } catch (IOException e) {
            failures.add(path + ": " + e.getMessage());
        }
        return null;
    }

    private String hostName(List<String> failures) {
        try {
            String output = commands.run(List.of("hostname"));
            if (output != null && !output.isBlank()) {
                return output.trim();
            }
            failures.add("hostname: no output");
        } catch (IOException e) {
            failures.add("hostname: " + e.getMessage());
        }
        try {
            String name = localHost.lookup();
            if (name != null && !name.isBlank()) {
                return name.trim();
            }
            failures.add("local host name is empty");
        } catch (IOException e) {
            failures.add("local host: " + e.getMessage());
        }
        return null;
    }

    static String runCommand(List<String> command) throws IOException {
        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        try {
            if (!process.waitFor(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("timed out after " + COMMAND_TIMEOUT_SECONDS + "s");
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IOException("exited with status " + process.exitValue());
            }
            return output;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", e);
        }
    }

    static String readFile(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @FunctionalInterface
    interface CommandRunner {
        String run(List<String> command) throws IOException;
    }

    @FunctionalInterface
    interface FileReader {
        String read(Path path) throws IOException;
    }

    @FunctionalInterface
    interface HostNameLookup {
        String lookup() throws IOException;
    }
}
