package org.publicip.cache;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.Common;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Derives a passphrase that identifies the current machine and user, used as the default secret of
 * the encrypted cache.
 * <p>
 * The machine ID of systemd or D-Bus is preferred; when neither is readable, the user and host names are used.
 */
public final class MachinePassphrase {
    public static final String COMPONENT_NAME = "machine-passphrase";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(MachinePassphrase.class);

    static final String PREFIX = "public-ip-address:";
    static final List<Path> MACHINE_ID_FILES = List.of(
            Path.of("/etc/machine-id"),
            Path.of("/var/lib/dbus/machine-id"));

    private MachinePassphrase() {
    }

    /**
     * @return the passphrase of this machine
     */
    public static @NotNull String resolve() {
        return resolve(MACHINE_ID_FILES, System.getProperty("user.name", ""), localHostName());
    }

    static @NotNull String resolve(@NotNull List<Path> idFiles, @NotNull String userName, @Nullable String hostName) {
        for (var file : idFiles) {
            var id = readId(file);
            if (id != null) {
                Logger.debug("Using the machine ID from {}", file);
                return PREFIX + id;
            }
        }

        Logger.debug("No machine ID available, using the user and host names");
        return PREFIX + userName + "@" + (hostName == null ? "localhost" : hostName);
    }

    private static @Nullable String readId(Path file) {
        if (!Files.isReadable(file)) {
            return null;
        }

        try {
            var id = Files.readString(file, StandardCharsets.UTF_8).trim();
            return id.isEmpty() ? null : id;
        } catch (IOException e) {
            Logger.debug("Cannot read {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static @Nullable String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            Logger.debug("Cannot resolve the local host name: {}", e.getMessage());
            return System.getenv("HOSTNAME");
        }
    }
}
