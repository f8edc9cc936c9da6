package org.publicip.cache;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.publicip.Common;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Finds the directory the cache file lives in.
 * <p>
 * The candidates are tried in this order, and the first one that exists or can be created wins:
 * <ol>
 *     <li>the platform cache directory ({@code $XDG_CACHE_HOME} or {@code ~/.cache}, {@code ~/Library/Caches},
 *     {@code %LOCALAPPDATA%}), with an application subdirectory,</li>
 *     <li>the platform data directory ({@code $XDG_DATA_HOME} or {@code ~/.local/share},
 *     {@code ~/Library/Application Support}, {@code %APPDATA%}), with an application subdirectory,</li>
 *     <li>the home directory,</li>
 *     <li>the working directory.</li>
 * </ol>
 */
public final class CacheLocation {
    public static final String COMPONENT_NAME = "cache-location";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(CacheLocation.class);

    public static final String APP_DIRECTORY = "public-ip-address";

    enum Platform {LINUX, MAC, WINDOWS}

    private final Function<String, String> _env;
    private final Platform _platform;
    private final Path _home;
    private final Path _workingDirectory;

    CacheLocation(@NotNull Function<String, String> env, @NotNull String osName, @Nullable Path home,
                  @NotNull Path workingDirectory) {
        _env = env;
        _platform = platformOf(osName);
        _home = home;
        _workingDirectory = workingDirectory;
    }

    /**
     * @return the location resolver of the running JVM
     */
    public static CacheLocation system() {
        var home = System.getProperty("user.home");
        return new CacheLocation(System::getenv, System.getProperty("os.name", ""),
                home == null || home.isBlank() ? null : Path.of(home),
                Path.of("").toAbsolutePath());
    }

    static Platform platformOf(String osName) {
        var name = osName.toLowerCase();
        if (name.startsWith("windows")) {
            return Platform.WINDOWS;
        } else if (name.startsWith("mac") || name.startsWith("darwin")) {
            return Platform.MAC;
        }
        return Platform.LINUX;
    }

    /**
     * Lists the candidate directories in order of preference. The working directory is always the last one.
     */
    public List<Path> candidates() {
        var result = new ArrayList<Path>();
        var cacheDir = cacheDirectory();
        if (cacheDir != null) {
            result.add(cacheDir.resolve(APP_DIRECTORY));
        }
        var dataDir = dataDirectory();
        if (dataDir != null) {
            result.add(dataDir.resolve(APP_DIRECTORY));
        }
        if (_home != null) {
            result.add(_home);
        }
        result.add(_workingDirectory);
        return result;
    }

    /**
     * Picks the first candidate directory that exists or can be created.
     *
     * @return the directory; the working directory if no other candidate is usable
     */
    public Path resolveDirectory() {
        for (var candidate : candidates()) {
            if (Files.isDirectory(candidate)) {
                return candidate;
            }

            try {
                Files.createDirectories(candidate);
                Logger.debug("Created cache directory {}", candidate);
                return candidate;
            } catch (IOException e) {
                Logger.debug("Cannot use {} as the cache directory: {}", candidate, e.getMessage());
            }
        }
        return _workingDirectory;
    }

    private @Nullable Path cacheDirectory() {
        return switch (_platform) {
            case WINDOWS -> envPath("LOCALAPPDATA");
            case MAC -> homeRelative("Library", "Caches");
            case LINUX -> {
                var xdg = envPath("XDG_CACHE_HOME");
                yield xdg != null ? xdg : homeRelative(".cache");
            }
        };
    }

    private @Nullable Path dataDirectory() {
        return switch (_platform) {
            case WINDOWS -> envPath("APPDATA");
            case MAC -> homeRelative("Library", "Application Support");
            case LINUX -> {
                var xdg = envPath("XDG_DATA_HOME");
                yield xdg != null ? xdg : homeRelative(".local", "share");
            }
        };
    }

    private @Nullable Path homeRelative(String first, String... more) {
        if (_home == null) {
            return null;
        }
        return _home.resolve(Path.of(first, more));
    }

    private @Nullable Path envPath(String name) {
        var value = _env.apply(name);
        if (value == null || value.isBlank()) {
            return null;
        }

        try {
            var path = Path.of(value);
            // XDG requires absolute paths, relative ones are ignored
            return path.isAbsolute() ? path : null;
        } catch (InvalidPathException e) {
            Logger.debug("Ignoring invalid path in {}: {}", name, e.getMessage());
            return null;
        }
    }
}
