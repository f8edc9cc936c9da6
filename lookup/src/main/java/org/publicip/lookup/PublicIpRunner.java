package org.publicip.lookup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.commons.cli.*;
import org.jetbrains.annotations.NotNull;
import org.publicip.Common;
import org.publicip.PropertiesBuilder;
import org.publicip.cache.CacheSettings;
import org.publicip.cache.ResponseCache;
import org.publicip.errors.AllProvidersFailedException;
import org.publicip.errors.CacheException;
import org.publicip.errors.ConfigurationException;
import org.publicip.errors.LookupException;
import org.publicip.errors.PublicIpException;
import org.publicip.models.LookupResponse;
import org.publicip.models.ProviderEntry;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * The command-line front end.
 * <p>
 * Looks up the public address of this machine, or the given target addresses, and prints the responses.
 */
public class PublicIpRunner {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(PublicIpRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_PROPERTIES = 2;
    static final int EXIT_LOOKUP = 3;
    static final int EXIT_CACHE = 4;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs the front end.
     *
     * @param args the command line arguments
     * @param out  the stream the responses are printed to
     * @return the exit code
     */
    static int run(String[] args, PrintStream out) {
        final var options = makeOptions();

        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            if (Arrays.stream(args).anyMatch(arg -> arg.equals("-h") || arg.equals("--help"))) {
                printHelp(options, out);
                return EXIT_OK;
            }

            System.err.println(e.getMessage());
            printHelp(options, System.err);
            return EXIT_USAGE;
        }

        if (cmd.hasOption("h")) {
            printHelp(options, out);
            return EXIT_OK;
        }

        final Properties properties;
        try {
            properties = initProperties(cmd);
        } catch (IOException e) {
            Logger.error("Failed to load properties: {}", e.getMessage());
            return EXIT_PROPERTIES;
        }

        final LookupOptions lookupOptions;
        final CacheSettings cacheSettings;
        final List<InetAddress> targets;
        try {
            lookupOptions = initLookupOptions(cmd, properties);
            cacheSettings = CacheSettings.fromProperties(properties);
            targets = initTargets(cmd);
        } catch (ConfigurationException e) {
            Logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("clear-cache")) {
            return clearCache(cacheSettings);
        }

        for (var entry : lookupOptions.providers()) {
            Logger.debug("Using provider: {}", entry.provider());
        }

        var resolver = FallbackResolver.fromOptions(lookupOptions);
        var cachedLookup = new CachedLookup(cacheSettings, resolver);
        var useCache = !cmd.hasOption("no-cache");
        var flush = cmd.hasOption("flush");
        // A null target stands for the caller's own address
        var lookups = targets.isEmpty() ? Collections.<InetAddress>singletonList(null) : targets;

        var responses = new ArrayList<LookupResponse>();
        try {
            for (var target : lookups) {
                var future = useCache
                        ? cachedLookup.performCachedLookup(lookupOptions.providers(), target, lookupOptions.ttl(),
                        flush)
                        : resolver.lookupWithFallback(lookupOptions.providers(), target);
                responses.add(Common.await(future));
            }
        } catch (AllProvidersFailedException e) {
            Logger.error("Lookup failed");
            for (var failure : e.getFailures()) {
                Logger.error("  {}", failure.getMessage());
            }
            return EXIT_LOOKUP;
        } catch (LookupException | ConfigurationException e) {
            Logger.error("Lookup failed: {}", e.getMessage());
            return EXIT_LOOKUP;
        } catch (CacheException e) {
            Logger.error("Cache failure: {}", e.getMessage());
            return EXIT_CACHE;
        } catch (PublicIpException e) {
            Logger.error("Unexpected failure", e);
            return EXIT_LOOKUP;
        }

        printResponses(responses, cmd.hasOption("json"), out);
        return EXIT_OK;
    }

    private static int clearCache(CacheSettings settings) {
        try {
            new ResponseCache(settings).delete();
            Logger.info("Deleted cache file {}", settings.path());
        } catch (CacheException e) {
            if (e.getKind() != CacheException.Kind.NOT_FOUND) {
                Logger.error("Cannot delete the cache: {}", e.getMessage());
                return EXIT_CACHE;
            }
            Logger.info("No cache file at {}", settings.path());
        }
        return EXIT_OK;
    }

    private static void printResponses(List<LookupResponse> responses, boolean json, PrintStream out) {
        if (json) {
            final ObjectMapper mapper = Common.makeMapper()
                    .configure(SerializationFeature.INDENT_OUTPUT, true)
                    .build();
            try {
                var value = responses.size() == 1 ? responses.get(0) : responses;
                out.println(mapper.writeValueAsString(value));
            } catch (JsonProcessingException e) {
                // Responses are plain records
                throw new IllegalStateException(e);
            }
            return;
        }

        for (int i = 0; i < responses.size(); i++) {
            if (i > 0) {
                out.println();
            }
            out.println(responses.get(i).describe());
        }
    }

    /**
     * Merges the provider, TTL and timeout settings from the configuration and the command line.
     */
    @NotNull
    private static LookupOptions initLookupOptions(CommandLine cmd, Properties properties)
            throws ConfigurationException {
        var options = LookupOptions.fromProperties(properties);

        var providers = options.providers();
        var cmdLineProviders = cmd.getOptionValues("provider");
        if (cmdLineProviders != null) {
            var parsed = new ArrayList<ProviderEntry>();
            for (var value : cmdLineProviders) {
                parsed.add(ProviderRegistry.parse(value));
            }
            providers = parsed;
        }

        var ttl = options.ttl();
        if (cmd.hasOption("ttl")) {
            var value = cmd.getOptionValue("ttl");
            ttl = "none".equalsIgnoreCase(value.trim()) ? null : LookupOptions.parseTtl(value);
        }

        return new LookupOptions(providers, ttl, options.timeout(), options.blocking());
    }

    @NotNull
    private static List<InetAddress> initTargets(CommandLine cmd) throws ConfigurationException {
        var targets = new ArrayList<InetAddress>();
        var values = cmd.getOptionValues("target");
        if (values == null) {
            return targets;
        }

        for (var value : values) {
            var address = Common.parseAddress(value);
            if (address == null) {
                throw new ConfigurationException(ConfigurationException.Kind.INVALID_VALUE,
                        "Not an IP address: " + value);
            }
            targets.add(address);
        }
        return targets;
    }

    /**
     * Creates the command line options.
     */
    @NotNull
    private static Options makeOptions() {
        final var options = new Options();
        options.addOption("h", "help", false, "Print this help message");

        options.addOption(Option.builder("p")
                .longOpt("properties")
                .desc("Path to a configuration file")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("o")
                .longOpt("option")
                .desc("A properties key/value to add to the configuration")
                .argName("key=value")
                .hasArg()
                .build());
        options.addOption(Option.builder("P")
                .longOpt("provider")
                .desc("A provider to use, optionally followed by its API key; repeat to set a fallback order")
                .argName("name [key]")
                .hasArg()
                .build());
        options.addOption(Option.builder("t")
                .longOpt("target")
                .desc("An IP address to look up instead of the public address; may be repeated")
                .argName("ip")
                .hasArg()
                .build());
        options.addOption(Option.builder()
                .longOpt("ttl")
                .desc("Seconds a cached response stays valid, or 'none' to never expire")
                .argName("seconds")
                .hasArg()
                .build());

        options.addOption(null, "flush", false, "Ignore the cached response");
        options.addOption(null, "no-cache", false, "Do not read or write the cache");
        options.addOption(null, "clear-cache", false, "Delete the cache file and exit");
        options.addOption(null, "json", false, "Print the responses as JSON");

        return options;
    }

    /**
     * Initializes the properties from the file and the --option passed in the command line.
     *
     * @param cmd The parsed command line arguments.
     * @return The initialized Properties instance.
     * @throws IOException if the properties file cannot be read
     */
    private static Properties initProperties(CommandLine cmd) throws IOException {
        final Properties fileProps = new Properties();
        if (cmd.hasOption("properties")) {
            var path = cmd.getOptionValue("properties");
            try (var inStream = new FileInputStream(path)) {
                fileProps.load(inStream);
            }
        }

        // The --option values override the file
        final var props = new PropertiesBuilder(fileProps);
        var cmdLineProperties = cmd.getOptionValues("option");
        if (cmdLineProperties != null) {
            for (var option : cmdLineProperties) {
                if (option.contains("=")) {
                    var parts = option.split("=", 2);
                    props.add(parts[0].trim(), parts[1]);
                } else {
                    Logger.warn("Ignoring invalid command-line option: {}", option);
                }
            }
        }

        return props.get();
    }

    private static void printHelp(Options options, PrintStream stream) {
        final var formatter = new HelpFormatter();
        var writer = new PrintWriter(stream);
        formatter.printHelp(writer, 119, "public-ip [options]", "", options,
                formatter.getLeftPadding(), formatter.getDescPadding(), "");
        writer.flush();
    }
}
