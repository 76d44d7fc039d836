package org.tacc.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Builds the application configuration from HOCON layers, strongest first:
 * <ol>
 *   <li>JVM system properties ({@code -Dtacc.shell.history-limit=20})</li>
 *   <li>Environment overrides using the {@code CONFIG_FORCE_} naming scheme of Typesafe Config</li>
 *   <li>The user file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after the layers are stacked, so an override also reaches every
 * value that refers to it.
 */
public final class ConfigLoader {

    /** User file looked up relative to the working directory. */
    static final Path DEFAULT_LOCATION = Path.of("config", "tacc.conf");

    private static final ConfigParseOptions USER_FILE_OPTIONS = ConfigParseOptions.defaults().setAllowMissing(false);

    private ConfigLoader() {
    }

    /**
     * How the user file was chosen.
     */
    public enum Source {
        OPTION,
        SYSTEM_PROPERTY,
        WORKING_DIRECTORY,
        DEFAULTS
    }

    /**
     * @param config The resolved configuration.
     * @param source How the user layer was chosen.
     * @param file   The user file, empty when only the defaults apply.
     */
    public record LoadedConfig(Config config, Source source, Optional<Path> file) {

        public String describe() {
            return switch (source) {
                case OPTION -> "using " + file.orElseThrow() + " (--config)";
                case SYSTEM_PROPERTY -> "using " + file.orElseThrow() + " (-Dconfig.file)";
                case WORKING_DIRECTORY -> "using " + file.orElseThrow();
                case DEFAULTS -> "no " + DEFAULT_LOCATION + " found, using built-in defaults";
            };
        }
    }

    /**
     * Picks the user file and loads the layered configuration.
     * <p>
     * The file given on the command line wins, then {@code -Dconfig.file}, then
     * {@code config/tacc.conf} in the working directory. Without any of these only
     * {@code reference.conf} and the overrides apply.
     *
     * @param explicitFile The {@code --config} value, or {@code null}.
     * @return The configuration and where it came from.
     * @throws IllegalArgumentException                if a requested file does not exist.
     * @throws com.typesafe.config.ConfigException     if a file cannot be parsed or resolved.
     */
    public static LoadedConfig load(Path explicitFile) {
        if (explicitFile != null) {
            return fromFile(requireFile(explicitFile, "--config"), Source.OPTION);
        }

        String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return fromFile(requireFile(Path.of(property), "-Dconfig.file"), Source.SYSTEM_PROPERTY);
        }

        if (Files.isRegularFile(DEFAULT_LOCATION)) {
            return fromFile(DEFAULT_LOCATION.toAbsolutePath(), Source.WORKING_DIRECTORY);
        }

        return new LoadedConfig(layered(ConfigFactory.empty()), Source.DEFAULTS, Optional.empty());
    }

    /**
     * Stacks the overrides on top of {@code userLayer} and {@code reference.conf}, then resolves.
     */
    static Config layered(Config userLayer) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironmentOverrides())
                .withFallback(userLayer)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static LoadedConfig fromFile(Path file, Source source) {
        Config userLayer = ConfigFactory.parseFile(file.toFile(), USER_FILE_OPTIONS);
        return new LoadedConfig(layered(userLayer), source, Optional.of(file));
    }

    private static Path requireFile(Path file, String origin) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(absolute)) {
            throw new IllegalArgumentException("Configuration file given via " + origin + " not found: " + absolute);
        }
        return absolute;
    }
}
