package paylink.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Loads payment configuration with priority:
 * 1. System Properties
 * 2. Environment Variables (dots replaced by underscores, upper case)
 * 3. Explicit file passed to the constructor, or external config/application.properties
 *    (working directory or -Dconfig.dir / CONFIG_DIR)
 * 4. Classpath application.properties (defaults embedded in the JAR)
 *
 * @since 19/10/2026
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final String CONFIG_FILE_NAME = "application.properties";
    private static final String EXTERNAL_CONFIG_FILE = "config/" + CONFIG_FILE_NAME;

    private final Properties properties;

    public ConfigurationLoader() {
        this.properties = loadProperties(null);
    }

    public ConfigurationLoader(String configFile) {
        this.properties = loadProperties(Paths.get(configFile));
    }

    private Properties loadProperties(Path explicitFile) {
        Properties props = new Properties();

        // Defaults first, every later source overrides
        loadFromClasspath(props);

        Path external = explicitFile != null ? explicitFile : findExternalFile();
        if (external != null) {
            if (Files.isRegularFile(external)) {
                try (InputStream input = Files.newInputStream(external)) {
                    Properties overrides = new Properties();
                    overrides.load(input);
                    props.putAll(overrides);
                    logger.info("Loaded payment configuration from: {}", external.toAbsolutePath());
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from '{}': {}", external, e.getMessage());
                }
            } else {
                logger.warn("Configuration file not found: {}", external.toAbsolutePath());
            }
        }

        if (props.isEmpty()) {
            logger.warn("No payment configuration found, every key falls back to its code default");
        }
        return props;
    }

    private Path findExternalFile() {
        String configDir = System.getProperty("config.dir", System.getenv("CONFIG_DIR"));
        if (configDir != null && !configDir.isBlank()) {
            return Paths.get(configDir, CONFIG_FILE_NAME).normalize();
        }

        Path workingDirConfig = Paths.get(EXTERNAL_CONFIG_FILE);
        if (Files.isRegularFile(workingDirConfig)) {
            return workingDirConfig;
        }
        logger.trace("External config not found at: {}", workingDirConfig.toAbsolutePath());
        return null;
    }

    private void loadFromClasspath(Properties props) {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (input != null) {
                props.load(input);
                logger.debug("Loaded classpath defaults from '{}'", CONFIG_FILE_NAME);
            }
        } catch (IOException e) {
            logger.debug("Error loading classpath configuration '{}': {}", CONFIG_FILE_NAME, e.getMessage());
        }
    }

    /**
     * Resolved value of a key, the default if no source defines it
     */
    public String getString(String key, String defaultValue) {
        for (ESource source : ESource.values()) {
            String value = source.lookup(key, properties);
            if (value != null) {
                logger.debug("Property '{}' = '{}' ({})", key, value, source);
                return source == ESource.FILE ? value.trim() : value;
            }
        }
        logger.debug("Property '{}' not set, default '{}'", key, defaultValue);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        return getNumber(key, defaultValue, Integer::parseInt);
    }

    public long getLong(String key, long defaultValue) {
        return getNumber(key, defaultValue, Long::parseLong);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        return value == null || value.isBlank() ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    private <T extends Number> T getNumber(String key, T defaultValue, Function<String, T> parser) {
        String value = getString(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return parser.apply(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Property '{}' is not a number: '{}', keeping default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private enum ESource {
        SYSTEM_PROPERTY {
            @Override
            String lookup(String key, Properties file) {
                return System.getProperty(key);
            }
        },
        ENVIRONMENT {
            @Override
            String lookup(String key, Properties file) {
                return System.getenv(key.replace('.', '_').toUpperCase(Locale.ROOT));
            }
        },
        FILE {
            @Override
            String lookup(String key, Properties file) {
                return file.getProperty(key);
            }
        };

        abstract String lookup(String key, Properties file);
    }
}
