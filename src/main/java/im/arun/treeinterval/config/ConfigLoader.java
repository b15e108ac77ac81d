package im.arun.treeinterval.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "tree-interval.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final TreeIntervalConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private TreeIntervalConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), TreeIntervalConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath", configPath);
            }

            InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
            if (resourceStream != null) {
                try (InputStream in = resourceStream) {
                    return yamlMapper.readValue(in, TreeIntervalConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new TreeIntervalConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new TreeIntervalConfig();
        }
    }

    public TreeIntervalConfig load() {
        return load(null);
    }

    public TreeIntervalConfig load(Map<String, Object> userOptions) {
        TreeIntervalConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "top_marker":
                case "topMarker":
                    config.setTopMarker(parseMarker(key, value, config.getTopMarker()));
                    break;
                case "chain_marker":
                case "chainMarker":
                    config.setChainMarker(parseMarker(key, value, config.getChainMarker()));
                    break;
                case "current_marker":
                case "currentMarker":
                    config.setCurrentMarker(parseMarker(key, value, config.getCurrentMarker()));
                    break;
                case "label_schema":
                case "labelSchema":
                    if (value instanceof String) config.setLabelSchema((String) value);
                    break;
                case "indent_size":
                case "indentSize":
                    if (value instanceof Integer) config.setIndentSize((Integer) value);
                    break;
                case "pretty_print":
                case "prettyPrint":
                    config.setPrettyPrint(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private char parseMarker(String key, Object value, char fallback) {
        if (value instanceof Character) {
            return (Character) value;
        }
        if (value instanceof String && ((String) value).length() == 1) {
            return ((String) value).charAt(0);
        }
        logger.warn("Ignoring {}: marker must be a single character, got {}", key, value);
        return fallback;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private TreeIntervalConfig copyConfig(TreeIntervalConfig source) {
        TreeIntervalConfig copy = new TreeIntervalConfig();
        copy.setTopMarker(source.getTopMarker());
        copy.setChainMarker(source.getChainMarker());
        copy.setCurrentMarker(source.getCurrentMarker());
        copy.setLabelSchema(source.getLabelSchema());
        copy.setIndentSize(source.getIndentSize());
        copy.setPrettyPrint(source.isPrettyPrint());
        return copy;
    }
}
