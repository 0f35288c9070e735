package im.arun.compextract.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String DEFAULT_RESOURCE = "extractor.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ExtractorConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ExtractorConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), ExtractorConfig.class);
                }
                logger.warn("Config file not found: {}", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, ExtractorConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new ExtractorConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ExtractorConfig();
        }
    }

    public ExtractorConfig load() {
        return load(null);
    }

    public ExtractorConfig load(Map<String, Object> userOptions) {
        ExtractorConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "min_children_for_significance":
                    case "minChildrenForSignificance":
                        if (value instanceof Integer) config.setMinChildrenForSignificance((Integer) value);
                        break;
                    case "synthesize_visibility_gears":
                    case "synthesizeVisibilityGears":
                        config.setSynthesizeVisibilityGears(parseBoolean(value));
                        break;
                    case "render_scale":
                    case "renderScale":
                        if (value instanceof Number) config.setRenderScale(((Number) value).doubleValue());
                        break;
                    case "log_dir":
                    case "logDir":
                        if (value instanceof String) config.setLogDir((String) value);
                        break;
                    case "deny_name_substrings":
                    case "denyNameSubstrings":
                        if (value instanceof List) config.setDenyNameSubstrings(toStringList((List<?>) value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
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

    private List<String> toStringList(List<?> values) {
        List<String> result = new ArrayList<>();
        for (Object value : values) {
            if (value != null) {
                result.add(value.toString());
            }
        }
        return result;
    }

    private ExtractorConfig copyConfig(ExtractorConfig source) {
        // Round-trip through the mapper so nested keyword lists are not shared
        try {
            return yamlMapper.readValue(yamlMapper.writeValueAsBytes(source), ExtractorConfig.class);
        } catch (IOException e) {
            logger.warn("Failed to copy configuration, using defaults: {}", e.getMessage());
            return new ExtractorConfig();
        }
    }
}
