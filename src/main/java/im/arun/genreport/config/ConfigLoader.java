package im.arun.genreport.config;

import com.fasterxml.jackson.core.JsonProcessingException;
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

/**
 * Loads {@link GenReportConfig}: an explicit YAML file first, then {@code genreport.yaml} on the
 * classpath, then built-in defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CLASSPATH_CONFIG = "genreport.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final GenReportConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private GenReportConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), GenReportConfig.class);
                }
                logger.warn("Config file {} not found, falling back to {}", configPath, CLASSPATH_CONFIG);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, GenReportConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", CLASSPATH_CONFIG);
            return new GenReportConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new GenReportConfig();
        }
    }

    public GenReportConfig load() {
        return load(null);
    }

    /**
     * Copy of the loaded configuration with user options merged in. Unknown keys are ignored
     * with a warning.
     */
    public GenReportConfig load(Map<String, Object> userOptions) {
        GenReportConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "island_preview_limit":
                case "islandPreviewLimit":
                    if (value instanceof Integer) config.setIslandPreviewLimit((Integer) value);
                    break;
                case "exception_start":
                case "exceptionStart":
                    if (value instanceof Integer) config.getExceptionBand().setStart((Integer) value);
                    break;
                case "exception_xrefs":
                case "exceptionXrefs":
                    config.getExceptionBand().setXrefs(parseList(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private List<String> parseList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null && !item.toString().isBlank()) {
                    out.add(item.toString().strip());
                }
            }
        } else if (value instanceof String) {
            for (String item : ((String) value).split(",")) {
                if (!item.isBlank()) {
                    out.add(item.strip());
                }
            }
        }
        return out;
    }

    private GenReportConfig copyConfig(GenReportConfig source) {
        try {
            return yamlMapper.treeToValue(yamlMapper.valueToTree(source), GenReportConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot copy configuration", e);
        }
    }
}
