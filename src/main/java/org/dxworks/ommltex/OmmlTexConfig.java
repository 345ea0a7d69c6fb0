package org.dxworks.ommltex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class OmmlTexConfig {

    private static final Logger LOG = LoggerFactory.getLogger(OmmlTexConfig.class);

    private static final long DEFAULT_MAX_FILE_BYTES = 5_000_000L;
    private static final String CONFIG_FILE_NAME = "ommltex-config.yml";
    private static final MathWrapping DEFAULT_MATH_WRAPPING = MathWrapping.NONE;

    private final long maxFileBytes;
    private final MathWrapping mathWrapping;

    private OmmlTexConfig(long maxFileBytes, MathWrapping mathWrapping) {
        this.maxFileBytes = maxFileBytes;
        this.mathWrapping = mathWrapping;
    }

    public long getMaxFileBytes() {
        return maxFileBytes;
    }

    public MathWrapping getMathWrapping() {
        return mathWrapping;
    }

    public static OmmlTexConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static OmmlTexConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Long maxFileBytes = yamlConfig.maxFileBytes;
                MathWrapping mathWrapping = MathWrapping.fromName(yamlConfig.mathWrapping);
                if (yamlConfig.mathWrapping != null && mathWrapping == null) {
                    LOG.warn("Unknown mathWrapping '{}' in {}, using {}", yamlConfig.mathWrapping, configPath,
                            DEFAULT_MATH_WRAPPING.getName());
                }

                long effectiveMaxFileBytes = (maxFileBytes != null && maxFileBytes > 0)
                        ? maxFileBytes
                        : DEFAULT_MAX_FILE_BYTES;
                MathWrapping effectiveMathWrapping = mathWrapping != null ? mathWrapping : DEFAULT_MATH_WRAPPING;

                return new OmmlTexConfig(effectiveMaxFileBytes, effectiveMathWrapping);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static OmmlTexConfig with(long maxFileBytes, MathWrapping mathWrapping) {
        long effectiveMaxFileBytes = maxFileBytes > 0 ? maxFileBytes : DEFAULT_MAX_FILE_BYTES;
        return new OmmlTexConfig(effectiveMaxFileBytes, mathWrapping != null ? mathWrapping : DEFAULT_MATH_WRAPPING);
    }

    public static OmmlTexConfig defaults() {
        return new OmmlTexConfig(DEFAULT_MAX_FILE_BYTES, DEFAULT_MATH_WRAPPING);
    }

    private static class YamlConfig {
        public Long maxFileBytes;
        public String mathWrapping;
    }
}
