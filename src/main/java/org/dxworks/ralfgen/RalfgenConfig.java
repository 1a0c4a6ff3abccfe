package org.dxworks.ralfgen;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class RalfgenConfig {

    private static final int DEFAULT_BYTES_PER_WORD = 4;
    private static final String CONFIG_FILE_NAME = "ralfgen-config.yml";

    private final int bytesPerWord;
    private final String sheet;

    private RalfgenConfig(int bytesPerWord, String sheet) {
        this.bytesPerWord = bytesPerWord;
        this.sheet = sheet;
    }

    public int getBytesPerWord() {
        return bytesPerWord;
    }

    /**
     * Sheet name or index to read, or null for the first sheet.
     */
    public String getSheet() {
        return sheet;
    }

    public static RalfgenConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static RalfgenConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(yamlConfig.bytesPerWord != null ? yamlConfig.bytesPerWord : DEFAULT_BYTES_PER_WORD,
                        yamlConfig.sheet);
            }
        } catch (IOException e) {
            System.err.println("Warning: ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static RalfgenConfig with(int bytesPerWord, String sheet) {
        int effectiveBytesPerWord = bytesPerWord > 0 ? bytesPerWord : DEFAULT_BYTES_PER_WORD;
        String effectiveSheet = (sheet != null && !sheet.isBlank()) ? sheet : null;
        return new RalfgenConfig(effectiveBytesPerWord, effectiveSheet);
    }

    public static RalfgenConfig defaults() {
        return new RalfgenConfig(DEFAULT_BYTES_PER_WORD, null);
    }

    private static class YamlConfig {
        public Integer bytesPerWord;
        public String sheet;
    }
}
