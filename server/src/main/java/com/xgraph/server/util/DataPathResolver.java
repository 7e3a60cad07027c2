package com.xgraph.server.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;

public class DataPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(DataPathResolver.class);

    public static final String DATA_DIR_PROPERTY = "xgraph.data.dir";
    public static final String CONFIG_RESOURCE = "/xgraph_config.json";

    public static String resolveDataDirectory() {
        return resolveDataDirectory(readConfigText("dataDirectory"));
    }

    /**
     * @param configured data directory from an already loaded configuration, may be null
     */
    public static String resolveDataDirectory(String configured) {
        // 1. System property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Config file
        if (configured != null && !configured.isEmpty()) {
            return configured;
        }

        // 3. Default
        return ".";
    }

    /**
     * Path of the forest document to load at startup, or null when none is configured.
     * Relative names are resolved against the data directory.
     */
    public static String resolveDataFile() {
        return resolveDataFile(readConfigText("dataDirectory"), readConfigText("dataFile"));
    }

    public static String resolveDataFile(String configuredDirectory, String dataFile) {
        if (dataFile == null || dataFile.isEmpty()) {
            return null;
        }
        if (new File(dataFile).isAbsolute()) {
            return dataFile;
        }
        return resolveDataDirectory(configuredDirectory) + File.separator + dataFile;
    }

    private static String readConfigText(String field) {
        try {
            ObjectMapper mapper = new ObjectMapper();
            try (InputStream is = DataPathResolver.class.getResourceAsStream(CONFIG_RESOURCE)) {
                if (is != null) {
                    JsonNode root = mapper.readTree(is);
                    if (root.hasNonNull(field)) {
                        String value = root.get(field).asText();
                        if (value != null && !value.isEmpty()) {
                            return value;
                        }
                    }
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to read {} from config: {}", field, e.getMessage());
        }
        return null;
    }
}
