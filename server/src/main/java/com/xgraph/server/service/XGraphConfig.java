package com.xgraph.server.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xgraph.server.data.tree.VisibilityConfig;
import com.xgraph.server.fit.FitOptions;
import com.xgraph.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Root of {@code xgraph_config.json}. Missing sections fall back to their defaults.
 */
public class XGraphConfig {

    private static final Logger logger = LoggerFactory.getLogger(XGraphConfig.class);

    public String dataDirectory;
    public String dataFile;
    public VisibilityConfig visibility = VisibilityConfig.all();
    public FitOptions fit = FitOptions.defaults();

    public static XGraphConfig defaults() {
        return new XGraphConfig();
    }

    public static XGraphConfig load() {
        try (InputStream is = XGraphConfig.class.getResourceAsStream(DataPathResolver.CONFIG_RESOURCE)) {
            if (is == null) {
                logger.info("No {} on the classpath, using defaults", DataPathResolver.CONFIG_RESOURCE);
                return defaults();
            }
            return read(is);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load " + DataPathResolver.CONFIG_RESOURCE, e);
        }
    }

    public static XGraphConfig read(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        XGraphConfig config = mapper.readValue(is, XGraphConfig.class);
        if (config.visibility == null) {
            config.visibility = VisibilityConfig.all();
        }
        if (config.fit == null) {
            config.fit = FitOptions.defaults();
        }
        return config;
    }
}
