package com.outlierai.server.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

public class ConfigPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigPathResolver.class);

    public static final String CONFIG_PATH_PROPERTY = "outlier.config.path";
    public static final String DEFAULT_RESOURCE = "/ensemble_config.json";

    public static String resolveConfigPath() {
        // 1. System property pointing at a file
        String sysProp = System.getProperty(CONFIG_PATH_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }
        // 2. Bundled classpath resource
        return "classpath:" + DEFAULT_RESOURCE;
    }

    public static InputStream openConfig() throws IOException {
        String path = resolveConfigPath();
        if (path.startsWith("classpath:")) {
            String resource = path.substring("classpath:".length());
            InputStream is = ConfigPathResolver.class.getResourceAsStream(resource);
            if (is == null) {
                throw new IOException("Config resource not found on classpath: " + resource);
            }
            return is;
        }
        logger.info("Loading ensemble config from {}", path);
        return new FileInputStream(path);
    }
}
