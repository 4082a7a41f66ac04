package com.ecgpda.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Resolves the scanpath configuration: the file named by the
 * {@value #CONFIG_FILE_PROPERTY} system property if set, else the bundled
 * {@value #CONFIG_RESOURCE}, else {@link ScanpathConfig#defaults()}.
 */
public class ScanpathConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ScanpathConfigLoader.class);

    public static final String CONFIG_FILE_PROPERTY = "scanpath.config.file";
    public static final String CONFIG_RESOURCE = "/scanpath_config.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    public static ScanpathConfig load() {
        String path = System.getProperty(CONFIG_FILE_PROPERTY);
        if (path != null && !path.trim().isEmpty()) {
            try {
                ScanpathConfig config = withDefaults(mapper.readValue(new File(path), ScanpathConfig.class));
                logger.info("Loaded scanpath config from {}", path);
                return config;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read scanpath config " + path, e);
            }
        }

        try (InputStream is = ScanpathConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                ScanpathConfig config = read(is);
                logger.info("Loaded scanpath config from classpath {}", CONFIG_RESOURCE);
                return config;
            }
            logger.warn("{} not found on classpath, using default AOI layout", CONFIG_RESOURCE);
        } catch (IOException e) {
            logger.error("Failed to parse {}, using default AOI layout", CONFIG_RESOURCE, e);
        }
        return ScanpathConfig.defaults();
    }

    public static ScanpathConfig read(InputStream is) throws IOException {
        return withDefaults(mapper.readValue(is, ScanpathConfig.class));
    }

    private static ScanpathConfig withDefaults(ScanpathConfig config) {
        if (config.aoiRegions == null || config.aoiRegions.isEmpty()) {
            logger.warn("No AOI regions configured, falling back to default layout");
            config.aoiRegions = ScanpathConfig.defaults().aoiRegions;
        }
        if (config.minFixationDurationMs < 0) {
            logger.warn("Negative minFixationDurationMs {}, using {}", config.minFixationDurationMs,
                    ScanpathConfig.DEFAULT_MIN_FIXATION_DURATION_MS);
            config.minFixationDurationMs = ScanpathConfig.DEFAULT_MIN_FIXATION_DURATION_MS;
        }
        return config;
    }
}
