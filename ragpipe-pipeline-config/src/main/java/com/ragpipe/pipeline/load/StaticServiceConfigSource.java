package com.ragpipe.pipeline.load;

import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.pipeline.ServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the services document from a file; when the file does not exist, from the bundled classpath resource
 * {@value #CLASSPATH_RESOURCE}.
 */
public final class StaticServiceConfigSource implements ServiceConfigSource {

    private static final Logger log = LoggerFactory.getLogger(StaticServiceConfigSource.class);

    public static final String CLASSPATH_RESOURCE = "services.yaml";

    private final Path file;
    private final ServiceConfigLoader loader;

    public StaticServiceConfigSource(Path file, ServiceConfigLoader loader) {
        this.file = file;
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    @Override
    public ServiceConfig load() {
        if (file != null && Files.isRegularFile(file)) {
            return loader.load(file);
        }
        log.info("Services file {} not found; using classpath resource {}", file, CLASSPATH_RESOURCE);
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = StaticServiceConfigSource.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, String.valueOf(file),
                        "No services document at " + file + " and no classpath resource " + CLASSPATH_RESOURCE);
            }
            return loader.load(in, "classpath:" + CLASSPATH_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, CLASSPATH_RESOURCE,
                    "Cannot read classpath resource " + CLASSPATH_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "static:" + file;
    }
}
