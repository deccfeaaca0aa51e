package org.zerotouch.training.sources.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.zerotouch.training.sources.config.models.PipelineConfig;
import org.zerotouch.training.sources.config.models.ResolvedSources;
import org.zerotouch.training.sources.config.models.Scope;
import org.zerotouch.training.sources.config.models.Sources;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

public class PipelineConfigHelper {
    private static final ResourceLoader resourceLoader = new DefaultResourceLoader();
    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads the pipeline configuration from a file path or a {@code classpath:} location.
     *
     * @param location path or classpath location of the YAML file
     * @return the configuration, with empty scope and sources filled in
     * @throws IllegalStateException if the location does not exist
     * @throws IOException           if the file cannot be read or parsed
     */
    public static PipelineConfig loadConfig(String location) throws IOException {
        Resource resource = location.startsWith(ResourceLoader.CLASSPATH_URL_PREFIX)
                ? resourceLoader.getResource(location)
                : new FileSystemResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Pipeline config not found: " + location);
        }

        PipelineConfig config;
        try (InputStream in = resource.getInputStream()) {
            config = mapper.readValue(in, PipelineConfig.class);
        }
        if (config == null) {
            config = new PipelineConfig();
        }
        if (config.scope == null) {
            config.scope = new Scope();
        }
        if (config.sources == null) {
            config.sources = new Sources();
        }
        return config;
    }

    /**
     * Resolves the configured source paths against a base directory. Absolute paths are kept as they are.
     *
     * @param config  the loaded configuration
     * @param baseDir directory relative paths are resolved against
     * @return absolute source paths per type, empty lists for unconfigured types
     */
    public static ResolvedSources resolvePaths(PipelineConfig config, Path baseDir) {
        Sources sources = config.sources != null ? config.sources : new Sources();
        return new ResolvedSources(
                resolveAll(sources.tosca, baseDir),
                resolveAll(sources.bpmn, baseDir),
                resolveAll(sources.overlay, baseDir));
    }

    private static List<Path> resolveAll(List<String> paths, Path baseDir) {
        if (paths == null) {
            return List.of();
        }
        return paths.stream()
                .map(p -> baseDir.resolve(p).toAbsolutePath().normalize())
                .toList();
    }
}
