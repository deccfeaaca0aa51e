package org.zerotouch.training.sources.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.zerotouch.training.sources.config.models.PipelineConfig;
import org.zerotouch.training.sources.config.models.ResolvedSources;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigHelperTest {
    private static final String PIPELINE_CONFIG = "src/test/resources/pipeline.yaml";

    @Test
    void shouldLoadScopeAndSources() throws IOException {
        PipelineConfig config = PipelineConfigHelper.loadConfig(PIPELINE_CONFIG);

        assertEquals("Acme Defense", config.scope.company);
        assertEquals("ANN", config.scope.siteCode);
        assertEquals("Buyer", config.scope.role);
        assertEquals(2, config.sources.tosca.size());
        assertEquals(1, config.sources.overlay.size());
    }

    @Test
    void shouldLoadFromClasspath() throws IOException {
        PipelineConfig config = PipelineConfigHelper.loadConfig("classpath:pipeline.yaml");

        assertEquals("Anniston", config.scope.site);
    }

    @Test
    void shouldThrowWhenConfigMissing() {
        assertThrows(IllegalStateException.class,
                () -> PipelineConfigHelper.loadConfig("src/test/resources/nope.yaml"));
        assertThrows(IllegalStateException.class,
                () -> PipelineConfigHelper.loadConfig("classpath:nope.yaml"));
    }

    @Test
    void shouldResolveRelativePathsAgainstBaseDir() throws IOException {
        PipelineConfig config = PipelineConfigHelper.loadConfig(PIPELINE_CONFIG);
        Path baseDir = Path.of("src/test/resources");

        ResolvedSources sources = PipelineConfigHelper.resolvePaths(config, baseDir);

        Path expected = baseDir.resolve("bpmn/purchase_requisition.bpmn").toAbsolutePath().normalize();
        assertEquals(expected, sources.bpmn().get(0));
        assertTrue(sources.tosca().get(0).isAbsolute());
        assertTrue(Files.exists(sources.overlay().get(0)));
    }

    @Test
    void shouldDefaultMissingSectionsToEmpty(@TempDir Path tempDir) throws IOException {
        Path configFile = tempDir.resolve("pipeline.yaml");
        Files.writeString(configFile, "scope:\n  role: Receiver\n");

        PipelineConfig config = PipelineConfigHelper.loadConfig(configFile.toString());
        ResolvedSources sources = PipelineConfigHelper.resolvePaths(config, tempDir);

        assertEquals("Receiver", config.scope.role);
        assertTrue(sources.tosca().isEmpty());
        assertTrue(sources.bpmn().isEmpty());
        assertTrue(sources.overlay().isEmpty());
    }

    @Test
    void shouldKeepAbsolutePaths(@TempDir Path tempDir) throws IOException {
        Path absolute = tempDir.resolve("overlay.yaml").toAbsolutePath();
        Path configFile = tempDir.resolve("pipeline.yaml");
        Files.writeString(configFile, "sources:\n  overlay:\n    - \"" + absolute.toString().replace("\\", "/") + "\"\n");

        PipelineConfig config = PipelineConfigHelper.loadConfig(configFile.toString());
        ResolvedSources sources = PipelineConfigHelper.resolvePaths(config, Path.of("elsewhere"));

        assertEquals(absolute.normalize(), sources.overlay().get(0));
        assertNotNull(config.scope);
    }
}
