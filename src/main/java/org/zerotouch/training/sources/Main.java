package org.zerotouch.training.sources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerotouch.training.sources.bpmn.BpmnValidator;
import org.zerotouch.training.sources.config.PipelineConfigHelper;
import org.zerotouch.training.sources.config.models.PipelineConfig;
import org.zerotouch.training.sources.config.models.ResolvedSources;
import org.zerotouch.training.sources.overlay.OverlayValidator;
import org.zerotouch.training.sources.overlay.models.OverlayResolution;
import org.zerotouch.training.sources.report.SummaryRenderer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Dry run of the source stage: reads the pipeline config, parses every configured source
 * and resolves the overlays, logging what was found. Nothing is generated.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String DEFAULT_CONFIG_PATH = "config/pipeline.yaml";

    // ------ Configuration
    private final String configPath;
    private PipelineConfig config;
    private ResolvedSources sources;

    // ------- Parsed sources
    private ParsedSources parsedSources;
    private OverlayResolution overlayResolution;

    public Main(String configPath) {
        this.configPath = configPath;
    }

    public static void main(String[] args) throws Exception {
        new Main(args.length > 0 ? args[0] : DEFAULT_CONFIG_PATH).run();
    }

    public void run() throws IOException {
        loadConfig();
        validateSources();
        parseSources();
        loadOverlays();
        logSummaries();
    }

    private void loadConfig() throws IOException {
        config = PipelineConfigHelper.loadConfig(configPath);
        Path configFile = Path.of(configPath).toAbsolutePath();
        Path baseDir = configFile.getParent() != null ? configFile.getParent() : Path.of(".");
        sources = PipelineConfigHelper.resolvePaths(config, baseDir);
        log.info("Scope: {} / {} ({}) / role {}",
                config.scope.company, config.scope.site, config.scope.siteCode, config.scope.role);
    }

    private void validateSources() throws IOException {
        for (Path path : sources.bpmn()) {
            if (Files.exists(path)) {
                BpmnValidator.isValid(path);
            }
        }
        for (Path path : sources.overlay()) {
            if (Files.exists(path)) {
                OverlayValidator.validate(path);
            }
        }
    }

    private void parseSources() {
        parsedSources = SourceLoader.parseSources(sources.tosca(), sources.bpmn());
    }

    private void loadOverlays() {
        overlayResolution = SourceLoader.loadOverlays(sources.overlay(), config.scope.role);
    }

    private void logSummaries() {
        parsedSources.bpmnProcesses()
                .forEach(process -> log.info("\n{}", SummaryRenderer.renderProcessSummary(process)));
        parsedSources.toscaScripts()
                .forEach(script -> log.info("\n{}", SummaryRenderer.renderScriptSummary(script)));
        log.info("Resolved {} overlay rules for site {}",
                overlayResolution.overlays().size(), overlayResolution.site().name);
    }

    public ParsedSources getParsedSources() {
        return parsedSources;
    }

    public OverlayResolution getOverlayResolution() {
        return overlayResolution;
    }
}
