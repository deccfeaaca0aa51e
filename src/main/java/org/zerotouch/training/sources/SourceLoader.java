package org.zerotouch.training.sources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerotouch.training.sources.bpmn.BpmnHelper;
import org.zerotouch.training.sources.bpmn.models.BpmnProcess;
import org.zerotouch.training.sources.overlay.OverlayAssembler;
import org.zerotouch.training.sources.overlay.models.OverlayResolution;
import org.zerotouch.training.sources.report.SummaryRenderer;
import org.zerotouch.training.sources.tosca.ToscaHelper;
import org.zerotouch.training.sources.tosca.models.TestScript;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry points that turn lists of source paths into parsed models and the resolved site overlay.
 */
public class SourceLoader {
    private static final Logger log = LoggerFactory.getLogger(SourceLoader.class);

    /**
     * Parses the given Tosca and BPMN files. Missing files are skipped with a warning;
     * a file that exists but cannot be parsed fails the whole call.
     *
     * @param toscaPaths Tosca test script exports
     * @param bpmnPaths  BPMN process diagrams
     * @return the parsed scripts and processes
     * @throws SourceParseException     if a document lacks a required element
     * @throws MalformedSourceException if a document is not well-formed XML
     */
    public static ParsedSources parseSources(List<Path> toscaPaths, List<Path> bpmnPaths) {
        List<TestScript> scripts = new ArrayList<>();
        for (Path path : toscaPaths) {
            if (!Files.exists(path)) {
                log.warn("Tosca file not found: {}", path);
                continue;
            }
            scripts.add(ToscaHelper.parseToscaFile(path.toString()));
        }

        List<BpmnProcess> processes = new ArrayList<>();
        for (Path path : bpmnPaths) {
            if (!Files.exists(path)) {
                log.warn("BPMN file not found: {}", path);
                continue;
            }
            processes.add(BpmnHelper.parseBpmnFile(path.toString()));
        }

        return new ParsedSources(scripts, processes);
    }

    /**
     * Loads and resolves the site overlays. With no overlay files the result is an empty
     * site and no rules, and the filesystem is not touched.
     *
     * @param overlayPaths overlay YAML files, later files win for the site block
     * @param role         target role, passed through to {@link OverlayAssembler#resolve(String)}
     * @return the resolved overlays
     */
    public static OverlayResolution loadOverlays(List<Path> overlayPaths, String role) {
        if (overlayPaths.isEmpty()) {
            log.warn("No overlay files configured");
            return OverlayResolution.empty();
        }

        OverlayAssembler assembler = new OverlayAssembler(overlayPaths);
        assembler.load();
        log.info("Overlay summary:\n{}", SummaryRenderer.renderOverlaySummary(assembler));
        return assembler.resolve(role);
    }
}
