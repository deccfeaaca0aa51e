package org.zerotouch.training.sources;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.zerotouch.training.sources.overlay.models.OverlayResolution;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceLoaderTest {
    private static final Path TOSCA_SCRIPT = Path.of("src/test/resources/tosca/goods_receipt_ns.xml");
    private static final Path BPMN_PROCESS = Path.of("src/test/resources/bpmn/purchase_requisition.bpmn");
    private static final Path OVERLAY = Path.of("src/test/resources/overlay/anniston_overlay.yaml");

    @Test
    void shouldParseExistingSourcesAndSkipMissing(@TempDir Path tempDir) {
        ParsedSources sources = SourceLoader.parseSources(
                List.of(tempDir.resolve("missing.xml"), TOSCA_SCRIPT),
                List.of(BPMN_PROCESS, tempDir.resolve("missing.bpmn")));

        assertEquals(1, sources.toscaScripts().size());
        assertEquals("MIGO", sources.toscaScripts().get(0).transaction());
        assertEquals(1, sources.bpmnProcesses().size());
        assertEquals("Process_PR", sources.bpmnProcesses().get(0).id());
    }

    @Test
    void shouldPropagateParseErrors(@TempDir Path tempDir) throws IOException {
        Path broken = tempDir.resolve("broken.xml");
        Files.writeString(broken, "<TestScript>");

        assertThrows(MalformedSourceException.class, () -> SourceLoader.parseSources(List.of(broken), List.of()));
        assertThrows(SourceParseException.class, () -> SourceLoader.parseSources(
                List.of(), List.of(Path.of("src/test/resources/bpmn/no_process.bpmn"))));
    }

    @Test
    void shouldReturnEmptyResolutionWithoutOverlayFiles() {
        OverlayResolution resolution = SourceLoader.loadOverlays(List.of(), "Buyer");

        assertEquals(OverlayResolution.empty(), resolution);
    }

    @Test
    void shouldWarnWhenNoOverlayFilesConfigured() {
        Logger logger = (Logger) LoggerFactory.getLogger(SourceLoader.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            SourceLoader.loadOverlays(List.of(), "");
        } finally {
            logger.detachAppender(appender);
        }

        assertEquals(1, appender.list.size());
        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertEquals("No overlay files configured", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void shouldLoadAndResolveOverlays() {
        OverlayResolution resolution = SourceLoader.loadOverlays(List.of(OVERLAY), "Buyer");

        assertEquals("Anniston", resolution.site().name);
        assertEquals(2, resolution.overlays().size());
    }
}
