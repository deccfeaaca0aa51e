package org.zerotouch.training.sources.config.models;

import java.nio.file.Path;
import java.util.List;

/**
 * Source file lists with every path made absolute.
 */
public record ResolvedSources(List<Path> tosca, List<Path> bpmn, List<Path> overlay) {
}
