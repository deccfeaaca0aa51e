package org.zerotouch.training.sources.tosca.models;

/**
 * A note on the test script, correlated to a step through {@code stepId}.
 */
public record Annotation(String type, String stepId, String description) {
}
