package org.zerotouch.training.sources.tosca.models;

/**
 * A UI element targeted by a test step.
 *
 * @param identifier  technical identifier used by automation (e.g. "wnd[0]/usr/ctxtBatch")
 * @param description human-readable label, may be empty
 */
public record UIElement(String identifier, String description) {
}
