package org.zerotouch.training.sources.bpmn.models;

/**
 * A document referenced by the process, taken from a top-level itemDefinition with documentation.
 */
public record DataObject(String id, String documentation) {
}
