package org.zerotouch.training.sources.bpmn.models;

// Connects participants, not flow elements.
public record MessageFlow(String id, String name, String sourceRef, String targetRef) {
}
