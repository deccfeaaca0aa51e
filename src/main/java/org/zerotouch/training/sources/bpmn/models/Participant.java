package org.zerotouch.training.sources.bpmn.models;

/**
 * A collaboration participant; its name is the role (swimlane) shown in training content.
 */
public record Participant(String id, String name, String processRef) {
}
