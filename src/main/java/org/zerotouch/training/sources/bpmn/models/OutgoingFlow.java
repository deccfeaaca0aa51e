package org.zerotouch.training.sources.bpmn.models;

/**
 * Target of an outgoing sequence flow together with the flow's label.
 */
public record OutgoingFlow(String targetRef, String label) {
}
