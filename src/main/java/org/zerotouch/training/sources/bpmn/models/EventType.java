package org.zerotouch.training.sources.bpmn.models;

/**
 * Coarse event classification. Throw and catch intermediate events both map to {@link #INTERMEDIATE}.
 */
public enum EventType {
    START,
    INTERMEDIATE,
    END
}
