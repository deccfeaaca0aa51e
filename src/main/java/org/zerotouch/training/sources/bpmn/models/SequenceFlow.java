package org.zerotouch.training.sources.bpmn.models;

/**
 * Represents a BPMN SequenceFlow connecting two flow elements.
 * Source and target are not checked against the process; dangling references show up as lookup misses.
 *
 * @param id        the unique identifier of the sequence flow
 * @param name      the branch label (e.g. "Yes"), may be empty
 * @param sourceRef id of the source element
 * @param targetRef id of the target element
 */
public record SequenceFlow(
        String id,
        String name,
        String sourceRef,
        String targetRef
) {
}
