package org.zerotouch.training.sources.bpmn.models;

import java.util.List;

/**
 * A flow element of a process: task, gateway or event.
 */
public interface BpmnElement {
    String id();

    String name();

    String documentation();

    List<String> incoming();

    List<String> outgoing();
}
