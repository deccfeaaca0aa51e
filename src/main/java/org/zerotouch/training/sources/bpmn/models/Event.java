package org.zerotouch.training.sources.bpmn.models;

import java.util.List;

public record Event(
        String id,
        String name,
        String documentation,
        EventType eventType,
        List<String> incoming,
        List<String> outgoing
) implements BpmnElement {

    public Event {
        incoming = incoming == null ? List.of() : List.copyOf(incoming);
        outgoing = outgoing == null ? List.of() : List.copyOf(outgoing);
    }
}
