package org.zerotouch.training.sources.bpmn.models;

import java.util.List;

/**
 * A BPMN gateway.
 *
 * @param defaultFlow id of the default outgoing flow, empty if none is declared
 */
public record Gateway(
        String id,
        String name,
        String documentation,
        GatewayType gatewayType,
        List<String> incoming,
        List<String> outgoing,
        String defaultFlow
) implements BpmnElement {

    public Gateway {
        incoming = incoming == null ? List.of() : List.copyOf(incoming);
        outgoing = outgoing == null ? List.of() : List.copyOf(outgoing);
        defaultFlow = defaultFlow == null ? "" : defaultFlow;
    }

    public boolean isDecision() {
        return gatewayType == GatewayType.EXCLUSIVE;
    }
}
