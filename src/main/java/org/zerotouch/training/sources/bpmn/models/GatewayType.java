package org.zerotouch.training.sources.bpmn.models;

public enum GatewayType {
    EXCLUSIVE("exclusiveGateway"),
    PARALLEL("parallelGateway"),
    INCLUSIVE("inclusiveGateway");

    private final String tagName;

    GatewayType(String tagName) {
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }
}
