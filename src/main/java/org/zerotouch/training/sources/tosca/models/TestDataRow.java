package org.zerotouch.training.sources.tosca.models;

public record TestDataRow(String fieldName, String fieldValue, String fieldDescription) {
}
