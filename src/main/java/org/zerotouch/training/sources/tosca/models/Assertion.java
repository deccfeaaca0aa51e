package org.zerotouch.training.sources.tosca.models;

/**
 * A validation assertion attached to a test step. All values are optional and empty when absent.
 * {@code reason} is free text; {@link SiteSpecificity} inspects it to flag site-specific steps.
 */
public record Assertion(
        String type,
        String fieldReference,
        String expectedValue,
        String allowedValues,
        String validationType,
        String reason
) {
}
