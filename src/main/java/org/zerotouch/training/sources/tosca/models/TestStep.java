package org.zerotouch.training.sources.tosca.models;

import lombok.Builder;

import java.util.List;
import java.util.Set;

/**
 * A single step of a Tosca test script.
 * The action type set is open; only the user-action and verification types below have meaning here.
 */
@Builder
public record TestStep(
        String stepId,
        int stepNumber,
        String description,
        String actionType,  // NAVIGATE, CLICK, INPUT, SELECT, VERIFY, CALCULATE, ...
        UIElement element,  // null when the action targets no element
        String value,
        String targetUrl,
        String expectedResult,
        String screenshot,
        List<Assertion> assertions
) {
    public static final Set<String> USER_ACTION_TYPES = Set.of("NAVIGATE", "CLICK", "INPUT", "SELECT");
    public static final Set<String> VERIFICATION_TYPES = Set.of("VERIFY", "CALCULATE");

    public TestStep {
        stepId = stepId == null ? "" : stepId;
        description = description == null ? "" : description;
        actionType = actionType == null ? "" : actionType;
        value = value == null ? "" : value;
        targetUrl = targetUrl == null ? "" : targetUrl;
        expectedResult = expectedResult == null ? "" : expectedResult;
        screenshot = screenshot == null ? "" : screenshot;
        assertions = assertions == null ? List.of() : List.copyOf(assertions);
    }

    /**
     * True if a user performs this step, as opposed to a check the test makes.
     */
    public boolean isUserAction() {
        return USER_ACTION_TYPES.contains(actionType);
    }

    public boolean isVerification() {
        return VERIFICATION_TYPES.contains(actionType);
    }
}
