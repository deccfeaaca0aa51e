package org.zerotouch.training.sources.bpmn.models;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A BPMN task of any subtype (task, userTask, serviceTask, sendTask, receiveTask).
 *
 * @param incoming ids of incoming sequence flows
 * @param outgoing ids of outgoing sequence flows
 */
public record Task(
        String id,
        String name,
        String documentation,
        List<String> incoming,
        List<String> outgoing
) implements BpmnElement {
    // e.g. "Create PR (ME51N)" -> ME51N
    private static final Pattern TRANSACTION_CODE_PATTERN = Pattern.compile("\\(([A-Z0-9]{2,10})\\)");

    public Task {
        incoming = incoming == null ? List.of() : List.copyOf(incoming);
        outgoing = outgoing == null ? List.of() : List.copyOf(outgoing);
    }

    /**
     * The first bracketed transaction code in the task name, or an empty string.
     */
    public String transactionCode() {
        if (name == null) {
            return "";
        }
        Matcher matcher = TRANSACTION_CODE_PATTERN.matcher(name);
        return matcher.find() ? matcher.group(1) : "";
    }
}
