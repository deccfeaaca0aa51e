package org.zerotouch.training.sources.bpmn.models;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fully parsed representation of one BPMN process, including the collaboration
 * participants and message flows of the diagram it came from.
 * <p>
 * Built once by {@code BpmnHelper.parseBpmnFile} and read-only afterwards.
 */
public record BpmnProcess(
        String id,
        String name,
        String documentation,
        List<Task> tasks,
        List<Gateway> gateways,
        List<Event> events,
        List<SequenceFlow> sequenceFlows,
        List<Participant> participants,
        List<MessageFlow> messageFlows,
        List<DataObject> dataObjects
) {

    public BpmnProcess {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Process id must not be empty");
        }
        name = name == null ? "" : name;
        documentation = documentation == null ? "" : documentation;
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        gateways = gateways == null ? List.of() : List.copyOf(gateways);
        events = events == null ? List.of() : List.copyOf(events);
        sequenceFlows = sequenceFlows == null ? List.of() : List.copyOf(sequenceFlows);
        participants = participants == null ? List.of() : List.copyOf(participants);
        messageFlows = messageFlows == null ? List.of() : List.copyOf(messageFlows);
        dataObjects = dataObjects == null ? List.of() : List.copyOf(dataObjects);
    }

    /**
     * Role names, one per participant, in document order.
     */
    public List<String> roles() {
        return participants.stream().map(Participant::name).toList();
    }

    /**
     * Elements in execution order: a breadth-first walk over the sequence flows starting at the first
     * start event. Each element is emitted once, on first visit, so cycles are cut off silently.
     * Sibling order follows the order in which the sequence flows appear in the source document.
     * <p>
     * Without a start event all elements are returned in collection order (tasks, gateways, events)
     * and no execution order may be assumed.
     *
     * @return the ordered elements
     */
    public List<BpmnElement> orderedElements() {
        Map<String, List<String>> flowMap = new LinkedHashMap<>();
        for (SequenceFlow flow : sequenceFlows) {
            flowMap.computeIfAbsent(flow.sourceRef(), k -> new ArrayList<>()).add(flow.targetRef());
        }

        Map<String, BpmnElement> elementsById = elementsById();

        Event start = events.stream()
                .filter(event -> event.eventType() == EventType.START)
                .findFirst()
                .orElse(null);
        if (start == null) {
            return new ArrayList<>(elementsById.values());
        }

        List<BpmnElement> ordered = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start.id());

        while (!queue.isEmpty()) {
            String currentId = queue.poll();
            if (!visited.add(currentId)) {
                continue;
            }

            // dangling flow targets are visited but produce no element
            BpmnElement current = elementsById.get(currentId);
            if (current != null) {
                ordered.add(current);
            }

            for (String nextId : flowMap.getOrDefault(currentId, List.of())) {
                if (!visited.contains(nextId)) {
                    queue.add(nextId);
                }
            }
        }

        return ordered;
    }

    /**
     * Elements that {@link #orderedElements()} never reaches from the start event.
     * Empty when the process has no start event, since every element is returned then.
     */
    public List<BpmnElement> unreachableElements() {
        Set<BpmnElement> reached = Collections.newSetFromMap(new IdentityHashMap<>());
        reached.addAll(orderedElements());
        List<BpmnElement> unreachable = new ArrayList<>();
        for (BpmnElement element : elementsById().values()) {
            if (!reached.contains(element)) {
                unreachable.add(element);
            }
        }
        return unreachable;
    }

    /**
     * Exclusive gateways only; parallel and inclusive gateways are not decisions.
     */
    public List<Gateway> decisionPoints() {
        return gateways.stream().filter(Gateway::isDecision).toList();
    }

    /**
     * Gets the (target, label) pairs of all flows leaving an element, in source order.
     *
     * @param elementId the source element id
     * @return outgoing flows, empty if none
     */
    public List<OutgoingFlow> getOutgoingFlows(String elementId) {
        List<OutgoingFlow> results = new ArrayList<>();
        for (SequenceFlow flow : sequenceFlows) {
            if (flow.sourceRef().equals(elementId)) {
                results.add(new OutgoingFlow(flow.targetRef(), flow.name()));
            }
        }
        return results;
    }

    /**
     * Looks up a task, gateway or event by id.
     *
     * @param elementId the element id
     * @return the element if found, null otherwise
     */
    public BpmnElement getElementById(String elementId) {
        for (Task task : tasks) {
            if (task.id().equals(elementId)) {
                return task;
            }
        }
        for (Gateway gateway : gateways) {
            if (gateway.id().equals(elementId)) {
                return gateway;
            }
        }
        for (Event event : events) {
            if (event.id().equals(elementId)) {
                return event;
            }
        }
        return null;
    }

    /**
     * Label of the first flow from {@code sourceId} to {@code targetId}, or an empty string.
     */
    public String getFlowLabel(String sourceId, String targetId) {
        for (SequenceFlow flow : sequenceFlows) {
            if (flow.sourceRef().equals(sourceId) && flow.targetRef().equals(targetId)) {
                return flow.name();
            }
        }
        return "";
    }

    private Map<String, BpmnElement> elementsById() {
        Map<String, BpmnElement> elements = new LinkedHashMap<>();
        putAll(elements, tasks);
        putAll(elements, gateways);
        putAll(elements, events);
        return elements;
    }

    private static void putAll(Map<String, BpmnElement> elements, Collection<? extends BpmnElement> source) {
        for (BpmnElement element : source) {
            elements.put(element.id(), element);
        }
    }
}
