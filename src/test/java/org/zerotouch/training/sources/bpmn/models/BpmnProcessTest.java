package org.zerotouch.training.sources.bpmn.models;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BpmnProcessTest {

    private static Task task(String id, String name) {
        return new Task(id, name, "", List.of(), List.of());
    }

    private static Event event(String id, EventType type) {
        return new Event(id, id, "", type, List.of(), List.of());
    }

    private static SequenceFlow flow(String source, String target) {
        return new SequenceFlow(source + "-" + target, "", source, target);
    }

    @Test
    void shouldRejectEmptyId() {
        assertThrows(IllegalArgumentException.class, () -> new BpmnProcess(
                "", "x", "", null, null, null, null, null, null, null));
    }

    @Test
    void shouldDefaultNullCollectionsToEmpty() {
        BpmnProcess process = new BpmnProcess("P", null, null, null, null, null, null, null, null, null);

        assertEquals("", process.name());
        assertTrue(process.tasks().isEmpty());
        assertTrue(process.orderedElements().isEmpty());
        assertTrue(process.decisionPoints().isEmpty());
    }

    @Test
    void shouldFollowSequenceFlowSourceOrderForParallelBranches() {
        Gateway split = new Gateway("Split", "", "", GatewayType.PARALLEL, List.of(), List.of(), "");
        BpmnProcess process = new BpmnProcess("P", "", "",
                List.of(task("A", "A"), task("B", "B")),
                List.of(split),
                List.of(event("Start", EventType.START)),
                // B's flow is declared before A's, so B is visited first
                List.of(flow("Start", "Split"), flow("Split", "B"), flow("Split", "A")),
                List.of(), List.of(), List.of());

        List<String> ids = process.orderedElements().stream().map(BpmnElement::id).toList();
        assertEquals(List.of("Start", "Split", "B", "A"), ids);
    }

    @Test
    void shouldUseFirstStartEvent() {
        BpmnProcess process = new BpmnProcess("P", "", "",
                List.of(task("A", "A"), task("B", "B")),
                List.of(),
                List.of(event("S1", EventType.START), event("S2", EventType.START)),
                List.of(flow("S1", "A"), flow("S2", "B")),
                List.of(), List.of(), List.of());

        List<String> ids = process.orderedElements().stream().map(BpmnElement::id).toList();
        assertEquals(List.of("S1", "A"), ids);
        assertEquals(List.of("B", "S2"),
                process.unreachableElements().stream().map(BpmnElement::id).toList());
    }

    @Test
    void shouldReturnEmptyFlowsForUnknownElement() {
        BpmnProcess process = new BpmnProcess("P", "", "", List.of(task("A", "A")), List.of(), List.of(),
                List.of(), List.of(), List.of(), List.of());

        assertTrue(process.getOutgoingFlows("Nope").isEmpty());
        assertNull(process.getElementById("Nope"));
        assertEquals("", process.getFlowLabel("A", "Nope"));
    }
}
