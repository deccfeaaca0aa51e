package org.zerotouch.training.sources.bpmn;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.zerotouch.training.sources.MalformedSourceException;
import org.zerotouch.training.sources.SourceParseException;
import org.zerotouch.training.sources.bpmn.models.BpmnElement;
import org.zerotouch.training.sources.bpmn.models.BpmnProcess;
import org.zerotouch.training.sources.bpmn.models.DataObject;
import org.zerotouch.training.sources.bpmn.models.Event;
import org.zerotouch.training.sources.bpmn.models.EventType;
import org.zerotouch.training.sources.bpmn.models.Gateway;
import org.zerotouch.training.sources.bpmn.models.GatewayType;
import org.zerotouch.training.sources.bpmn.models.OutgoingFlow;
import org.zerotouch.training.sources.bpmn.models.Task;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BpmnHelperTest {
    private static final String PURCHASE_REQUISITION_BPMN = "src/test/resources/bpmn/purchase_requisition.bpmn";
    private static final String CYCLIC_BPMN = "src/test/resources/bpmn/cyclic.bpmn";
    private static final String NO_START_BPMN = "src/test/resources/bpmn/no_start.bpmn";
    private static final String NO_PROCESS_BPMN = "src/test/resources/bpmn/no_process.bpmn";

    @Test
    void shouldParseProcessMetadata() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(PURCHASE_REQUISITION_BPMN);

        assertEquals("Process_PR", process.id());
        assertEquals("Purchase Requisition", process.name());
        // no documentation on definitions, so the process's own is used
        assertTrue(process.documentation().startsWith("Requester raises a purchase requisition"));
    }

    @Test
    void shouldParseElementsOfEveryKind() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(PURCHASE_REQUISITION_BPMN);

        assertEquals(2, process.tasks().size());
        assertEquals(1, process.gateways().size());
        assertEquals(3, process.events().size());
        assertEquals(5, process.sequenceFlows().size());

        Task createPr = (Task) process.getElementById("Task_CreatePR");
        assertEquals("Enter material, quantity and delivery date.", createPr.documentation());
        assertEquals(List.of("Flow_1"), createPr.incoming());
        assertEquals(List.of("Flow_2"), createPr.outgoing());

        Gateway gateway = process.gateways().get(0);
        assertEquals(GatewayType.EXCLUSIVE, gateway.gatewayType());
        assertEquals("Flow_No", gateway.defaultFlow());
        assertEquals(List.of("Flow_Yes", "Flow_No"), gateway.outgoing());
    }

    @Test
    void shouldParseCollaboration() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(PURCHASE_REQUISITION_BPMN);

        assertEquals(List.of("Requester", "Buyer"), process.roles());
        assertEquals("Process_PR", process.participants().get(0).processRef());
        assertEquals(1, process.messageFlows().size());
        assertEquals("PR submitted", process.messageFlows().get(0).name());
    }

    @Test
    void shouldKeepOnlyDocumentedItemDefinitionsAsDataObjects() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(PURCHASE_REQUISITION_BPMN);

        List<String> ids = process.dataObjects().stream().map(DataObject::id).toList();
        assertEquals(List.of("Item_PurchaseRequisition", "Item_PurchaseOrder"), ids);
        // nested documentation/text node
        assertEquals("Purchase requisition form\nLists material, quantity and cost center",
                process.dataObjects().get(0).documentation());
        assertEquals("Purchase order sent to the vendor", process.dataObjects().get(1).documentation());
    }

    @Test
    void shouldOrderPurchaseRequisitionBreadthFirst() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(PURCHASE_REQUISITION_BPMN);

        List<String> ids = process.orderedElements().stream().map(BpmnElement::id).toList();
        assertEquals(List.of("Start_PR", "Task_CreatePR", "Gateway_Approved", "Task_PostPO",
                "End_Rejected", "End_Ordered"), ids);
    }

    @Test
    void shouldExposeDecisionsAndBranchLabels() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(PURCHASE_REQUISITION_BPMN);

        Task createPr = (Task) process.getElementById("Task_CreatePR");
        assertEquals("ME51N", createPr.transactionCode());

        assertEquals(List.of(process.getElementById("Gateway_Approved")), process.decisionPoints());
        assertEquals(List.of(new OutgoingFlow("Task_PostPO", "Yes"), new OutgoingFlow("End_Rejected", "No")),
                process.getOutgoingFlows("Gateway_Approved"));
        assertEquals("Yes", process.getFlowLabel("Gateway_Approved", "Task_PostPO"));
        assertEquals("", process.getFlowLabel("Start_PR", "Task_CreatePR"));
    }

    @Test
    void shouldTruncateCyclesWithoutRepeatingElements() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(CYCLIC_BPMN);

        List<String> ids = process.orderedElements().stream().map(BpmnElement::id).toList();
        assertEquals(List.of("Start_C", "Task_A", "Gateway_Par", "Task_B", "Event_Wait",
                "Gateway_Check", "End_C"), ids);
    }

    @Test
    void shouldReportElementsUnreachableFromStart() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(CYCLIC_BPMN);

        List<String> ids = process.unreachableElements().stream().map(BpmnElement::id).toList();
        assertEquals(List.of("Task_Orphan", "Gateway_Inc", "Event_Notify"), ids);
    }

    @Test
    void shouldCollapseThrowAndCatchEventsToIntermediate() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(CYCLIC_BPMN);

        assertEquals(EventType.INTERMEDIATE, ((Event) process.getElementById("Event_Notify")).eventType());
        assertEquals(EventType.INTERMEDIATE, ((Event) process.getElementById("Event_Wait")).eventType());
        assertEquals(EventType.START, ((Event) process.getElementById("Start_C")).eventType());
    }

    @Test
    void shouldTreatOnlyExclusiveGatewaysAsDecisions() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(CYCLIC_BPMN);

        assertEquals(3, process.gateways().size());
        assertEquals(List.of("Gateway_Check"), process.decisionPoints().stream().map(Gateway::id).toList());
    }

    @Test
    void shouldTolerateDanglingFlowTargets() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(CYCLIC_BPMN);

        assertTrue(process.getOutgoingFlows("Task_B").contains(new OutgoingFlow("Missing_Node", "")));
        assertNull(process.getElementById("Missing_Node"));
    }

    @Test
    void shouldFallBackToCollectionOrderWithoutStartEvent() {
        BpmnProcess process = BpmnHelper.parseBpmnFile(NO_START_BPMN);

        List<String> ids = process.orderedElements().stream().map(BpmnElement::id).toList();
        assertEquals(List.of("T1", "S1", "G1"), ids);
        assertTrue(process.unreachableElements().isEmpty());
        assertTrue(process.roles().isEmpty());
    }

    @Test
    void shouldThrowWhenNoProcessElement() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> BpmnHelper.parseBpmnFile(NO_PROCESS_BPMN));
        assertEquals(NO_PROCESS_BPMN, e.getSourcePath());
    }

    @Test
    void shouldWrapMalformedXmlDistinctly(@TempDir Path tempDir) throws IOException {
        Path broken = tempDir.resolve("broken.bpmn");
        Files.writeString(broken, "<bpmn:definitions xmlns:bpmn=\"" + BpmnHelper.BPMN_NS + "\"><bpmn:process");

        assertThrows(MalformedSourceException.class, () -> BpmnHelper.parseBpmnFile(broken.toString()));
    }

    @Test
    void shouldReturnFalseForMalformedDiagram(@TempDir Path tempDir) throws IOException {
        Path broken = tempDir.resolve("broken.bpmn");
        Files.writeString(broken, "not xml at all");

        assertFalse(BpmnValidator.isValid(broken));
    }
}
