package org.zerotouch.training.sources.bpmn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.zerotouch.training.sources.MalformedSourceException;
import org.zerotouch.training.sources.SourceParseException;
import org.zerotouch.training.sources.XmlSupport;
import org.zerotouch.training.sources.bpmn.models.BpmnProcess;
import org.zerotouch.training.sources.bpmn.models.DataObject;
import org.zerotouch.training.sources.bpmn.models.Event;
import org.zerotouch.training.sources.bpmn.models.EventType;
import org.zerotouch.training.sources.bpmn.models.Gateway;
import org.zerotouch.training.sources.bpmn.models.GatewayType;
import org.zerotouch.training.sources.bpmn.models.MessageFlow;
import org.zerotouch.training.sources.bpmn.models.Participant;
import org.zerotouch.training.sources.bpmn.models.SequenceFlow;
import org.zerotouch.training.sources.bpmn.models.Task;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BpmnHelper {
    private static final Logger log = LoggerFactory.getLogger(BpmnHelper.class);

    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";

    // Collected group by group, so this order is also the fallback element order
    private static final String[] TASK_TAGS = {
            "task", "userTask", "serviceTask", "sendTask", "receiveTask"
    };

    private static final Map<String, EventType> EVENT_TAGS = orderedEventTags();

    /**
     * Parses a BPMN 2.0 file and returns its first top-level process.
     * Participants and message flows are taken from the diagram's collaboration, if there is one.
     *
     * @param bpmnFilePath the path to the BPMN file
     * @return the parsed process
     * @throws SourceParseException     if the document has no top-level process, or the process has no id
     * @throws MalformedSourceException if the file cannot be read or is not well-formed XML
     */
    public static BpmnProcess parseBpmnFile(String bpmnFilePath) {
        Document doc = XmlSupport.parseXmlFile(bpmnFilePath);
        Element definitionsEl = doc.getDocumentElement();

        Element processEl = XmlSupport.firstChild(definitionsEl, BPMN_NS, "process");
        if (processEl == null) {
            throw new SourceParseException("No bpmn:process element found in " + bpmnFilePath, bpmnFilePath);
        }
        if (processEl.getAttribute("id").isEmpty()) {
            throw new SourceParseException("bpmn:process in " + bpmnFilePath + " has no id", bpmnFilePath);
        }

        String documentation = getDocumentation(definitionsEl);
        if (documentation.isEmpty()) {
            documentation = getDocumentation(processEl);
        }

        List<Participant> participants = new ArrayList<>();
        List<MessageFlow> messageFlows = new ArrayList<>();
        Element collaborationEl = XmlSupport.firstChild(definitionsEl, BPMN_NS, "collaboration");
        if (collaborationEl != null) {
            participants = parseParticipants(collaborationEl);
            messageFlows = parseMessageFlows(collaborationEl);
        }

        BpmnProcess process = new BpmnProcess(
                processEl.getAttribute("id"),
                processEl.getAttribute("name"),
                documentation,
                parseTasks(processEl),
                parseGateways(processEl),
                parseEvents(processEl),
                parseSequenceFlows(processEl),
                participants,
                messageFlows,
                parseDataObjects(definitionsEl));

        log.info("Parsed BPMN {}: {} tasks, {} roles, {} decisions",
                process.name(), process.tasks().size(), process.roles().size(), process.decisionPoints().size());
        return process;
    }

    private static List<Task> parseTasks(Element processEl) {
        List<Task> tasks = new ArrayList<>();
        for (String tag : TASK_TAGS) {
            for (Element taskEl : XmlSupport.children(processEl, BPMN_NS, tag)) {
                Task task = new Task(
                        taskEl.getAttribute("id"),
                        taskEl.getAttribute("name"),
                        getDocumentation(taskEl),
                        getRefs(taskEl, "incoming"),
                        getRefs(taskEl, "outgoing"));
                log.debug("Parsed {} '{}' ({})", tag, task.name(), task.id());
                tasks.add(task);
            }
        }
        return tasks;
    }

    private static List<Gateway> parseGateways(Element processEl) {
        List<Gateway> gateways = new ArrayList<>();
        for (GatewayType type : GatewayType.values()) {
            for (Element gatewayEl : XmlSupport.children(processEl, BPMN_NS, type.tagName())) {
                gateways.add(new Gateway(
                        gatewayEl.getAttribute("id"),
                        gatewayEl.getAttribute("name"),
                        getDocumentation(gatewayEl),
                        type,
                        getRefs(gatewayEl, "incoming"),
                        getRefs(gatewayEl, "outgoing"),
                        gatewayEl.getAttribute("default")));
            }
        }
        return gateways;
    }

    private static List<Event> parseEvents(Element processEl) {
        List<Event> events = new ArrayList<>();
        for (Map.Entry<String, EventType> entry : EVENT_TAGS.entrySet()) {
            for (Element eventEl : XmlSupport.children(processEl, BPMN_NS, entry.getKey())) {
                events.add(new Event(
                        eventEl.getAttribute("id"),
                        eventEl.getAttribute("name"),
                        getDocumentation(eventEl),
                        entry.getValue(),
                        getRefs(eventEl, "incoming"),
                        getRefs(eventEl, "outgoing")));
            }
        }
        return events;
    }

    /**
     * Parses all sequence flows of a process element, in document order.
     *
     * @param processEl the process element
     * @return the sequence flows
     */
    private static List<SequenceFlow> parseSequenceFlows(Element processEl) {
        List<SequenceFlow> flows = new ArrayList<>();
        for (Element flowEl : XmlSupport.children(processEl, BPMN_NS, "sequenceFlow")) {
            flows.add(new SequenceFlow(
                    flowEl.getAttribute("id"),
                    flowEl.getAttribute("name"),
                    flowEl.getAttribute("sourceRef"),
                    flowEl.getAttribute("targetRef")));
        }
        return flows;
    }

    private static List<Participant> parseParticipants(Element collaborationEl) {
        List<Participant> participants = new ArrayList<>();
        for (Element participantEl : XmlSupport.children(collaborationEl, BPMN_NS, "participant")) {
            participants.add(new Participant(
                    participantEl.getAttribute("id"),
                    participantEl.getAttribute("name"),
                    participantEl.getAttribute("processRef")));
        }
        return participants;
    }

    private static List<MessageFlow> parseMessageFlows(Element collaborationEl) {
        List<MessageFlow> messageFlows = new ArrayList<>();
        for (Element flowEl : XmlSupport.children(collaborationEl, BPMN_NS, "messageFlow")) {
            messageFlows.add(new MessageFlow(
                    flowEl.getAttribute("id"),
                    flowEl.getAttribute("name"),
                    flowEl.getAttribute("sourceRef"),
                    flowEl.getAttribute("targetRef")));
        }
        return messageFlows;
    }

    /**
     * Top-level item definitions become data objects, but only when they carry documentation.
     */
    private static List<DataObject> parseDataObjects(Element definitionsEl) {
        List<DataObject> dataObjects = new ArrayList<>();
        for (Element itemEl : XmlSupport.children(definitionsEl, BPMN_NS, "itemDefinition")) {
            String documentation = getDocumentation(itemEl);
            if (!documentation.isEmpty()) {
                dataObjects.add(new DataObject(itemEl.getAttribute("id"), documentation));
            }
        }
        return dataObjects;
    }

    /**
     * Extracts documentation from an element: the nested {@code documentation/text} node when it has text,
     * otherwise the documentation element's own text. Empty when there is no documentation.
     */
    static String getDocumentation(Element element) {
        Element docEl = XmlSupport.firstChild(element, BPMN_NS, "documentation");
        if (docEl == null) {
            return "";
        }
        Element textEl = XmlSupport.firstChild(docEl, BPMN_NS, "text");
        if (textEl != null) {
            String text = XmlSupport.directText(textEl);
            if (!text.isEmpty()) {
                return text.trim();
            }
        }
        return XmlSupport.directText(docEl).trim();
    }

    private static List<String> getRefs(Element element, String tag) {
        List<String> refs = new ArrayList<>();
        for (Element refEl : XmlSupport.children(element, BPMN_NS, tag)) {
            String ref = refEl.getTextContent();
            if (ref != null && !ref.trim().isEmpty()) {
                refs.add(ref.trim());
            }
        }
        return refs;
    }

    private static Map<String, EventType> orderedEventTags() {
        Map<String, EventType> tags = new LinkedHashMap<>();
        tags.put("startEvent", EventType.START);
        tags.put("intermediateThrowEvent", EventType.INTERMEDIATE);
        tags.put("intermediateCatchEvent", EventType.INTERMEDIATE);
        tags.put("endEvent", EventType.END);
        return tags;
    }
}
