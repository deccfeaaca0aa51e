package org.zerotouch.training.sources;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.zerotouch.training.sources.bpmn.models.BpmnProcess;
import org.zerotouch.training.sources.tosca.models.TestScript;

import java.util.List;

/**
 * Every source document parsed in one run, in the order the paths were given.
 */
public record ParsedSources(
        @JsonProperty("tosca_scripts") List<TestScript> toscaScripts,
        @JsonProperty("bpmn_processes") List<BpmnProcess> bpmnProcesses
) {
    public ParsedSources {
        toscaScripts = toscaScripts == null ? List.of() : List.copyOf(toscaScripts);
        bpmnProcesses = bpmnProcesses == null ? List.of() : List.copyOf(bpmnProcesses);
    }
}
