package org.zerotouch.training.sources.bpmn;

import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.xml.ModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Pre-check of a diagram against the BPMN 2.0 model. {@link BpmnHelper} parses diagrams
 * whether or not they pass.
 */
public class BpmnValidator {
    private static final Logger log = LoggerFactory.getLogger(BpmnValidator.class);

    /**
     * @throws ModelException if the diagram cannot be read as a BPMN model or fails validation
     */
    public static void validate(Path diagramPath) {
        BpmnModelInstance model = Bpmn.readModelFromFile(diagramPath.toFile());
        Bpmn.validateModel(model);
    }

    public static boolean isValid(Path diagramPath) {
        try {
            validate(diagramPath);
            return true;
        } catch (ModelException e) {
            log.warn("Diagram {} is not valid BPMN 2.0: {}", diagramPath.getFileName(), e.getMessage());
            return false;
        }
    }
}
