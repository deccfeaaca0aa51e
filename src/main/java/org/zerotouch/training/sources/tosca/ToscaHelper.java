package org.zerotouch.training.sources.tosca;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.zerotouch.training.sources.MalformedSourceException;
import org.zerotouch.training.sources.XmlSupport;
import org.zerotouch.training.sources.tosca.models.Annotation;
import org.zerotouch.training.sources.tosca.models.Assertion;
import org.zerotouch.training.sources.tosca.models.TestDataRow;
import org.zerotouch.training.sources.tosca.models.TestScript;
import org.zerotouch.training.sources.tosca.models.TestStep;
import org.zerotouch.training.sources.tosca.models.UIElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses Tosca-style XML test scripts, namespaced or bare, into {@link TestScript}s.
 * Missing optional elements read as empty strings or zero.
 */
public class ToscaHelper {
    private static final Logger log = LoggerFactory.getLogger(ToscaHelper.class);

    public static final String TOSCA_NS = "http://www.tricentis.com/tosca/2.0";

    /**
     * Parses a Tosca XML file.
     *
     * @param toscaFilePath path to the test script
     * @return the parsed test script
     * @throws MalformedSourceException if the file cannot be read or is not well-formed XML
     */
    public static TestScript parseToscaFile(String toscaFilePath) {
        Document doc = XmlSupport.parseXmlFile(toscaFilePath);
        Element root = doc.getDocumentElement();

        ToscaSchema schema = ToscaSchema.detect(root);
        log.debug("Reading {} as {} Tosca document", toscaFilePath, schema);

        TestScript script = switch (schema) {
            case NAMESPACED -> parseNamespaced(root);
            case BARE -> parseBare(root);
        };

        log.info("Parsed Tosca {}: {} steps, {} site-specific",
                script.name(), script.steps().size(), script.siteSpecificSteps().size());
        return script;
    }

    // ------ namespaced documents

    private static TestScript parseNamespaced(Element root) {
        Element metadata = XmlSupport.firstChild(root, TOSCA_NS, "Metadata");
        Element env = XmlSupport.firstChild(root, TOSCA_NS, "TestEnvironment");

        List<TestStep> steps = new ArrayList<>();
        for (Element stepEl : XmlSupport.descendants(root, TOSCA_NS, "Step")) {
            // <Annotation><Step> holds a step id reference, not a step
            Element parent = (Element) stepEl.getParentNode();
            if ("Annotation".equals(parent.getLocalName())) {
                continue;
            }
            steps.add(parseStep(stepEl, TOSCA_NS));
        }

        List<Annotation> annotations = new ArrayList<>();
        for (Element annotationEl : XmlSupport.descendants(root, TOSCA_NS, "Annotation")) {
            annotations.add(parseAnnotation(annotationEl, TOSCA_NS));
        }

        return TestScript.builder()
                .scriptId(text(metadata, TOSCA_NS, "TestScriptId"))
                .name(text(metadata, TOSCA_NS, "Name"))
                .description(text(metadata, TOSCA_NS, "Description"))
                .version(text(metadata, TOSCA_NS, "Version"))
                .process(text(metadata, TOSCA_NS, "Process"))
                .transaction(text(metadata, TOSCA_NS, "Transaction"))
                .executionStatus(text(metadata, TOSCA_NS, "ExecutionStatus"))
                .executionCount(parseIntOrZero(text(metadata, TOSCA_NS, "ExecutionCount"), "ExecutionCount"))
                .lastExecuted(text(metadata, TOSCA_NS, "LastExecutedDate"))
                .siteCode(text(env, TOSCA_NS, "SiteCode"))
                .siteName(text(env, TOSCA_NS, "SiteName"))
                .systemName(text(env, TOSCA_NS, "SystemName"))
                .steps(steps)
                .annotations(annotations)
                .testData(parseDataRows(root, TOSCA_NS))
                .build();
    }

    // ------ bare documents

    private static TestScript parseBare(Element root) {
        Element metadata = firstNonNull(
                XmlSupport.firstChild(root, null, "Metadata"),
                XmlSupport.firstChild(root, null, "metadata"));
        Element env = firstNonNull(
                XmlSupport.firstChild(root, null, "TestEnvironment"),
                XmlSupport.firstChild(root, null, "testEnvironment"));

        List<TestStep> steps = new ArrayList<>();
        Element stepsContainer = firstNonNull(
                XmlSupport.firstDescendant(root, null, "TestSteps"),
                XmlSupport.firstDescendant(root, null, "steps"));
        if (stepsContainer != null) {
            List<Element> stepEls = XmlSupport.children(stepsContainer, null, "Step");
            if (stepEls.isEmpty()) {
                stepEls = XmlSupport.children(stepsContainer, null, "step");
            }
            for (Element stepEl : stepEls) {
                steps.add(parseStep(stepEl, null));
            }
        }

        List<Annotation> annotations = new ArrayList<>();
        Element annotationsContainer = XmlSupport.firstDescendant(root, null, "Annotations");
        for (Element annotationEl : XmlSupport.children(annotationsContainer, null, "Annotation")) {
            annotations.add(parseAnnotation(annotationEl, null));
        }

        return TestScript.builder()
                .scriptId(text(metadata, null, "TestScriptId"))
                .name(textEither(metadata, "Name", "name"))
                .description(textEither(metadata, "Description", "description"))
                .version(textEither(metadata, "Version", "version"))
                .process(textEither(metadata, "Process", "process"))
                .transaction(textEither(metadata, "Transaction", "transaction"))
                .executionStatus(textEither(metadata, "ExecutionStatus", "status"))
                .executionCount(parseIntOrZero(text(metadata, null, "ExecutionCount"), "ExecutionCount"))
                .lastExecuted(textEither(metadata, "LastExecutedDate", "last_executed"))
                .siteCode(text(env, null, "SiteCode"))
                .siteName(text(env, null, "SiteName"))
                .systemName(text(env, null, "SystemName"))
                .steps(steps)
                .annotations(annotations)
                .testData(parseDataRows(root, null))
                .build();
    }

    // ------ shared element readers, namespace is null for bare documents

    private static TestStep parseStep(Element stepEl, String ns) {
        Element actionEl = XmlSupport.firstChild(stepEl, ns, "Action");

        UIElement element = null;
        Element elementEl = XmlSupport.firstChild(actionEl, ns, "Element");
        if (elementEl != null) {
            element = new UIElement(
                    text(elementEl, ns, "Identifier"),
                    text(elementEl, ns, "Description"));
        }

        List<Assertion> assertions = new ArrayList<>();
        for (Element assertionEl : XmlSupport.children(stepEl, ns, "Assertion")) {
            assertions.add(new Assertion(
                    text(assertionEl, ns, "Type"),
                    text(assertionEl, ns, "FieldReference"),
                    text(assertionEl, ns, "ExpectedValue"),
                    text(assertionEl, ns, "AllowedValues"),
                    text(assertionEl, ns, "ValidationType"),
                    text(assertionEl, ns, "Reason")));
        }

        return TestStep.builder()
                .stepId(text(stepEl, ns, "StepId"))
                .stepNumber(parseIntOrZero(text(stepEl, ns, "StepNumber"), "StepNumber"))
                .description(text(stepEl, ns, "Description"))
                .actionType(text(actionEl, ns, "Type"))
                .element(element)
                .value(text(actionEl, ns, "Value"))
                .targetUrl(text(actionEl, ns, "TargetURL"))
                .expectedResult(text(stepEl, ns, "ExpectedResult"))
                .screenshot(text(stepEl, ns, "ScreenshotReference"))
                .assertions(assertions)
                .build();
    }

    private static Annotation parseAnnotation(Element annotationEl, String ns) {
        return new Annotation(
                text(annotationEl, ns, "Type"),
                text(annotationEl, ns, "Step"),
                text(annotationEl, ns, "Description"));
    }

    private static List<TestDataRow> parseDataRows(Element root, String ns) {
        List<TestDataRow> rows = new ArrayList<>();
        for (Element rowEl : XmlSupport.descendants(root, ns, "DataRow")) {
            rows.add(new TestDataRow(
                    text(rowEl, ns, "FieldName"),
                    text(rowEl, ns, "FieldValue"),
                    text(rowEl, ns, "FieldDescription")));
        }
        return rows;
    }

    private static String text(Element parent, String ns, String tag) {
        return XmlSupport.childText(parent, ns, tag);
    }

    private static String textEither(Element parent, String tag, String fallbackTag) {
        String value = text(parent, null, tag);
        return value.isEmpty() ? text(parent, null, fallbackTag) : value;
    }

    private static int parseIntOrZero(String value, String field) {
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Non-numeric {} '{}', using 0", field, value);
            return 0;
        }
    }

    private static Element firstNonNull(Element first, Element second) {
        return first != null ? first : second;
    }
}
