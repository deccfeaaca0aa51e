package org.zerotouch.training.sources.report;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.Version;
import org.zerotouch.training.sources.bpmn.models.BpmnElement;
import org.zerotouch.training.sources.bpmn.models.BpmnProcess;
import org.zerotouch.training.sources.bpmn.models.DataObject;
import org.zerotouch.training.sources.bpmn.models.Gateway;
import org.zerotouch.training.sources.bpmn.models.OutgoingFlow;
import org.zerotouch.training.sources.bpmn.models.Task;
import org.zerotouch.training.sources.overlay.OverlayAssembler;
import org.zerotouch.training.sources.overlay.models.RawOverlayRule;
import org.zerotouch.training.sources.overlay.models.SiteInfo;
import org.zerotouch.training.sources.overlay.models.Variation;
import org.zerotouch.training.sources.tosca.models.Annotation;
import org.zerotouch.training.sources.tosca.models.TestScript;
import org.zerotouch.training.sources.tosca.models.TestStep;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders plain-text summaries of parsed sources from the templates under {@code templates/}.
 * The templates only see strings, numbers and lists of maps built here.
 */
public class SummaryRenderer {

    private static final Configuration FREEMARKER_CONFIG;

    static {
        FREEMARKER_CONFIG = new Configuration(new Version("2.3.32"));
        FREEMARKER_CONFIG.setDefaultEncoding(StandardCharsets.UTF_8.name());
        FREEMARKER_CONFIG.setClassLoaderForTemplateLoading(
                SummaryRenderer.class.getClassLoader(),
                "templates"
        );

        // fail fast when variables are missing, etc.
        FREEMARKER_CONFIG.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        FREEMARKER_CONFIG.setLogTemplateExceptions(false);
        FREEMARKER_CONFIG.setFallbackOnNullLoopVariable(false);
    }

    public static String renderProcessSummary(BpmnProcess process) {
        Map<String, Object> model = new HashMap<>();
        model.put("name", process.name());
        model.put("id", process.id());
        model.put("roles", process.roles());
        model.put("taskCount", process.tasks().size());
        model.put("gatewayCount", process.gateways().size());
        model.put("eventCount", process.events().size());
        model.put("flowCount", process.sequenceFlows().size());
        model.put("documentationLines", firstLines(process.documentation(), 8));

        List<Map<String, Object>> elements = new ArrayList<>();
        for (BpmnElement element : process.orderedElements()) {
            Map<String, Object> row = new HashMap<>();
            row.put("kind", String.format("%-8s", element.getClass().getSimpleName()));
            row.put("name", element.name());
            row.put("extra", elementDetail(process, element));
            elements.add(row);
        }
        model.put("elements", elements);

        List<Map<String, Object>> decisions = new ArrayList<>();
        for (Gateway gateway : process.decisionPoints()) {
            Map<String, Object> row = new HashMap<>();
            row.put("name", gateway.name());
            row.put("documentationLines", firstLines(gateway.documentation(), 4));
            decisions.add(row);
        }
        model.put("decisions", decisions);

        List<String> documents = new ArrayList<>();
        for (DataObject dataObject : process.dataObjects()) {
            documents.add(dataObject.documentation().isEmpty()
                    ? dataObject.id()
                    : dataObject.documentation().split("\n")[0]);
        }
        model.put("documents", documents);

        return render("process_summary.ftl", model);
    }

    public static String renderScriptSummary(TestScript script) {
        List<TestStep> siteSpecificSteps = script.siteSpecificSteps();
        Set<String> siteSpecificIds = siteSpecificSteps.stream()
                .map(TestStep::stepId)
                .collect(Collectors.toSet());

        Map<String, Object> model = new HashMap<>();
        model.put("name", script.name());
        model.put("scriptId", script.scriptId());
        model.put("siteName", script.siteName());
        model.put("siteCode", script.siteCode());
        model.put("systemName", script.systemName());
        model.put("executionStatus", script.executionStatus());
        model.put("executionCount", script.executionCount());
        model.put("lastExecuted", script.lastExecuted());
        model.put("stepCount", script.steps().size());
        model.put("userActionCount", script.userActionSteps().size());
        model.put("siteSpecificCount", siteSpecificSteps.size());

        List<Map<String, Object>> steps = new ArrayList<>();
        for (TestStep step : script.steps()) {
            Map<String, Object> row = new HashMap<>();
            row.put("number", String.format("%3d", step.stepNumber()));
            row.put("actionType", String.format("%-8s", step.actionType()));
            row.put("description", step.description());
            row.put("detail", stepDetail(step));
            row.put("marker", siteSpecificIds.contains(step.stepId()) ? " [SITE-SPECIFIC]" : "");
            steps.add(row);
        }
        model.put("steps", steps);

        List<Map<String, Object>> annotations = new ArrayList<>();
        for (Annotation annotation : script.annotations()) {
            Map<String, Object> row = new HashMap<>();
            row.put("type", annotation.type());
            row.put("description", abbreviate(annotation.description(), 100));
            annotations.add(row);
        }
        model.put("annotations", annotations);

        return render("script_summary.ftl", model);
    }

    public static String renderOverlaySummary(OverlayAssembler assembler) {
        SiteInfo site = assembler.getSiteInfo();
        List<RawOverlayRule> rules = assembler.getRawOverlays();

        Map<String, Object> model = new HashMap<>();
        model.put("siteName", site.name != null ? site.name : "Unknown");
        model.put("siteCode", site.code != null ? site.code : "");
        model.put("system", site.system != null ? site.system : "");

        int totalVariations = 0;
        List<Map<String, Object>> ruleRows = new ArrayList<>();
        for (RawOverlayRule rule : rules) {
            List<Variation> variations = rule.variations != null ? rule.variations : List.of();
            totalVariations += variations.size();

            List<Map<String, Object>> variationRows = new ArrayList<>();
            for (Variation variation : variations) {
                if (variation == null) {
                    continue;
                }
                Map<String, Object> row = new HashMap<>();
                row.put("label", variation.has(Variation.FIELD)
                        ? variation.text(Variation.FIELD)
                        : variation.text(Variation.STEP));
                row.put("type", variation.type());
                variationRows.add(row);
            }

            Map<String, Object> ruleRow = new HashMap<>();
            ruleRow.put("process", rule.process != null ? rule.process : "");
            ruleRow.put("transaction", rule.transaction != null ? rule.transaction : "");
            ruleRow.put("variationCount", variations.size());
            ruleRow.put("variations", variationRows);
            ruleRows.add(ruleRow);
        }
        model.put("totalRules", totalVariations);
        model.put("rules", ruleRows);

        return render("overlay_summary.ftl", model);
    }

    private static String elementDetail(BpmnProcess process, BpmnElement element) {
        if (element instanceof Task task && !task.transactionCode().isEmpty()) {
            return " [" + task.transactionCode() + "]";
        }
        if (element instanceof Gateway) {
            List<String> paths = new ArrayList<>();
            for (OutgoingFlow flow : process.getOutgoingFlows(element.id())) {
                paths.add(flow.label().isEmpty() ? "default" : "'" + flow.label() + "'");
            }
            return paths.isEmpty() ? "" : " -> paths: " + String.join(", ", paths);
        }
        return "";
    }

    private static String stepDetail(TestStep step) {
        if (!step.value().isEmpty()) {
            return " -> " + step.value();
        }
        if (!step.targetUrl().isEmpty()) {
            return " -> " + step.targetUrl();
        }
        return "";
    }

    private static List<String> firstLines(String text, int limit) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(text.split("\n"))
                .limit(limit)
                .map(String::trim)
                .toList();
    }

    private static String abbreviate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }

    private static String render(String templateName, Map<String, Object> model) {
        try (StringWriter out = new StringWriter()) {
            Template template = FREEMARKER_CONFIG.getTemplate(templateName);
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render summary template " + templateName, e);
        }
    }
}
