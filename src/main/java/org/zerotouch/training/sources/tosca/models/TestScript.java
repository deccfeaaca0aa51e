package org.zerotouch.training.sources.tosca.models;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fully parsed representation of a Tosca test script.
 * Steps keep the order in which they appear in the source document.
 */
@Builder
public record TestScript(
        String scriptId,
        String name,
        String description,
        String version,
        String process,
        String transaction,
        String siteCode,
        String siteName,
        String systemName,
        String executionStatus,
        int executionCount,
        String lastExecuted,
        List<TestStep> steps,
        List<Annotation> annotations,
        List<TestDataRow> testData
) {
    public TestScript {
        scriptId = scriptId == null ? "" : scriptId;
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        version = version == null ? "" : version;
        process = process == null ? "" : process;
        transaction = transaction == null ? "" : transaction;
        siteCode = siteCode == null ? "" : siteCode;
        siteName = siteName == null ? "" : siteName;
        systemName = systemName == null ? "" : systemName;
        executionStatus = executionStatus == null ? "" : executionStatus;
        lastExecuted = lastExecuted == null ? "" : lastExecuted;
        steps = steps == null ? List.of() : List.copyOf(steps);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
        testData = testData == null ? List.of() : List.copyOf(testData);
    }

    /**
     * Steps a user performs; verifications and calculations are left out.
     */
    public List<TestStep> userActionSteps() {
        return steps.stream().filter(TestStep::isUserAction).toList();
    }

    public List<Annotation> siteSpecificAnnotations() {
        return annotations.stream().filter(SiteSpecificity::isSiteSpecificAnnotation).toList();
    }

    /**
     * Steps referenced by a site-specific annotation, plus steps with at least one assertion whose
     * reason mentions the site. Returned in step order, each step once.
     */
    public List<TestStep> siteSpecificSteps() {
        Set<String> siteStepIds = siteSpecificAnnotations().stream()
                .map(Annotation::stepId)
                .collect(Collectors.toSet());

        List<TestStep> result = new ArrayList<>();
        for (TestStep step : steps) {
            if (siteStepIds.contains(step.stepId())) {
                result.add(step);
                continue;
            }
            for (Assertion assertion : step.assertions()) {
                if (SiteSpecificity.isSiteSpecificReason(assertion.reason(), siteName)) {
                    result.add(step);
                    break;
                }
            }
        }
        return result;
    }
}
