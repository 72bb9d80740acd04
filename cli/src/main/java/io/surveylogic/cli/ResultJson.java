package io.surveylogic.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surveylogic.core.model.EvaluationResult;
import io.surveylogic.core.model.NavigationResult;
import io.surveylogic.core.model.ValidationError;
import io.surveylogic.core.model.VisibilitySnapshot;

/** Renders evaluation results as JSON for command output. */
final class ResultJson {

    private ResultJson() {}

    static ObjectNode toJson(ObjectMapper mapper, EvaluationResult result) {
        VisibilitySnapshot visibility = result.visibility();
        ObjectNode root = mapper.createObjectNode();
        root.put("surveyId", visibility.surveyId());
        root.put("version", visibility.surveyVersion());
        root.put("section", visibility.currentSectionId());

        ArrayNode sections = root.putArray("visibleSections");
        visibility.visibleSectionIds().forEach(sections::add);
        ArrayNode fields = root.putArray("visibleFields");
        visibility.visibleFieldIds().forEach(fields::add);

        NavigationResult next = result.next();
        ObjectNode nextNode = root.putObject("next");
        if (next.isComplete()) {
            nextNode.putNull("section");
        } else {
            nextNode.put("section", next.sectionId());
        }
        nextNode.put("complete", next.isComplete());
        nextNode.put("reason", next.reason().name());

        root.put("valid", result.isValid());
        ArrayNode errors = root.putArray("errors");
        for (ValidationError error : result.errors()) {
            ObjectNode errorNode = errors.addObject();
            errorNode.put("field", error.fieldId());
            errorNode.put("code", error.code().name());
            errorNode.put("message", error.message());
        }
        return root;
    }
}
