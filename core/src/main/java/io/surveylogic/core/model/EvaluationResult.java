package io.surveylogic.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Full evaluation outcome for one answer set: visibility, next section and validation errors.
 * Always recomputed from scratch, never patched incrementally.
 *
 * @param visibility visible sections and fields
 * @param next       next section or completion
 * @param errors     validation errors in field declaration order
 */
public record EvaluationResult(VisibilitySnapshot visibility, NavigationResult next, List<ValidationError> errors) {

    public EvaluationResult {
        Objects.requireNonNull(visibility, "visibility must not be null");
        Objects.requireNonNull(next, "next must not be null");
        errors = List.copyOf(errors);
    }

    public List<String> visibleFieldIds() {
        return visibility.visibleFieldIds();
    }

    public List<String> visibleSectionIds() {
        return visibility.visibleSectionIds();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
