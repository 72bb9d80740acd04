package io.surveylogic.core.error;

import java.util.List;

/**
 * Thrown when the {@code nextSection} overrides of a definition form a cycle. The cycle is reported as
 * the ordered list of section ids, with the first id repeated at the end ({@code [a, b, a]}).
 */
public final class NavigationCycleException extends DefinitionLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public NavigationCycleException(String message, List<String> cycle, String surveyId, String source) {
        super(message, surveyId, source, "sections");
        this.cycle = List.copyOf(cycle);
    }

    /** Section ids forming the cycle, first id repeated at the end. */
    public List<String> cycle() {
        return cycle;
    }
}
