package io.surveylogic.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Declared answer type of a survey field. Drives comparison semantics and value checks. */
public enum FieldType {
    TEXT("text"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    CHOICE("choice"),
    MULTICHOICE("multichoice"),
    DATE("date");

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in definition files, e.g. {@code multichoice}. */
    public String wireName() {
        return wireName;
    }

    /** Returns {@code true} for the types whose answers are picked from declared options. */
    public boolean isChoice() {
        return this == CHOICE || this == MULTICHOICE;
    }

    /**
     * Resolves a definition-file type name (case-insensitive).
     *
     * @param name type name, e.g. {@code "number"}
     * @return the matching type, or empty if the name is unknown
     */
    public static Optional<FieldType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(normalized))
                .findFirst();
    }
}
