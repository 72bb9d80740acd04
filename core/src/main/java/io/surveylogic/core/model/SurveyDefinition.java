package io.surveylogic.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated, immutable representation of one survey version. Created at load time by {@code
 * DefinitionParser} and shared across concurrent evaluations; a new version is a new instance,
 * never an in-place edit.
 *
 * <p>
 * The constructor enforces the structural invariants (unique ids, every field placed in exactly
 * one section). Semantic checks on conditions, rules and navigation happen in the parser before
 * an instance is built.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class SurveyDefinition {

    private final String id;
    private final String version;
    private final String title;
    private final List<Section> sections;
    private final List<Field> fields;
    private final Map<String, Section> sectionsById;
    private final Map<String, Field> fieldsById;
    private final Map<String, String> sectionIdByField;
    private final Map<String, Integer> sectionIndex;
    private final Map<String, Integer> fieldIndex;

    /**
     * Creates a definition.
     *
     * @param id       survey id
     * @param version  survey version
     * @param title    display title, may be null
     * @param sections sections in declared order
     * @param fields   all fields of the survey; declared order follows sections
     * @throws IllegalArgumentException on duplicate ids or fields not placed in exactly one
     *                                  section
     */
    public SurveyDefinition(String id, String version, String title, List<Section> sections, List<Field> fields) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
        this.title = title;
        Objects.requireNonNull(sections, "sections must not be null");
        Objects.requireNonNull(fields, "fields must not be null");

        Map<String, Field> byId = new HashMap<>();
        for (Field field : fields) {
            if (byId.put(field.id(), field) != null) {
                throw new IllegalArgumentException("Duplicate field id: '" + field.id() + "'");
            }
        }

        Map<String, Section> sectionMap = new LinkedHashMap<>();
        Map<String, String> owner = new HashMap<>();
        Map<String, Integer> sIndex = new HashMap<>();
        Map<String, Integer> fIndex = new HashMap<>();
        Map<String, Field> orderedFields = new LinkedHashMap<>();
        for (Section section : sections) {
            if (sectionMap.put(section.id(), section) != null) {
                throw new IllegalArgumentException("Duplicate section id: '" + section.id() + "'");
            }
            sIndex.put(section.id(), sIndex.size());
            for (String fieldId : section.fieldIds()) {
                Field field = byId.get(fieldId);
                if (field == null) {
                    throw new IllegalArgumentException(
                            "Section '" + section.id() + "' lists unknown field '" + fieldId + "'");
                }
                String previous = owner.put(fieldId, section.id());
                if (previous != null) {
                    throw new IllegalArgumentException("Field '" + fieldId + "' is listed in sections '" + previous
                            + "' and '" + section.id() + "'");
                }
                fIndex.put(fieldId, fIndex.size());
                orderedFields.put(fieldId, field);
            }
        }
        if (orderedFields.size() != byId.size()) {
            List<String> orphans = new ArrayList<>(byId.keySet());
            orphans.removeAll(orderedFields.keySet());
            Collections.sort(orphans);
            throw new IllegalArgumentException("Fields not placed in any section: " + orphans);
        }

        this.sections = List.copyOf(sections);
        this.fields = List.copyOf(orderedFields.values());
        this.sectionsById = Collections.unmodifiableMap(sectionMap);
        this.fieldsById = Collections.unmodifiableMap(orderedFields);
        this.sectionIdByField = Collections.unmodifiableMap(owner);
        this.sectionIndex = Collections.unmodifiableMap(sIndex);
        this.fieldIndex = Collections.unmodifiableMap(fIndex);
    }

    public String id() {
        return id;
    }

    public String version() {
        return version;
    }

    public String title() {
        return title;
    }

    /** Registry key of this version: {@code id@version}. */
    public String key() {
        return id + "@" + version;
    }

    /** Sections in declared order. */
    public List<Section> sections() {
        return sections;
    }

    /** All fields in declared survey order (section order, then field order within a section). */
    public List<Field> fields() {
        return fields;
    }

    public Optional<Section> section(String sectionId) {
        return Optional.ofNullable(sectionsById.get(sectionId));
    }

    public Optional<Field> field(String fieldId) {
        return Optional.ofNullable(fieldsById.get(fieldId));
    }

    /** Returns the section that owns the given field. */
    public Optional<Section> sectionOf(String fieldId) {
        String sectionId = sectionIdByField.get(fieldId);
        return sectionId == null ? Optional.empty() : section(sectionId);
    }

    /** Zero-based declaration index of a section, or {@code -1} if unknown. */
    public int sectionIndex(String sectionId) {
        return sectionIndex.getOrDefault(sectionId, -1);
    }

    /** Zero-based declaration index of a field in survey order, or {@code -1} if unknown. */
    public int fieldIndex(String fieldId) {
        return fieldIndex.getOrDefault(fieldId, -1);
    }

    @Override
    public String toString() {
        return "SurveyDefinition[" + key() + ", sections=" + sections.size() + ", fields=" + fields.size() + "]";
    }
}
