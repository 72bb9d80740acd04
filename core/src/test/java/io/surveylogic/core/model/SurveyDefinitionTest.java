package io.surveylogic.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Structural invariants enforced by the definition constructor. */
class SurveyDefinitionTest {

    private static Field text(String id) {
        return new Field(id, FieldType.TEXT, List.of());
    }

    @Test
    void indexesSectionsAndFieldsInDeclaredOrder() {
        SurveyDefinition definition = new SurveyDefinition(
                "s",
                "1",
                null,
                List.of(new Section("one", List.of("b", "a")), new Section("two", List.of("c"))),
                List.of(text("a"), text("b"), text("c")));

        assertThat(definition.key()).isEqualTo("s@1");
        assertThat(definition.fields()).extracting(Field::id).containsExactly("b", "a", "c");
        assertThat(definition.fieldIndex("c")).isEqualTo(2);
        assertThat(definition.sectionIndex("two")).isEqualTo(1);
        assertThat(definition.sectionIndex("missing")).isEqualTo(-1);
        assertThat(definition.sectionOf("c")).map(Section::id).contains("two");
    }

    @Test
    void rejectsDuplicateFieldIds() {
        assertThatThrownBy(() -> new SurveyDefinition(
                        "s", "1", null, List.of(new Section("one", List.of("a"))), List.of(text("a"), text("a"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate field id");
    }

    @Test
    void rejectsFieldListedInTwoSections() {
        assertThatThrownBy(() -> new SurveyDefinition(
                        "s",
                        "1",
                        null,
                        List.of(new Section("one", List.of("a")), new Section("two", List.of("a"))),
                        List.of(text("a"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'one' and 'two'");
    }

    @Test
    void rejectsOrphanFields() {
        assertThatThrownBy(() -> new SurveyDefinition(
                        "s", "1", null, List.of(new Section("one", List.of("a"))), List.of(text("a"), text("z"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[z]");
    }
}
