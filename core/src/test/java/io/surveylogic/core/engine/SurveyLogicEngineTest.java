package io.surveylogic.core.engine;

import static io.surveylogic.core.testkit.TestSurveys.answers;
import static io.surveylogic.core.testkit.TestSurveys.fixture;
import static io.surveylogic.core.testkit.TestSurveys.invalidFixture;
import static io.surveylogic.core.testkit.TestSurveys.yaml;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.surveylogic.core.error.ConditionParseException;
import io.surveylogic.core.error.DefinitionParseException;
import io.surveylogic.core.error.NavigationCycleException;
import io.surveylogic.core.model.AnswerSet;
import io.surveylogic.core.model.ConditionTrace;
import io.surveylogic.core.model.EvaluationResult;
import io.surveylogic.core.model.NavigationResult.Reason;
import io.surveylogic.core.model.SurveyDefinition;
import io.surveylogic.core.model.Truth;
import io.surveylogic.core.model.ValidationError;
import io.surveylogic.core.model.VisibilitySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SurveyLogicEngineTest {

    private SurveyLogicEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SurveyLogicEngine();
    }

    @Nested
    class Loading {

        @Test
        void loadedDefinitionIsRegisteredUnderIdAndKey() {
            SurveyDefinition loaded = engine.loadDefinition(fixture("household-survey.yaml"));

            assertThat(engine.getDefinition("household")).containsSame(loaded);
            assertThat(engine.getDefinition("household@2")).containsSame(loaded);
            assertThat(engine.registry().definitionCount()).isEqualTo(1);
        }

        @Test
        void jsonDefinitionsLoadToo() {
            SurveyDefinition loaded = engine.loadDefinition(fixture("linear-survey.json"));

            assertThat(loaded.key()).isEqualTo("linear@1.0");
        }

        @Test
        @DisplayName("a rejected definition leaves the registry unchanged")
        void rejectedDefinitionIsNotRegistered() {
            engine.loadDefinition(fixture("employment-survey.yaml"));
            DefinitionRegistry before = engine.registry();

            assertThatThrownBy(() -> engine.loadDefinition(invalidFixture("navigation-cycle.yaml")))
                    .isInstanceOf(NavigationCycleException.class);

            assertThat(engine.registry()).isSameAs(before);
            assertThat(engine.getDefinition("looping")).isEmpty();
        }

        @Test
        @DisplayName("a single backward override loads and routes back")
        void backwardOverrideLoads() {
            SurveyDefinition loaded = engine.loadDefinition(yaml("""
                    id: confirming
                    version: "1"
                    sections:
                      - id: a
                        fields: [{id: name, type: text}]
                      - id: b
                        fields: [{id: confirm, type: boolean}]
                        nextSection:
                          - when: {field: confirm, value: false}
                            goTo: a
                    """), "inline");

            assertThat(engine.getDefinition("confirming")).containsSame(loaded);
            EvaluationResult result = engine.evaluate(loaded, answers("name", "Ann", "confirm", false), "b");
            assertThat(result.next().sectionId()).isEqualTo("a");
            assertThat(result.next().reason()).isEqualTo(Reason.OVERRIDE);
        }

        @Test
        void unreadableFileIsAParseError() {
            assertThatThrownBy(() -> engine.loadDefinition(invalidFixture("not-yaml.yaml")))
                    .isInstanceOf(DefinitionParseException.class);
            assertThat(engine.registry().definitionCount()).isZero();
        }

        @Test
        void newerVersionTakesOverPlainId() {
            engine.loadDefinition(yaml("""
                    id: pulse
                    version: "1"
                    sections: [{id: s, fields: [{id: q, type: text}]}]
                    """), "v1");
            SurveyDefinition second = engine.loadDefinition(yaml("""
                    id: pulse
                    version: "2"
                    sections: [{id: s, fields: [{id: q, type: number}]}]
                    """), "v2");

            assertThat(engine.getDefinition("pulse")).containsSame(second);
            assertThat(engine.getDefinition("pulse@1")).isPresent();
            assertThat(engine.registry().definitionCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("employment scenario")
    class Employment {

        private SurveyDefinition survey;

        @BeforeEach
        void load() {
            survey = engine.loadDefinition(fixture("employment-survey.yaml"));
        }

        @Test
        void unemployedHidesIncomeAndIsValid() {
            EvaluationResult result = engine.evaluate(survey, answers("employment_status", "Unemployed"), "status");

            assertThat(result.visibleFieldIds()).containsExactly("employment_status");
            assertThat(result.isValid()).isTrue();
            assertThat(result.next().isComplete()).isTrue();
            assertThat(result.next().reason()).isEqualTo(Reason.END_OF_SURVEY);
        }

        @Test
        void employedWithoutIncomeNeedsIncome() {
            EvaluationResult result = engine.evaluate(survey, answers("employment_status", "Employed"), "status");

            assertThat(result.visibleFieldIds()).containsExactly("employment_status", "income");
            assertThat(result.errors()).extracting(ValidationError::fieldId, ValidationError::code)
                    .containsExactly(tuple("income", ValidationError.Code.REQUIRED));
        }

        @Test
        void employedWithIncomeIsValid() {
            EvaluationResult result =
                    engine.evaluate(survey, answers("employment_status", "Employed", "income", 42), "status");

            assertThat(result.isValid()).isTrue();
        }

        @Test
        @DisplayName("answering more fields only resolves indeterminate outcomes")
        void indeterminateResolvesOnceAnswered() {
            AnswerSet none = AnswerSet.empty();
            AnswerSet answered = none.with("employment_status", "Employed");

            assertThat(engine.computeVisibility(survey, none, "status").fieldOutcome("income"))
                    .isEqualTo(Truth.INDETERMINATE);
            assertThat(engine.computeVisibility(survey, answered, "status").fieldOutcome("income"))
                    .isEqualTo(Truth.TRUE);
            assertThat(engine.computeVisibility(survey, answered.with("employment_status", "Unemployed"), "status")
                            .fieldOutcome("income"))
                    .isEqualTo(Truth.FALSE);
        }

        @Test
        void evaluationIsDeterministic() {
            AnswerSet answers = answers("employment_status", "Employed", "income", -5);

            EvaluationResult first = engine.evaluate(survey, answers, "status");
            EvaluationResult second = engine.evaluate(survey, answers, "status");

            assertThat(second).isEqualTo(first);
        }

        @Test
        void stepwiseCallsAgreeWithEvaluate() {
            AnswerSet answers = answers("employment_status", "Employed");
            VisibilitySnapshot snapshot = engine.computeVisibility(survey, answers, "status");

            EvaluationResult result = engine.evaluate(survey, answers, "status");

            assertThat(result.visibility()).isEqualTo(snapshot);
            assertThat(result.next()).isEqualTo(engine.resolveNext(survey, snapshot, "status"));
            assertThat(result.errors()).isEqualTo(engine.validate(survey, snapshot, answers));
        }
    }

    @Nested
    class Explain {

        @Test
        void explainsInlineCondition() {
            SurveyDefinition survey = engine.loadDefinition(fixture("household-survey.yaml"));

            ConditionTrace trace = engine.explain(
                    survey,
                    yaml("{operator: AND, conditions: [{field: age, comparison: lessThan, value: 18}, "
                            + "{field: has_children, value: true}]}"),
                    answers("age", 12));

            assertThat(trace.outcome()).isEqualTo(Truth.INDETERMINATE);
            assertThat(trace.leaves(Truth.INDETERMINATE)).hasSize(1);
            assertThat(trace.leaves(Truth.TRUE)).hasSize(1);
        }

        @Test
        void invalidInlineConditionIsRejected() {
            SurveyDefinition survey = engine.loadDefinition(fixture("household-survey.yaml"));

            assertThatThrownBy(() -> engine.explain(survey, yaml("{field: shoe_size, value: 9}"), AnswerSet.empty()))
                    .isInstanceOf(ConditionParseException.class)
                    .hasMessageContaining("shoe_size");
        }
    }
}
