package com.nevis.corpus.preprocess;

import com.nevis.corpus.exception.InvalidPreprocessStepException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PreprocessStepTest {

    @Test
    @DisplayName("Steps are listed in pipeline order")
    void shouldListStepsInOrder() {
        assertThat(Arrays.stream(PreprocessStep.values()).map(PreprocessStep::stepName))
            .containsExactly("tokenization", "segmentation", "tagging", "nerc");
    }

    @ParameterizedTest
    @EnumSource(PreprocessStep.class)
    @DisplayName("Prerequisites always come earlier in the pipeline")
    void shouldOnlyDependOnEarlierSteps(PreprocessStep step) {
        assertThat(step.prerequisites()).allMatch(required -> required.ordinal() < step.ordinal());
    }

    @Test
    @DisplayName("Every step after tokenization needs tokens")
    void shouldRequireTokenization() {
        assertThat(PreprocessStep.TOKENIZATION.prerequisites()).isEmpty();
        assertThat(PreprocessStep.SEGMENTATION.prerequisites()).containsExactly(PreprocessStep.TOKENIZATION);
        assertThat(PreprocessStep.TAGGING.prerequisites()).containsExactly(PreprocessStep.TOKENIZATION);
        assertThat(PreprocessStep.NERC.prerequisites()).containsExactly(PreprocessStep.TOKENIZATION);
    }

    @Test
    @DisplayName("Dependents mirror the prerequisite table")
    void shouldListDependents() {
        assertThat(PreprocessStep.TOKENIZATION.dependents())
            .containsExactly(PreprocessStep.SEGMENTATION, PreprocessStep.TAGGING, PreprocessStep.NERC);
        assertThat(PreprocessStep.SEGMENTATION.dependents()).isEmpty();
        assertThat(PreprocessStep.TAGGING.dependents()).isEmpty();
        assertThat(PreprocessStep.NERC.dependents()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(PreprocessStep.class)
    @DisplayName("Names resolve back to their step")
    void shouldResolveByName(PreprocessStep step) {
        assertThat(PreprocessStep.fromName(step.stepName())).isEqualTo(step);
    }

    @Test
    @DisplayName("Unknown names are rejected")
    void shouldRejectUnknownName() {
        assertThatThrownBy(() -> PreprocessStep.fromName("spell it"))
            .isInstanceOf(InvalidPreprocessStepException.class);
        assertThatThrownBy(() -> PreprocessStep.fromName("TOKENIZATION"))
            .isInstanceOf(InvalidPreprocessStepException.class);
        assertThatThrownBy(() -> PreprocessStep.fromName(null))
            .isInstanceOf(InvalidPreprocessStepException.class);
    }
}
