package com.whereq.scribe.model;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionParamsTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void defaultsAreValid() {
        TranscriptionParams params = TranscriptionParams.defaults();

        assertThat(params.getTask()).isEqualTo(TaskKind.TRANSCRIBE);
        assertThat(params.getBeamSize()).isEqualTo(5);
        assertThat(params.isVadFilter()).isTrue();
        assertThat(params.getLanguage()).isNull();
        assertThat(validator.validate(params)).isEmpty();
    }

    @Test
    void beamSizeOutOfBounds() {
        TranscriptionParams params = TranscriptionParams.builder().beamSize(11).build();

        assertThat(validator.validate(params)).hasSize(1);
    }

    @Test
    void speakerRangeMustBeOrdered() {
        TranscriptionParams params = TranscriptionParams.builder()
            .enableDiarization(true)
            .minSpeakers(4)
            .maxSpeakers(2)
            .build();

        Set<ConstraintViolation<TranscriptionParams>> violations = validator.validate(params);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
            .containsExactly("speakerRangeValid");
    }

    @Test
    void taskParsingIgnoresCase() {
        assertThat(TaskKind.parse("Translate")).isEqualTo(TaskKind.TRANSLATE);
        assertThat(TaskKind.parse(" transcribe ")).isEqualTo(TaskKind.TRANSCRIBE);
        assertThatThrownBy(() -> TaskKind.parse("summarize"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("transcribe");
    }
}
