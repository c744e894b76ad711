package com.phillippitts.voicestream.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class SynthesisExceptionBuilderTest {

    @Test
    void buildsPlainMessageWithoutDetails() {
        SynthesisException ex = SynthesisExceptionBuilder.create("Synthesis failed").stage("engine").build();

        assertThat(ex.getMessage()).isEqualTo("Synthesis failed (stage: engine)");
        assertThat(ex.getStage()).isEqualTo("engine");
        assertThat(ex.getCause()).isNull();
    }

    @Test
    void appendsDetailsInOrder() {
        IOException cause = new IOException("error=2");

        SynthesisException ex = SynthesisExceptionBuilder.create("Failed to start encoder")
                .stage("encoder")
                .cause(cause)
                .durationMs(12)
                .metadata("format", "mp3")
                .metadata("command", "lame -")
                .build();

        assertThat(ex.getMessage()).isEqualTo(
                "Failed to start encoder (durationMs=12, format=mp3, command=lame -) (stage: encoder)");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void missingStageBecomesUnknown() {
        assertThat(SynthesisExceptionBuilder.create("x").build().getStage()).isEqualTo("unknown");
    }
}
