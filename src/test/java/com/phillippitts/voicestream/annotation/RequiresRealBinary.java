package com.phillippitts.voicestream.annotation;

import org.junit.jupiter.api.Tag;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks tests that require external binaries (e.g., the lame or opusenc encoders).
 *
 * <p>These tests are excluded from the default Maven run. To run them locally:
 * <pre>
 * mvn test -Dsurefire.excludedGroups= -Dgroups=real-binary
 * </pre>
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Tag("real-binary")
public @interface RequiresRealBinary {
    /**
     * Human-readable description of what this test requires.
     * Example: "lame on PATH (apt install lame)"
     */
    String value() default "";
}
