package com.phillippitts.voicestream.config.properties;

import com.phillippitts.voicestream.service.engine.EngineSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Configuration properties for the native synthesis engine.
 * Binds to properties prefixed with "tts.engine".
 *
 * <p>Example application.properties:
 * <pre>
 * tts.engine.library-path=/usr/lib/libRHVoice.so
 * tts.engine.data-path=/usr/share/RHVoice
 * tts.engine.resources[0]=/opt/voices/anna
 * tts.engine.expected-version=1.2.4
 * </pre>
 *
 * @param libraryPath native library location, unset for the system default
 * @param dataPath engine data directory, unset for the library's default
 * @param resources additional voice/resource directories
 * @param expectedVersion engine version this deployment was tested with; a mismatch is only
 *                        logged as a warning, unset disables the check
 */
@ConfigurationProperties(prefix = "tts.engine")
@Validated
public record EngineProperties(
        String libraryPath,
        String dataPath,
        List<String> resources,
        String expectedVersion
) {
    public EngineProperties {
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public EngineSettings toSettings() {
        return new EngineSettings(libraryPath, dataPath, resources);
    }
}
