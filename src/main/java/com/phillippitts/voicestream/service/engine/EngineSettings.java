package com.phillippitts.voicestream.service.engine;

import java.util.List;

/**
 * Locations an engine needs at initialization.
 *
 * @param libraryPath path of the native engine library, or null for the system default
 * @param dataPath directory with the engine's language and voice data, or null for the default
 * @param resources additional voice/resource paths to load
 */
public record EngineSettings(String libraryPath, String dataPath, List<String> resources) {

    public EngineSettings {
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(null, null, List.of());
    }
}
