package ai.paraflow.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Reads and writes {@link AnalysisSettings} as JSON. */
public final class SettingsLoader {
    private static final Logger logger = LogManager.getLogger(SettingsLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private SettingsLoader() {}

    /**
     * Loads settings from a JSON file.
     *
     * @throws IllegalArgumentException if the file is not valid JSON, has unknown properties or invalid values
     * @throws IOException if the file cannot be read
     */
    public static AnalysisSettings load(Path file) throws IOException {
        var json = Files.readString(file);
        var settings = parse(json, file.toString());
        logger.debug("Loaded settings from {}: {}", file, settings);
        return settings;
    }

    public static AnalysisSettings parse(String json) {
        return parse(json, "settings");
    }

    private static AnalysisSettings parse(String json, String source) {
        if (json.isBlank()) {
            return AnalysisSettings.defaults();
        }
        try {
            return MAPPER.readValue(json, AnalysisSettings.class);
        } catch (JsonProcessingException e) {
            // value validation failures arrive wrapped
            var cause =
                    e.getCause() instanceof IllegalArgumentException iae ? iae.getMessage() : e.getOriginalMessage();
            throw new IllegalArgumentException("Invalid " + source + ": " + cause, e);
        }
    }

    public static String toJson(AnalysisSettings settings) {
        try {
            return MAPPER.writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settings", e);
        }
    }
}
