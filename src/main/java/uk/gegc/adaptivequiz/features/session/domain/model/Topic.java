package uk.gegc.adaptivequiz.features.session.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Math topics a quiz can be started on.
 */
public enum Topic {
    ALGEBRA("Algebra"),
    CALCULUS("Calculus"),
    GEOMETRY("Geometry"),
    STATISTICS("Statistics"),
    BASIC_ARITHMETIC("Basic Arithmetic");

    private final String displayName;

    Topic(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a topic from its display name ("Basic Arithmetic") or constant
     * name ("BASIC_ARITHMETIC"), ignoring case and surrounding whitespace.
     */
    public static Optional<Topic> fromDisplayName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(topic -> topic.displayName.equalsIgnoreCase(normalized)
                        || topic.name().equals(normalized.toUpperCase(Locale.ROOT)))
                .findFirst();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
