package ai.bridgegen.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fully scoped name of a type or function in the foreign interface.
 * Textual form is the namespace and name joined with {@code ::}.
 */
public record QualifiedName(List<String> namespace, String name) {

    public static final String SEPARATOR = "::";

    public QualifiedName {
        namespace = namespace != null ? List.copyOf(namespace) : List.of();
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static QualifiedName of(String text) {
        Objects.requireNonNull(text, "text");
        final String trimmed = text.trim();
        final String stripped = trimmed.startsWith(SEPARATOR) ? trimmed.substring(SEPARATOR.length()) : trimmed;
        final List<String> parts = new ArrayList<>(Arrays.asList(stripped.split(SEPARATOR, -1)));
        final String last = parts.remove(parts.size() - 1);
        return new QualifiedName(parts, last);
    }

    public static QualifiedName of(List<String> segments) {
        Objects.requireNonNull(segments, "segments");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("segments must not be empty");
        }
        return new QualifiedName(segments.subList(0, segments.size() - 1), segments.get(segments.size() - 1));
    }

    public boolean topLevel() {
        return namespace.isEmpty();
    }

    @JsonValue
    @Override
    public String toString() {
        if (namespace.isEmpty()) {
            return name;
        }
        return String.join(SEPARATOR, namespace) + SEPARATOR + name;
    }
}
