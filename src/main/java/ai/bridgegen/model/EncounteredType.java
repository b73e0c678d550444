package ai.bridgegen.model;

import java.util.Objects;

/**
 * JSONL line for types.jsonl
 * <p>
 * A type the bridge module already defines; downstream generation must skip it.
 */
public record EncounteredType(
        Kind kind,          // STRUCT | ENUM
        QualifiedName name
) {

    public EncounteredType {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    public enum Kind {
        STRUCT,
        ENUM
    }
}
