package ai.bridgegen.analysis;

import java.util.List;
import java.util.Objects;

import ai.bridgegen.model.QualifiedName;

/**
 * Struct analysis available from the first analysis phase on.
 *
 * @param fieldTypes types of every field, only meaningful for {@link TypeKind#POD}
 */
public record PodAnalysis(
        TypeKind kind,
        List<QualifiedName> fieldTypes
) {
    public PodAnalysis {
        Objects.requireNonNull(kind, "kind");
        fieldTypes = fieldTypes != null ? List.copyOf(fieldTypes) : List.of();
    }
}
