package ai.bridgegen.analysis;

import java.util.List;
import java.util.Objects;

import ai.bridgegen.model.QualifiedName;

/**
 * Struct analysis once constructors and allocators have been analysed.
 *
 * @param constructorAndAllocatorDeps functions that must exist before the struct can be emitted
 */
public record PodAndDepAnalysis(
        PodAnalysis pod,
        List<QualifiedName> constructorAndAllocatorDeps
) {
    public PodAndDepAnalysis {
        Objects.requireNonNull(pod, "pod");
        constructorAndAllocatorDeps = constructorAndAllocatorDeps != null
                ? List.copyOf(constructorAndAllocatorDeps)
                : List.of();
    }
}
