package ai.bridgegen.analysis;

import java.util.List;

import ai.bridgegen.model.QualifiedName;

/**
 * Items that can not be ordered because they depend on each other.
 */
public final class DependencyCycleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<QualifiedName> unordered;

    public DependencyCycleException(List<QualifiedName> unordered) {
        super("Dependency cycle among: " + unordered);
        this.unordered = List.copyOf(unordered);
    }

    public List<QualifiedName> unordered() {
        return unordered;
    }
}
