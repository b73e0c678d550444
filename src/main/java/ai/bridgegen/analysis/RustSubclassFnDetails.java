package ai.bridgegen.analysis;

import java.util.List;

import ai.bridgegen.model.QualifiedName;

/**
 * Generated function forwarding a virtual call from a native superclass to its subclass.
 */
public record RustSubclassFnDetails(List<QualifiedName> dependencies) {
    public RustSubclassFnDetails {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }
}
