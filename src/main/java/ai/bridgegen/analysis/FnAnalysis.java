package ai.bridgegen.analysis;

import java.util.List;

import ai.bridgegen.model.QualifiedName;

/**
 * @param deps types and functions the signature needs
 */
public record FnAnalysis(List<QualifiedName> deps) {
    public FnAnalysis {
        deps = deps != null ? List.copyOf(deps) : List.of();
    }
}
