package ai.bridgegen.analysis;

import java.util.List;

import ai.bridgegen.model.QualifiedName;

/**
 * @param deps types the alias target mentions
 */
public record TypedefAnalysis(List<QualifiedName> deps) {
    public TypedefAnalysis {
        deps = deps != null ? List.copyOf(deps) : List.of();
    }
}
