package ai.bridgegen.analysis;

import java.util.List;
import java.util.stream.Collectors;

import ai.bridgegen.model.QualifiedName;

/**
 * An item that must be emitted after the items it depends on.
 */
public interface HasDependencies {

    QualifiedName name();

    /**
     * Dependencies in discovery order; may contain duplicates.
     */
    List<QualifiedName> deps();

    default String formatDeps() {
        return deps().stream().map(QualifiedName::toString).collect(Collectors.joining(","));
    }
}
