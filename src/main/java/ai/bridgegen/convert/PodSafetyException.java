package ai.bridgegen.convert;

import java.util.Objects;

import ai.bridgegen.model.QualifiedName;

/**
 * A type requested as value-safe can not be proven safe to pass by value.
 */
public final class PodSafetyException extends Exception {

    private static final long serialVersionUID = 1L;

    private final QualifiedName offendingType;

    public PodSafetyException(QualifiedName offendingType, String message) {
        super(message);
        this.offendingType = Objects.requireNonNull(offendingType, "offendingType");
    }

    public QualifiedName offendingType() {
        return offendingType;
    }
}
