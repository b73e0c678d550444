package ai.bridgegen.convert;

import java.util.Objects;

import ai.bridgegen.model.QualifiedName;

/**
 * Conversion of a binding module failed; nothing of the run is usable.
 */
public final class ConvertException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        NO_CONTENT,
        UNSAFE_POD_TYPE,
        UNKNOWN_FOREIGN_ITEM
    }

    private final Kind kind;
    private final QualifiedName typeName;

    private ConvertException(Kind kind, QualifiedName typeName, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.typeName = typeName;
    }

    public static ConvertException noContent(String moduleName) {
        return new ConvertException(Kind.NO_CONTENT, null, "Module " + moduleName + " has no content", null);
    }

    public static ConvertException unsafePodType(PodSafetyException cause) {
        return new ConvertException(Kind.UNSAFE_POD_TYPE, cause.offendingType(), cause.getMessage(), cause);
    }

    public static ConvertException unknownForeignItem(String description) {
        return new ConvertException(Kind.UNKNOWN_FOREIGN_ITEM, null,
                "Unsupported item in foreign block: " + description, null);
    }

    public Kind kind() {
        return kind;
    }

    /** Offending type for {@link Kind#UNSAFE_POD_TYPE}, otherwise null. */
    public QualifiedName typeName() {
        return typeName;
    }
}
