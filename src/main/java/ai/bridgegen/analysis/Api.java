package ai.bridgegen.analysis;

import java.util.Objects;

import ai.bridgegen.model.QualifiedName;

/**
 * One discovered, analysed API item.
 *
 * <p>{@code S} is the struct analysis of the phase the item belongs to:
 * {@link PodAnalysis} before constructors and allocators are analysed,
 * {@link PodAndDepAnalysis} afterwards. Only struct payloads differ between phases.
 *
 * @param <S> struct analysis payload of the phase
 */
public sealed interface Api<S> permits Api.Typedef, Api.Struct, Api.Enum, Api.Function, Api.Subclass,
        Api.RustSubclassFn, Api.ForwardDeclaration, Api.Const, Api.ExternCppType, Api.IgnoredItem {

    QualifiedName name();

    /**
     * @param oldTyname name the typedef aliases, null if the target is not a named type
     */
    record Typedef<S>(QualifiedName name, QualifiedName oldTyname, TypedefAnalysis analysis) implements Api<S> {
        public Typedef {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(analysis, "analysis");
        }
    }

    record Struct<S>(QualifiedName name, S analysis) implements Api<S> {
        public Struct {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(analysis, "analysis");
        }
    }

    record Enum<S>(QualifiedName name) implements Api<S> {
        public Enum {
            Objects.requireNonNull(name, "name");
        }
    }

    record Function<S>(QualifiedName name, FnAnalysis analysis) implements Api<S> {
        public Function {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(analysis, "analysis");
        }
    }

    /**
     * Subclass defined on the bridge side of a native superclass.
     */
    record Subclass<S>(QualifiedName name, QualifiedName superclass) implements Api<S> {
        public Subclass {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(superclass, "superclass");
        }
    }

    record RustSubclassFn<S>(QualifiedName name, QualifiedName subclass, RustSubclassFnDetails details)
            implements Api<S> {
        public RustSubclassFn {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(subclass, "subclass");
            Objects.requireNonNull(details, "details");
        }
    }

    record ForwardDeclaration<S>(QualifiedName name) implements Api<S> {
        public ForwardDeclaration {
            Objects.requireNonNull(name, "name");
        }
    }

    record Const<S>(QualifiedName name, String value) implements Api<S> {
        public Const {
            Objects.requireNonNull(name, "name");
        }
    }

    record ExternCppType<S>(QualifiedName name, boolean opaque) implements Api<S> {
        public ExternCppType {
            Objects.requireNonNull(name, "name");
        }
    }

    record IgnoredItem<S>(QualifiedName name, String reason) implements Api<S> {
        public IgnoredItem {
            Objects.requireNonNull(name, "name");
        }
    }
}
