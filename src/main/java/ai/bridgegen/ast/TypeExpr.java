package ai.bridgegen.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import ai.bridgegen.model.QualifiedName;

/**
 * Type shapes appearing in generated bindings.
 *
 * <p>Only the shapes the converter treats specially get their own variant: paths
 * (possibly generic), raw pointers, references and fixed-size arrays. Everything else
 * (tuples, function pointers, lifetimes used as generic arguments) is carried as
 * {@link OtherType} text.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TypeExpr.PathType.class, name = "path"),
        @JsonSubTypes.Type(value = TypeExpr.PtrType.class, name = "ptr"),
        @JsonSubTypes.Type(value = TypeExpr.RefType.class, name = "ref"),
        @JsonSubTypes.Type(value = TypeExpr.ArrayType.class, name = "array"),
        @JsonSubTypes.Type(value = TypeExpr.OtherType.class, name = "other")
})
public sealed interface TypeExpr
        permits TypeExpr.PathType, TypeExpr.PtrType, TypeExpr.RefType, TypeExpr.ArrayType, TypeExpr.OtherType {

    /** Source form, e.g. {@code &mut UniquePtr<Foo>}. */
    String render();

    static PathType path(String... idents) {
        final List<Segment> segments = new ArrayList<>(idents.length);
        for (String ident : idents) {
            segments.add(new Segment(ident, List.of()));
        }
        return new PathType(false, segments);
    }

    static PathType generic(String ident, TypeExpr... args) {
        return new PathType(false, List.of(new Segment(ident, Arrays.asList(args))));
    }

    static PtrType ptr(boolean mutable, TypeExpr elem) {
        return new PtrType(mutable, elem);
    }

    static RefType ref(boolean mutable, TypeExpr elem) {
        return new RefType(null, mutable, elem);
    }

    record PathType(boolean leadingColon, List<Segment> segments) implements TypeExpr {
        public PathType {
            segments = segments != null ? List.copyOf(segments) : List.of();
            if (segments.isEmpty()) {
                throw new IllegalArgumentException("path must have at least one segment");
            }
        }

        /** Qualified name of the path, generic arguments ignored. */
        public QualifiedName qualifiedName() {
            final List<String> idents = new ArrayList<>(segments.size());
            for (Segment s : segments) {
                idents.add(s.ident());
            }
            return QualifiedName.of(idents);
        }

        @Override
        public String render() {
            final StringBuilder sb = new StringBuilder();
            if (leadingColon) {
                sb.append("::");
            }
            for (int i = 0; i < segments.size(); i++) {
                if (i > 0) {
                    sb.append("::");
                }
                sb.append(segments.get(i).render());
            }
            return sb.toString();
        }
    }

    record Segment(String ident, List<TypeExpr> args) {
        public Segment {
            Objects.requireNonNull(ident, "ident");
            args = args != null ? List.copyOf(args) : List.of();
        }

        public String render() {
            if (args.isEmpty()) {
                return ident;
            }
            final StringBuilder sb = new StringBuilder(ident).append('<');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(args.get(i).render());
            }
            return sb.append('>').toString();
        }
    }

    record PtrType(boolean mutable, TypeExpr elem) implements TypeExpr {
        public PtrType {
            Objects.requireNonNull(elem, "elem");
        }

        @Override
        public String render() {
            return (mutable ? "*mut " : "*const ") + elem.render();
        }
    }

    /**
     * Reference; {@code lifetime} is null when unbound.
     */
    record RefType(String lifetime, boolean mutable, TypeExpr elem) implements TypeExpr {
        public RefType {
            Objects.requireNonNull(elem, "elem");
        }

        @Override
        public String render() {
            final StringBuilder sb = new StringBuilder("&");
            if (lifetime != null) {
                sb.append(lifetime).append(' ');
            }
            if (mutable) {
                sb.append("mut ");
            }
            return sb.append(elem.render()).toString();
        }
    }

    record ArrayType(TypeExpr elem, String len) implements TypeExpr {
        public ArrayType {
            Objects.requireNonNull(elem, "elem");
            Objects.requireNonNull(len, "len");
        }

        @Override
        public String render() {
            return "[" + elem.render() + "; " + len + "]";
        }
    }

    record OtherType(String text) implements TypeExpr {
        public OtherType {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String render() {
            return text;
        }
    }
}
