package ai.bridgegen.ast;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Item tree of generated bindings, both as read from the binding generator and as
 * produced by the converter.
 *
 * <p>Records are immutable; list components are copied and never null. Nullable
 * components are documented on the record.
 */
public final class RawAst {

    private RawAst() {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = Module.class, name = "mod"),
            @JsonSubTypes.Type(value = ForeignMod.class, name = "foreign_mod"),
            @JsonSubTypes.Type(value = Struct.class, name = "struct"),
            @JsonSubTypes.Type(value = Enum.class, name = "enum"),
            @JsonSubTypes.Type(value = Impl.class, name = "impl"),
            @JsonSubTypes.Type(value = Verbatim.class, name = "verbatim")
    })
    public sealed interface Item permits Module, ForeignMod, Struct, Enum, Impl, Verbatim {
    }

    /**
     * Module; {@code items} is null for a declaration without a body ({@code mod foo;}).
     */
    public record Module(
            String name,
            List<Attribute> attrs,
            String visibility,
            List<Item> items
    ) implements Item {
        public Module {
            Objects.requireNonNull(name, "name");
            attrs = attrs != null ? List.copyOf(attrs) : List.of();
            items = items != null ? List.copyOf(items) : null;
        }

        public boolean hasContent() {
            return items != null;
        }
    }

    /**
     * {@code [unsafe] extern "abi" { ... }}
     */
    public record ForeignMod(
            List<Attribute> attrs,
            boolean unsafe,
            String abi,
            List<ForeignItem> items
    ) implements Item {
        public ForeignMod {
            attrs = attrs != null ? List.copyOf(attrs) : List.of();
            Objects.requireNonNull(abi, "abi");
            items = items != null ? List.copyOf(items) : List.of();
        }
    }

    public record Struct(
            String name,
            List<Attribute> attrs,
            String visibility,
            List<Field> fields
    ) implements Item {
        public Struct {
            Objects.requireNonNull(name, "name");
            attrs = attrs != null ? List.copyOf(attrs) : List.of();
            fields = fields != null ? List.copyOf(fields) : List.of();
        }
    }

    public record Enum(
            String name,
            List<Attribute> attrs,
            String visibility,
            List<Variant> variants
    ) implements Item {
        public Enum {
            Objects.requireNonNull(name, "name");
            attrs = attrs != null ? List.copyOf(attrs) : List.of();
            variants = variants != null ? List.copyOf(variants) : List.of();
        }
    }

    public record Impl(
            List<Attribute> attrs,
            TypeExpr selfType,
            List<ImplMethod> methods
    ) implements Item {
        public Impl {
            attrs = attrs != null ? List.copyOf(attrs) : List.of();
            Objects.requireNonNull(selfType, "selfType");
            methods = methods != null ? List.copyOf(methods) : List.of();
        }
    }

    /**
     * Any other declaration, kept as source text.
     */
    public record Verbatim(String text) implements Item {
        public Verbatim {
            Objects.requireNonNull(text, "text");
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = ForeignFn.class, name = "fn"),
            @JsonSubTypes.Type(value = ForeignType.class, name = "type"),
            @JsonSubTypes.Type(value = ForeignInclude.class, name = "include"),
            @JsonSubTypes.Type(value = ForeignStatic.class, name = "static")
    })
    public sealed interface ForeignItem permits ForeignFn, ForeignType, ForeignInclude, ForeignStatic {
    }

    /**
     * Foreign function; {@code returnType} is null for unit.
     */
    public record ForeignFn(
            String name,
            List<Attribute> attrs,
            String visibility,
            List<FnParam> params,
            TypeExpr returnType
    ) implements ForeignItem {
        public ForeignFn {
            Objects.requireNonNull(name, "name");
            attrs = attrs != null ? List.copyOf(attrs) : List.of();
            params = params != null ? List.copyOf(params) : List.of();
        }
    }

    public record ForeignType(String name) implements ForeignItem {
        public ForeignType {
            Objects.requireNonNull(name, "name");
        }
    }

    public record ForeignInclude(String header) implements ForeignItem {
        public ForeignInclude {
            Objects.requireNonNull(header, "header");
        }
    }

    public record ForeignStatic(String name, boolean mutable, TypeExpr type) implements ForeignItem {
        public ForeignStatic {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }

    /**
     * {@code #[path tokens]}, e.g. path {@code repr} with tokens {@code (C)}.
     */
    public record Attribute(String path, String tokens) {
        public Attribute {
            Objects.requireNonNull(path, "path");
            tokens = tokens != null ? tokens : "";
        }

        public String render() {
            return "#[" + path + tokens + "]";
        }
    }

    public record Field(String name, String visibility, TypeExpr type) {
        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }

    /**
     * Enum variant; {@code discriminant} is null when implicit.
     */
    public record Variant(String name, String discriminant) {
        public Variant {
            Objects.requireNonNull(name, "name");
        }
    }

    public record FnParam(String name, TypeExpr type) {
        public FnParam {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }

    /**
     * Method inside an impl block; {@code returnType} is null for unit and {@code body}
     * is the source text between the braces.
     */
    public record ImplMethod(
            String name,
            List<Attribute> attrs,
            String visibility,
            boolean unsafe,
            List<FnParam> params,
            TypeExpr returnType,
            String body
    ) {
        public ImplMethod {
            Objects.requireNonNull(name, "name");
            attrs = attrs != null ? List.copyOf(attrs) : List.of();
            params = params != null ? List.copyOf(params) : List.of();
            body = body != null ? body : "";
        }
    }
}
