package ai.bridgegen.ast;

import java.util.List;
import java.util.Objects;

/**
 * Renders items as bridge source text. Output is for people and diffs, not for
 * re-parsing: verbatim items are emitted as given and no escaping is applied.
 */
public final class ItemPrinter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();

    public static String render(List<RawAst.Item> items) {
        Objects.requireNonNull(items, "items");
        final ItemPrinter printer = new ItemPrinter();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                printer.out.append('\n');
            }
            printer.item(items.get(i), 0);
        }
        return printer.out.toString();
    }

    public static String render(RawAst.Item item) {
        return render(List.of(item));
    }

    private void item(RawAst.Item item, int depth) {
        if (item instanceof RawAst.Module m) {
            attrs(m.attrs(), depth);
            line(depth, vis(m.visibility()) + "mod " + m.name() + (m.hasContent() ? " {" : ";"));
            if (m.hasContent()) {
                for (RawAst.Item child : m.items()) {
                    item(child, depth + 1);
                }
                line(depth, "}");
            }
        } else if (item instanceof RawAst.ForeignMod fm) {
            attrs(fm.attrs(), depth);
            line(depth, (fm.unsafe() ? "unsafe " : "") + "extern \"" + fm.abi() + "\" {");
            for (RawAst.ForeignItem fi : fm.items()) {
                foreignItem(fi, depth + 1);
            }
            line(depth, "}");
        } else if (item instanceof RawAst.Struct s) {
            attrs(s.attrs(), depth);
            line(depth, vis(s.visibility()) + "struct " + s.name() + " {");
            for (RawAst.Field f : s.fields()) {
                line(depth + 1, vis(f.visibility()) + f.name() + ": " + f.type().render() + ",");
            }
            line(depth, "}");
        } else if (item instanceof RawAst.Enum e) {
            attrs(e.attrs(), depth);
            line(depth, vis(e.visibility()) + "enum " + e.name() + " {");
            for (RawAst.Variant v : e.variants()) {
                line(depth + 1, v.name() + (v.discriminant() != null ? " = " + v.discriminant() : "") + ",");
            }
            line(depth, "}");
        } else if (item instanceof RawAst.Impl impl) {
            attrs(impl.attrs(), depth);
            line(depth, "impl " + impl.selfType().render() + " {");
            for (RawAst.ImplMethod m : impl.methods()) {
                attrs(m.attrs(), depth + 1);
                line(depth + 1, vis(m.visibility()) + (m.unsafe() ? "unsafe " : "")
                        + signature(m.name(), m.params(), m.returnType()) + " {");
                line(depth + 2, m.body());
                line(depth + 1, "}");
            }
            line(depth, "}");
        } else if (item instanceof RawAst.Verbatim v) {
            for (String l : v.text().split("\n", -1)) {
                line(depth, l);
            }
        }
    }

    private void foreignItem(RawAst.ForeignItem fi, int depth) {
        if (fi instanceof RawAst.ForeignFn fn) {
            attrs(fn.attrs(), depth);
            line(depth, vis(fn.visibility()) + signature(fn.name(), fn.params(), fn.returnType()) + ";");
        } else if (fi instanceof RawAst.ForeignType t) {
            line(depth, "type " + t.name() + ";");
        } else if (fi instanceof RawAst.ForeignInclude inc) {
            line(depth, "include!(\"" + inc.header() + "\");");
        } else if (fi instanceof RawAst.ForeignStatic st) {
            line(depth, "static " + (st.mutable() ? "mut " : "") + st.name() + ": " + st.type().render() + ";");
        }
    }

    private static String signature(String name, List<RawAst.FnParam> params, TypeExpr returnType) {
        final StringBuilder sb = new StringBuilder("fn ").append(name).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(params.get(i).name()).append(": ").append(params.get(i).type().render());
        }
        sb.append(')');
        if (returnType != null) {
            sb.append(" -> ").append(returnType.render());
        }
        return sb.toString();
    }

    private void attrs(List<RawAst.Attribute> attrs, int depth) {
        for (RawAst.Attribute a : attrs) {
            line(depth, a.render());
        }
    }

    private static String vis(String visibility) {
        return visibility == null || visibility.isBlank() ? "" : visibility + " ";
    }

    private void line(int depth, String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
