package ai.bridgegen.convert;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ai.bridgegen.ast.RawAst;
import ai.bridgegen.ast.TypeExpr;
import ai.bridgegen.model.AdditionalNeed;
import ai.bridgegen.model.EncounteredType;
import ai.bridgegen.model.QualifiedName;

/**
 * Converts the bindings produced by the binding generator into a bridge module.
 * Tasks performed, in a single pass after classification:
 * - merges all foreign blocks into one, prefixed with include! directives
 * - passes value-safe structs through (minus repr), turns the rest into opaque types
 * - strips repr/derive from enums
 * - replaces constructors with make_unique factories and records the native helper they need
 * - rewrites signatures: known type names, pointers to references, this to self, Class_ prefixes
 * - removes link_name attributes
 * Everything else is passed through outside the bridge module.
 */
public final class BridgeConverter {

    public static final String BRIDGE_MODULE_NAME = "cxxbridge";
    public static final String BRIDGE_ATTRIBUTE = "cxx::bridge";
    public static final String MAKE_UNIQUE = "make_unique";

    static final String CONSTRUCTOR = "new";
    static final String THIS_PARAM = "this";
    static final String RECEIVER_PARAM = "self";
    static final String OPAQUE_HOLDER_SUFFIX = "ContainingStruct";

    private final ConversionConfig config;
    private final TypeConverter types = new TypeConverter();

    public BridgeConverter(ConversionConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @param extraInclusion header included after the configured ones, may be null
     */
    public ConversionResult convert(RawAst.Module bindings, String extraInclusion) throws ConvertException {
        Objects.requireNonNull(bindings, "bindings");
        if (!bindings.hasContent()) {
            throw ConvertException.noContent(bindings.name());
        }
        final List<RawAst.Item> items = bindings.items();

        // Step 1: classification must be complete before anything is rewritten
        final Classification classification = classify(items);
        // Every struct of the module, not just those seen before the current item, so
        // a constructor declared ahead of its struct is still elided.
        final Set<String> aggregates = new LinkedHashSet<>();
        for (RawAst.Item item : items) {
            if (item instanceof RawAst.Struct s) {
                aggregates.add(s.name());
            }
        }

        // Step 2: rewrite in input order
        final ClassNames classNames = new ClassNames();
        final List<RawAst.Item> allItems = new ArrayList<>();
        final List<RawAst.Item> bridgeItems = new ArrayList<>();
        final List<EncounteredType> typesToDisable = new ArrayList<>();
        final Set<QualifiedName> disabledNames = new HashSet<>();
        final List<AdditionalNeed> needs = new ArrayList<>();
        final Set<QualifiedName> constructed = new HashSet<>();
        ForeignModAccumulator foreignMod = null;

        for (RawAst.Item item : items) {
            if (item instanceof RawAst.ForeignMod fm) {
                if (foreignMod == null) {
                    // first foreign block donates attributes and ABI; every block's contents go into it
                    foreignMod = new ForeignModAccumulator(fm, includes(extraInclusion));
                }
                foreignMod.items.addAll(convertForeignItems(fm.items(), aggregates, classNames));
            } else if (item instanceof RawAst.Struct s) {
                final QualifiedName tyname = QualifiedName.of(s.name());
                if (disabledNames.add(tyname)) {
                    typesToDisable.add(new EncounteredType(EncounteredType.Kind.STRUCT, tyname));
                }
                classNames.registerType(s.name());
                if (classification.isValueSafe(tyname)) {
                    // transparent: the other side gets field access and by-value passing
                    bridgeItems.addAll(withNativeDeclaration(s.name(), convertStruct(s)));
                } else {
                    // opaque: only usable behind a pointer, layout stays hidden
                    bridgeItems.addAll(opaqueTypeAlias(s.name()));
                }
            } else if (item instanceof RawAst.Enum e) {
                final QualifiedName tyname = QualifiedName.of(e.name());
                if (disabledNames.add(tyname)) {
                    typesToDisable.add(new EncounteredType(EncounteredType.Kind.ENUM, tyname));
                }
                bridgeItems.addAll(withNativeDeclaration(e.name(), convertEnum(e)));
            } else if (item instanceof RawAst.Impl impl) {
                final RawAst.Impl factory = convertImpl(impl, aggregates, constructed, needs);
                if (factory != null) {
                    allItems.add(factory);
                }
            } else {
                allItems.add(item);
            }
        }

        if (foreignMod != null) {
            bridgeItems.add(foreignMod.build());
        }
        allItems.add(new RawAst.Module(
                BRIDGE_MODULE_NAME,
                List.of(new RawAst.Attribute(BRIDGE_ATTRIBUTE, "")),
                "pub",
                bridgeItems));

        return new ConversionResult(allItems, typesToDisable, needs);
    }

    private Classification classify(List<RawAst.Item> items) throws ConvertException {
        final ByValueChecker checker = new ByValueChecker();
        for (RawAst.Item item : items) {
            if (item instanceof RawAst.Struct s) {
                checker.ingestStruct(s);
            }
        }
        try {
            return checker.classify(config.podRequests());
        } catch (PodSafetyException ex) {
            throw ConvertException.unsafePodType(ex);
        }
    }

    private List<RawAst.ForeignItem> includes(String extraInclusion) {
        final List<RawAst.ForeignItem> out = new ArrayList<>();
        for (String header : config.includeList()) {
            out.add(new RawAst.ForeignInclude(header));
        }
        if (extraInclusion != null && !extraInclusion.isBlank()) {
            out.add(new RawAst.ForeignInclude(extraInclusion));
        }
        return out;
    }

    private List<RawAst.Item> withNativeDeclaration(String name, RawAst.Item definition) {
        final List<RawAst.Item> out = new ArrayList<>(2);
        if (!config.oldRust()) {
            out.add(new RawAst.ForeignMod(List.of(), true, "C++", List.of(new RawAst.ForeignType(name))));
        }
        out.add(definition);
        return out;
    }

    private static List<RawAst.Item> opaqueTypeAlias(String name) {
        // The bridge can't name a type it only knows as extern unless some struct
        // mentions it, hence the holder struct.
        final RawAst.Field holder = new RawAst.Field("_0", null,
                TypeExpr.generic("UniquePtr", TypeExpr.path(name)));
        return List.of(
                new RawAst.ForeignMod(List.of(), false, "C", List.of(new RawAst.ForeignType(name))),
                new RawAst.Struct(name + OPAQUE_HOLDER_SUFFIX, List.of(), null, List.of(holder)));
    }

    private static RawAst.Struct convertStruct(RawAst.Struct s) {
        return new RawAst.Struct(s.name(), stripAttr(s.attrs(), "repr"), s.visibility(), s.fields());
    }

    private static RawAst.Enum convertEnum(RawAst.Enum e) {
        return new RawAst.Enum(e.name(), stripAttr(stripAttr(e.attrs(), "repr"), "derive"),
                e.visibility(), e.variants());
    }

    /**
     * Returns the make_unique impl replacing the constructor, or null if the block has
     * nothing to offer (no constructor, not an aggregate of this module, or already handled).
     */
    private static RawAst.Impl convertImpl(RawAst.Impl impl,
                                           Set<String> aggregates,
                                           Set<QualifiedName> constructed,
                                           List<AdditionalNeed> needs) {
        if (!(impl.selfType() instanceof TypeExpr.PathType selfPath)) {
            return null;
        }
        final QualifiedName tyname = selfPath.qualifiedName();
        if (!aggregates.contains(tyname.toString())) {
            return null;
        }

        for (RawAst.ImplMethod m : impl.methods()) {
            if (!CONSTRUCTOR.equals(m.name())) {
                continue;
            }
            if (!constructed.add(tyname)) {
                return null;
            }

            final List<QualifiedName> constructorArgs = new ArrayList<>();
            final List<String> argNames = new ArrayList<>();
            for (RawAst.FnParam p : m.params()) {
                if (RECEIVER_PARAM.equals(p.name())) {
                    continue;
                }
                argNames.add(p.name());
                if (p.type() instanceof TypeExpr.PathType pt) {
                    constructorArgs.add(pt.qualifiedName());
                }
            }
            needs.add(new AdditionalNeed.MakeUnique(tyname, constructorArgs));

            // Type::make_unique forwards to the Type_make_unique helper
            final String body = tyname.name() + "_" + MAKE_UNIQUE + "(" + String.join(", ", argNames) + ")";
            final RawAst.ImplMethod factory = new RawAst.ImplMethod(
                    MAKE_UNIQUE, List.of(), m.visibility(), false, m.params(), m.returnType(), body);
            return new RawAst.Impl(List.of(), impl.selfType(), List.of(factory));
        }
        return null;
    }

    private List<RawAst.ForeignItem> convertForeignItems(List<RawAst.ForeignItem> foreignItems,
                                                         Set<String> aggregates,
                                                         ClassNames classNames) throws ConvertException {
        final List<RawAst.ForeignItem> out = new ArrayList<>(foreignItems.size());
        for (RawAst.ForeignItem fi : foreignItems) {
            if (!(fi instanceof RawAst.ForeignFn fn)) {
                throw ConvertException.unknownForeignItem(fi.toString());
            }
            final RawAst.ForeignFn converted = convertForeignFn(fn, aggregates, classNames);
            if (converted != null) {
                out.add(converted);
            }
        }
        return out;
    }

    /**
     * Returns null for constructors, which are replaced by make_unique.
     */
    private RawAst.ForeignFn convertForeignFn(RawAst.ForeignFn fn, Set<String> aggregates, ClassNames classNames) {
        for (String ty : aggregates) {
            if (fn.name().equals(ty + "_" + ty)) {
                return null;
            }
        }

        boolean isMethod = false;
        final List<RawAst.FnParam> params = new ArrayList<>(fn.params().size());
        for (RawAst.FnParam p : fn.params()) {
            final RawAst.FnParam converted = types.convertParam(p);
            if (THIS_PARAM.equals(p.name())) {
                isMethod = true;
                params.add(new RawAst.FnParam(RECEIVER_PARAM, converted.type()));
            } else {
                params.add(converted);
            }
        }

        // Methods arrive as Class_method; the bridge wants just the method name.
        final String name = isMethod ? classNames.stripClassPrefix(fn.name()) : fn.name();
        return new RawAst.ForeignFn(
                name,
                stripAttr(fn.attrs(), "link_name"),
                fn.visibility(),
                params,
                types.convertReturnType(fn.returnType()));
    }

    private static List<RawAst.Attribute> stripAttr(List<RawAst.Attribute> attrs, String toStrip) {
        final List<RawAst.Attribute> out = new ArrayList<>(attrs.size());
        for (RawAst.Attribute a : attrs) {
            if (!toStrip.equals(a.path())) {
                out.add(a);
            }
        }
        return out;
    }

    private static final class ForeignModAccumulator {
        final List<RawAst.Attribute> attrs;
        final boolean unsafe;
        final String abi;
        final List<RawAst.ForeignItem> items;

        private ForeignModAccumulator(RawAst.ForeignMod first, List<RawAst.ForeignItem> includes) {
            this.attrs = first.attrs();
            this.unsafe = first.unsafe();
            this.abi = first.abi();
            this.items = new ArrayList<>(includes);
        }

        RawAst.ForeignMod build() {
            return new RawAst.ForeignMod(attrs, unsafe, abi, items);
        }
    }
}
