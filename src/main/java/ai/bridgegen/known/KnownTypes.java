package ai.bridgegen.known;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import ai.bridgegen.model.QualifiedName;

/**
 * Registry of foreign types the bridge understands without seeing their definition:
 * - standard library names the binding generator flattens (std_string, ...) and their bridge spelling
 * - primitives, which are always safe to pass by value
 */
public final class KnownTypes {

    private static final Map<QualifiedName, KnownType> TYPES;

    static {
        final Map<QualifiedName, KnownType> m = new LinkedHashMap<>();
        register(m, "std_unique_ptr", "UniquePtr", true);
        register(m, "std_shared_ptr", "SharedPtr", true);
        register(m, "std_string", "CxxString", false);
        register(m, "std_vector", "CxxVector", false);
        for (String p : new String[] {
                "i8", "i16", "i32", "i64", "isize",
                "u8", "u16", "u32", "u64", "usize",
                "f32", "f64", "bool", "char"}) {
            register(m, p, null, true);
        }
        for (String c : new String[] {
                "c_char", "c_schar", "c_uchar", "c_short", "c_ushort",
                "c_int", "c_uint", "c_long", "c_ulong", "c_longlong", "c_ulonglong"}) {
            register(m, "std::os::raw::" + c, null, true);
        }
        TYPES = Collections.unmodifiableMap(m);
    }

    private KnownTypes() {
    }

    private static void register(Map<QualifiedName, KnownType> m, String name, String replacement, boolean byValueSafe) {
        final QualifiedName qn = QualifiedName.of(name);
        m.put(qn, new KnownType(qn, replacement, byValueSafe));
    }

    public static Optional<KnownType> lookup(QualifiedName name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(TYPES.get(name));
    }

    public static Optional<String> bridgeReplacement(String ident) {
        if (ident == null || ident.isBlank()) {
            return Optional.empty();
        }
        final KnownType t = TYPES.get(QualifiedName.of(ident));
        return t == null ? Optional.empty() : Optional.ofNullable(t.bridgeReplacement());
    }

    public static Map<QualifiedName, KnownType> all() {
        return TYPES;
    }

    /**
     * @param bridgeReplacement name used inside the bridge module, or null if unchanged
     */
    public record KnownType(QualifiedName name, String bridgeReplacement, boolean byValueSafe) {
        public KnownType {
            Objects.requireNonNull(name, "name");
        }
    }
}
