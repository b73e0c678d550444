package ai.bridgegen.convert;

import java.util.ArrayList;
import java.util.List;

import ai.bridgegen.ast.RawAst;
import ai.bridgegen.ast.TypeExpr;
import ai.bridgegen.known.KnownTypes;

/**
 * Rewrites types in signatures into the form the bridge accepts:
 * - known names get their bridge spelling (recursing into generic arguments)
 * - raw pointers become references of the same mutability, lifetime left unbound
 * - references recurse into their referent
 * Never fails; any other shape is returned as is.
 */
public final class TypeConverter {

    public TypeExpr convert(TypeExpr type) {
        if (type instanceof TypeExpr.PathType p) {
            return convertPath(p);
        }
        if (type instanceof TypeExpr.RefType r) {
            return new TypeExpr.RefType(r.lifetime(), r.mutable(), convert(r.elem()));
        }
        if (type instanceof TypeExpr.PtrType ptr) {
            return new TypeExpr.RefType(null, ptr.mutable(), convert(ptr.elem()));
        }
        return type;
    }

    /** Null (unit) stays null. */
    public TypeExpr convertReturnType(TypeExpr returnType) {
        return returnType == null ? null : convert(returnType);
    }

    public RawAst.FnParam convertParam(RawAst.FnParam param) {
        return new RawAst.FnParam(param.name(), convert(param.type()));
    }

    private TypeExpr.PathType convertPath(TypeExpr.PathType path) {
        final List<TypeExpr.Segment> segments = new ArrayList<>(path.segments().size());
        for (TypeExpr.Segment s : path.segments()) {
            final List<TypeExpr> args = new ArrayList<>(s.args().size());
            for (TypeExpr arg : s.args()) {
                args.add(convert(arg));
            }
            final String ident = KnownTypes.bridgeReplacement(s.ident()).orElse(s.ident());
            segments.add(new TypeExpr.Segment(ident, args));
        }
        return new TypeExpr.PathType(path.leadingColon(), segments);
    }
}
