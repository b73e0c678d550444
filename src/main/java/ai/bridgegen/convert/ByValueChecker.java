package ai.bridgegen.convert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.bridgegen.ast.RawAst;
import ai.bridgegen.ast.TypeExpr;
import ai.bridgegen.known.KnownTypes;
import ai.bridgegen.model.QualifiedName;
import ai.bridgegen.model.TypeClassification;

/**
 * Decides which structs may be passed by value across the bridge.
 * Two passes:
 * - ingestStruct: record each struct's field dependencies (unvalidated)
 * - classify: walk the requested types and everything their fields need
 * Anything not reached from a request stays opaque. A pointer path leading back to a
 * value-safe struct, directly or through other structs, makes it unsafe.
 */
public final class ByValueChecker {

    /** Field name the binding generator uses for a virtual table pointer. */
    static final String VTABLE_FIELD = "vtable_";

    private final Map<QualifiedName, StructDetails> structs = new LinkedHashMap<>();

    public void ingestStruct(RawAst.Struct def) {
        Objects.requireNonNull(def, "def");
        final QualifiedName tyname = QualifiedName.of(def.name());

        String problem = null;
        final List<QualifiedName> deps = new ArrayList<>(def.fields().size());
        for (RawAst.Field f : def.fields()) {
            if (VTABLE_FIELD.equals(f.name())) {
                problem = "Type " + tyname + " could not be POD because it has virtual functions";
                break;
            }
            final TypeExpr fieldType = f.type();
            if (pointsTo(fieldType, tyname)) {
                problem = "Type " + tyname + " could not be POD because field " + f.name()
                        + " refers back to the type itself";
                break;
            }
            final QualifiedName dep = fieldDependency(fieldType);
            if (dep == null) {
                problem = "Type " + tyname + " could not be POD because field " + f.name()
                        + " has type " + fieldType.render() + " which can not be analysed";
                break;
            }
            deps.add(dep);
        }
        structs.put(tyname, new StructDetails(deps, problem));
    }

    /**
     * Marks every requested type, and every type its fields need, as value-safe.
     *
     * @throws PodSafetyException naming the first type that can not be value-safe
     */
    public Classification classify(Collection<QualifiedName> requests) throws PodSafetyException {
        Objects.requireNonNull(requests, "requests");

        final Set<QualifiedName> pod = new HashSet<>();
        final Deque<Request> pending = new ArrayDeque<>();
        for (QualifiedName r : requests) {
            pending.addLast(new Request(r, null));
        }

        while (!pending.isEmpty()) {
            final Request req = pending.removeFirst();
            if (pod.contains(req.type())) {
                continue;
            }

            final var known = KnownTypes.lookup(req.type());
            if (known.isPresent()) {
                if (!known.get().byValueSafe()) {
                    throw new PodSafetyException(req.type(), because(req,
                            "type " + req.type() + " is not safe for POD"));
                }
                pod.add(req.type());
                continue;
            }

            final StructDetails details = structs.get(req.type());
            if (details == null) {
                throw new PodSafetyException(req.type(), because(req,
                        "Unable to make " + req.type() + " POD because we never saw a struct definition"));
            }
            if (details.problem() != null) {
                throw new PodSafetyException(req.type(), because(req, details.problem()));
            }
            pod.add(req.type());
            for (QualifiedName dep : details.dependencies()) {
                pending.addLast(new Request(dep, req));
            }
        }

        rejectCycles(requests);

        final Map<QualifiedName, TypeClassification> verdicts = new LinkedHashMap<>();
        for (QualifiedName name : structs.keySet()) {
            verdicts.put(name, pod.contains(name) ? TypeClassification.VALUE_SAFE : TypeClassification.OPAQUE);
        }
        for (QualifiedName name : requests) {
            verdicts.putIfAbsent(name, TypeClassification.VALUE_SAFE);
        }
        return new Classification(verdicts);
    }

    private void rejectCycles(Collection<QualifiedName> requests) throws PodSafetyException {
        final Set<QualifiedName> done = new HashSet<>();
        for (QualifiedName r : requests) {
            final List<QualifiedName> cycle = findCycle(r, new ArrayList<>(), done);
            if (cycle != null) {
                final QualifiedName first = cycle.get(0);
                final String through = cycle.size() > 1
                        ? " through " + cycle.subList(1, cycle.size())
                        : "";
                throw new PodSafetyException(first,
                        "Type " + first + " could not be POD because it refers back to itself" + through);
            }
        }
    }

    /** Depth-first; returns the cycle starting at its first revisited type, or null. */
    private List<QualifiedName> findCycle(QualifiedName type, List<QualifiedName> path, Set<QualifiedName> done) {
        final int at = path.indexOf(type);
        if (at >= 0) {
            return new ArrayList<>(path.subList(at, path.size()));
        }
        final StructDetails details = structs.get(type);
        if (details == null || !done.add(type)) {
            return null;
        }
        path.add(type);
        for (QualifiedName dep : details.dependencies()) {
            final List<QualifiedName> cycle = findCycle(dep, path, done);
            if (cycle != null) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        return null;
    }

    private static String because(Request req, String reason) {
        String message = reason;
        Request child = req;
        for (Request parent = req.requiredBy(); parent != null; parent = parent.requiredBy()) {
            message = "Type " + parent.type() + " could not be POD because its dependent type " + child.type()
                    + " isn't safe to be POD. Because: " + message;
            child = parent;
        }
        return message;
    }

    /** True if {@code type} is a pointer or reference to {@code target}, possibly inside arrays. */
    static boolean pointsTo(TypeExpr type, QualifiedName target) {
        if (type instanceof TypeExpr.ArrayType arr) {
            return pointsTo(arr.elem(), target);
        }
        if (type instanceof TypeExpr.PtrType || type instanceof TypeExpr.RefType) {
            return target.equals(fieldDependency(type));
        }
        return false;
    }

    /** Type a field needs to be value-safe, or null if the shape can not be analysed. */
    static QualifiedName fieldDependency(TypeExpr type) {
        if (type instanceof TypeExpr.PathType p) {
            return p.qualifiedName();
        }
        if (type instanceof TypeExpr.PtrType ptr) {
            return fieldDependency(ptr.elem());
        }
        if (type instanceof TypeExpr.RefType ref) {
            return fieldDependency(ref.elem());
        }
        if (type instanceof TypeExpr.ArrayType arr) {
            return fieldDependency(arr.elem());
        }
        return null;
    }

    private record StructDetails(List<QualifiedName> dependencies, String problem) {
    }

    private record Request(QualifiedName type, Request requiredBy) {
    }
}
