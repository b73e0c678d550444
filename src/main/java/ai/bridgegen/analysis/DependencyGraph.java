package ai.bridgegen.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.bridgegen.model.QualifiedName;

/**
 * Deduplicated dependency edges between API items, ready for ordered emission.
 * - Edges only point at names that are items of the graph (primitives and
 *   types defined elsewhere are not emitted, so they impose no order)
 * - Self edges are dropped
 */
public record DependencyGraph(
        List<QualifiedName> items,                        // input order
        Map<QualifiedName, Set<QualifiedName>> edges      // item -> items it depends on
) {

    public DependencyGraph {
        items = List.copyOf(items);
        final Map<QualifiedName, Set<QualifiedName>> copy = new LinkedHashMap<>();
        for (var e : edges.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
        }
        edges = Collections.unmodifiableMap(copy);
    }

    public static DependencyGraph build(List<? extends HasDependencies> apis) {
        Objects.requireNonNull(apis, "apis");

        final Set<QualifiedName> known = new LinkedHashSet<>();
        for (HasDependencies api : apis) {
            known.add(api.name());
        }

        // Several items may share a name (overloads); their edges are merged.
        final Map<QualifiedName, Set<QualifiedName>> edges = new LinkedHashMap<>();
        for (HasDependencies api : apis) {
            final Set<QualifiedName> deps = edges.computeIfAbsent(api.name(), k -> new LinkedHashSet<>());
            for (QualifiedName dep : api.deps()) {
                if (known.contains(dep) && !dep.equals(api.name())) {
                    deps.add(dep);
                }
            }
        }
        return new DependencyGraph(new ArrayList<>(known), edges);
    }

    public Set<QualifiedName> dependenciesOf(QualifiedName name) {
        return edges.getOrDefault(name, Set.of());
    }

    /**
     * Items ordered so that each comes after everything it depends on. Among items that
     * are ready at the same time, input order wins.
     *
     * @throws DependencyCycleException if some items depend on each other
     */
    public List<QualifiedName> emissionOrder() {
        final Map<QualifiedName, Integer> remaining = new LinkedHashMap<>();
        final Map<QualifiedName, List<QualifiedName>> dependents = new LinkedHashMap<>();
        for (QualifiedName item : items) {
            final Set<QualifiedName> deps = dependenciesOf(item);
            remaining.put(item, deps.size());
            for (QualifiedName dep : deps) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(item);
            }
        }

        final List<QualifiedName> order = new ArrayList<>(items.size());
        final Set<QualifiedName> emitted = new LinkedHashSet<>();
        boolean progress = true;
        while (progress) {
            progress = false;
            for (QualifiedName item : items) {
                if (emitted.contains(item) || remaining.get(item) > 0) {
                    continue;
                }
                emitted.add(item);
                order.add(item);
                for (QualifiedName dependent : dependents.getOrDefault(item, List.of())) {
                    remaining.merge(dependent, -1, Integer::sum);
                }
                progress = true;
                // restart so an earlier item freed by this one goes first
                break;
            }
        }

        if (order.size() != items.size()) {
            final List<QualifiedName> stuck = new ArrayList<>();
            for (QualifiedName item : items) {
                if (!emitted.contains(item)) {
                    stuck.add(item);
                }
            }
            throw new DependencyCycleException(stuck);
        }
        return order;
    }
}
