package ai.bridgegen.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ai.bridgegen.model.QualifiedName;

/**
 * Dependency views of {@link Api} items, one per analysis phase. Separate entry points keep
 * allocator dependencies out of reach until the phase that computes them has run.
 */
public final class ApiDependencies {

    private ApiDependencies() {
    }

    /** Items of the phase before constructor and allocator analysis. */
    public static HasDependencies prePhase(Api<PodAnalysis> api) {
        return new PrePhase(Objects.requireNonNull(api, "api"));
    }

    /** Items of the phase after constructor and allocator analysis. */
    public static HasDependencies fnPhase(Api<PodAndDepAnalysis> api) {
        return new FnPhase(Objects.requireNonNull(api, "api"));
    }

    public static List<HasDependencies> prePhase(List<Api<PodAnalysis>> apis) {
        final List<HasDependencies> out = new ArrayList<>(apis.size());
        for (Api<PodAnalysis> api : apis) {
            out.add(prePhase(api));
        }
        return out;
    }

    public static List<HasDependencies> fnPhase(List<Api<PodAndDepAnalysis>> apis) {
        final List<HasDependencies> out = new ArrayList<>(apis.size());
        for (Api<PodAndDepAnalysis> api : apis) {
            out.add(fnPhase(api));
        }
        return out;
    }

    /**
     * Dependencies shared by both phases; null for structs, which differ per phase.
     */
    private static List<QualifiedName> commonDeps(Api<?> api) {
        if (api instanceof Api.Typedef<?> t) {
            final List<QualifiedName> out = new ArrayList<>();
            if (t.oldTyname() != null) {
                out.add(t.oldTyname());
            }
            out.addAll(t.analysis().deps());
            return out;
        }
        if (api instanceof Api.Function<?> f) {
            return f.analysis().deps();
        }
        if (api instanceof Api.Subclass<?> s) {
            return List.of(s.superclass());
        }
        if (api instanceof Api.RustSubclassFn<?> fn) {
            return fn.details().dependencies();
        }
        if (api instanceof Api.Struct<?>) {
            return null;
        }
        return List.of();
    }

    private record PrePhase(Api<PodAnalysis> api) implements HasDependencies {

        @Override
        public QualifiedName name() {
            return api.name();
        }

        @Override
        public List<QualifiedName> deps() {
            if (api instanceof Api.Struct<PodAnalysis> s) {
                final PodAnalysis pod = s.analysis();
                return pod.kind() == TypeKind.POD ? pod.fieldTypes() : List.of();
            }
            return commonDeps(api);
        }
    }

    private record FnPhase(Api<PodAndDepAnalysis> api) implements HasDependencies {

        @Override
        public QualifiedName name() {
            return api.name();
        }

        @Override
        public List<QualifiedName> deps() {
            if (api instanceof Api.Struct<PodAndDepAnalysis> s) {
                final PodAndDepAnalysis analysis = s.analysis();
                if (analysis.pod().kind() == TypeKind.POD) {
                    final List<QualifiedName> out = new ArrayList<>(analysis.pod().fieldTypes());
                    out.addAll(analysis.constructorAndAllocatorDeps());
                    return out;
                }
                return analysis.constructorAndAllocatorDeps();
            }
            return commonDeps(api);
        }
    }
}
