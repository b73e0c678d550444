package ai.bridgegen.analysis;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ai.bridgegen.model.QualifiedName;

public class DependencyGraphTest {

    private static QualifiedName qn(String name) {
        return QualifiedName.of(name);
    }

    private static List<QualifiedName> qns(String... names) {
        return Arrays.stream(names).map(QualifiedName::of).toList();
    }

    private static Api<PodAndDepAnalysis> podStruct(String name, List<String> fields, List<String> allocDeps) {
        return new Api.Struct<>(qn(name), new PodAndDepAnalysis(
                new PodAnalysis(TypeKind.POD, qns(fields.toArray(new String[0]))),
                qns(allocDeps.toArray(new String[0]))));
    }

    private static Api<PodAndDepAnalysis> function(String name, String... deps) {
        return new Api.Function<>(qn(name), new FnAnalysis(qns(deps)));
    }

    @Test
    void edgesAreDedupedAndLimitedToItems() {
        final DependencyGraph g = DependencyGraph.build(ApiDependencies.fnPhase(List.of(
                podStruct("Rect", List.of("Point", "Point", "i32", "Rect"), List.of()),
                podStruct("Point", List.of("i32"), List.of()))));

        assertEquals(Set.of(qn("Point")), g.dependenciesOf(qn("Rect")));
        assertTrue(g.dependenciesOf(qn("Point")).isEmpty());
        assertTrue(g.dependenciesOf(qn("Unknown")).isEmpty());
    }

    @Test
    void emissionOrderPutsDependenciesFirst() {
        final DependencyGraph g = DependencyGraph.build(ApiDependencies.fnPhase(List.of(
                function("draw", "Canvas", "Rect"),
                podStruct("Rect", List.of("Point"), List.of("Rect_new")),
                function("Rect_new", "Point"),
                new Api.Enum<>(qn("Colour")),
                podStruct("Point", List.of("i32"), List.of()),
                new Api.Struct<>(qn("Canvas"), new PodAndDepAnalysis(
                        new PodAnalysis(TypeKind.OPAQUE, List.of()), List.of())))));

        final List<QualifiedName> order = g.emissionOrder();
        assertEquals(6, order.size());
        for (QualifiedName item : order) {
            for (QualifiedName dep : g.dependenciesOf(item)) {
                assertTrue(order.indexOf(dep) < order.indexOf(item), dep + " before " + item);
            }
        }
        assertEquals(qns("Colour", "Point", "Rect_new", "Rect", "Canvas", "draw"), order);
    }

    @Test
    void independentItemsKeepInputOrder() {
        final DependencyGraph g = DependencyGraph.build(ApiDependencies.prePhase(List.of(
                new Api.Enum<PodAnalysis>(qn("B")),
                new Api.Enum<PodAnalysis>(qn("A")),
                new Api.Enum<PodAnalysis>(qn("C")))));
        assertEquals(qns("B", "A", "C"), g.emissionOrder());
    }

    @Test
    void cycleIsReported() {
        final DependencyGraph g = DependencyGraph.build(ApiDependencies.prePhase(List.of(
                new Api.Subclass<PodAnalysis>(qn("A"), qn("B")),
                new Api.Subclass<PodAnalysis>(qn("B"), qn("A")),
                new Api.Enum<PodAnalysis>(qn("Free")))));

        final DependencyCycleException ex = assertThrows(DependencyCycleException.class, g::emissionOrder);
        assertEquals(qns("A", "B"), ex.unordered());
    }
}
