package ai.bridgegen.convert;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.bridgegen.ast.RawAst;
import ai.bridgegen.ast.TypeExpr;
import ai.bridgegen.model.QualifiedName;
import ai.bridgegen.model.TypeClassification;

public class ByValueCheckerTest {

    private static RawAst.Struct struct(String name, RawAst.Field... fields) {
        return new RawAst.Struct(name, List.of(), "pub", List.of(fields));
    }

    private static RawAst.Field field(String name, TypeExpr type) {
        return new RawAst.Field(name, "pub", type);
    }

    private static List<QualifiedName> names(String... names) {
        return java.util.Arrays.stream(names).map(QualifiedName::of).toList();
    }

    @Test
    void plainDataIsValueSafe() throws Exception {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Point", field("x", TypeExpr.path("i32")), field("y", TypeExpr.path("i32"))));

        final Classification c = checker.classify(names("Point"));
        assertTrue(c.isValueSafe(QualifiedName.of("Point")));
        assertEquals(TypeClassification.VALUE_SAFE, c.verdict(QualifiedName.of("Point")));
    }

    @Test
    void unrequestedTypesStayOpaque() throws Exception {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Point", field("x", TypeExpr.path("i32"))));
        checker.ingestStruct(struct("Other", field("x", TypeExpr.path("i32"))));

        final Classification c = checker.classify(names("Point"));
        assertEquals(TypeClassification.OPAQUE, c.verdict(QualifiedName.of("Other")));
        assertEquals(2, c.verdicts().size());
    }

    @Test
    void fieldTypesBecomeValueSafeTransitively() throws Exception {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Rect",
                field("origin", TypeExpr.path("Point")),
                field("size", TypeExpr.path("Size"))));
        checker.ingestStruct(struct("Point", field("x", TypeExpr.path("i32"))));
        checker.ingestStruct(struct("Size", field("w", TypeExpr.path("u32"))));

        final Classification c = checker.classify(names("Rect"));
        assertTrue(c.isValueSafe(QualifiedName.of("Rect")));
        assertTrue(c.isValueSafe(QualifiedName.of("Point")));
        assertTrue(c.isValueSafe(QualifiedName.of("Size")));
    }

    @Test
    void neverIngestedPointeeFailsNamingIt() {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Bad", field("inner", TypeExpr.ptr(true, TypeExpr.path("SelfRef")))));

        final PodSafetyException ex = assertThrows(PodSafetyException.class,
                () -> checker.classify(names("Bad")));
        assertEquals(QualifiedName.of("SelfRef"), ex.offendingType());
        assertTrue(ex.getMessage().contains("Bad"), ex.getMessage());
        assertTrue(ex.getMessage().contains("SelfRef"), ex.getMessage());
    }

    @Test
    void requestForUnknownTypeFails() {
        final PodSafetyException ex = assertThrows(PodSafetyException.class,
                () -> new ByValueChecker().classify(names("Ghost")));
        assertEquals(QualifiedName.of("Ghost"), ex.offendingType());
    }

    @Test
    void unsafeKnownFieldTypeFails() {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Person", field("name", TypeExpr.path("std_string"))));

        final PodSafetyException ex = assertThrows(PodSafetyException.class,
                () -> checker.classify(names("Person")));
        assertEquals(QualifiedName.of("std_string"), ex.offendingType());
    }

    @Test
    void uniquePtrFieldIsSafe() throws Exception {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Holder",
                field("p", TypeExpr.generic("std_unique_ptr", TypeExpr.path("NeverSeen")))));
        assertTrue(checker.classify(names("Holder")).isValueSafe(QualifiedName.of("Holder")));
    }

    @Test
    void selfReferentialStructIsRejected() {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Node",
                field("value", TypeExpr.path("i32")),
                field("next", TypeExpr.ptr(true, TypeExpr.path("Node")))));

        final PodSafetyException ex = assertThrows(PodSafetyException.class,
                () -> checker.classify(names("Node")));
        assertEquals(QualifiedName.of("Node"), ex.offendingType());
    }

    @Test
    void selfPointerInsideArrayIsRejected() {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Tree",
                field("kids", new TypeExpr.ArrayType(TypeExpr.ptr(true, TypeExpr.path("Tree")), "2"))));

        final PodSafetyException ex = assertThrows(PodSafetyException.class,
                () -> checker.classify(names("Tree")));
        assertEquals(QualifiedName.of("Tree"), ex.offendingType());
        assertTrue(ex.getMessage().contains("kids"), ex.getMessage());
    }

    @Test
    void pointerCycleBetweenStructsIsRejected() {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Parent", field("child", TypeExpr.ptr(true, TypeExpr.path("Child")))));
        checker.ingestStruct(struct("Child", field("parent", TypeExpr.ref(false, TypeExpr.path("Parent")))));

        final PodSafetyException ex = assertThrows(PodSafetyException.class,
                () -> checker.classify(names("Parent")));
        assertEquals(QualifiedName.of("Parent"), ex.offendingType());
        assertEquals("Type Parent could not be POD because it refers back to itself through [Child]",
                ex.getMessage());
    }

    @Test
    void pointerCycleIsFoundWhicheverTypeIsRequestedFirst() {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Parent", field("child", TypeExpr.ptr(true, TypeExpr.path("Child")))));
        checker.ingestStruct(struct("Child", field("parent", TypeExpr.ptr(true, TypeExpr.path("Parent")))));

        final PodSafetyException ex = assertThrows(PodSafetyException.class,
                () -> checker.classify(names("Child", "Parent")));
        assertEquals(QualifiedName.of("Child"), ex.offendingType());
    }

    @Test
    void sharedDependencyIsNotACycle() throws Exception {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Line",
                field("a", TypeExpr.path("Point")),
                field("b", TypeExpr.ptr(false, TypeExpr.path("Point")))));
        checker.ingestStruct(struct("Point", field("x", TypeExpr.path("i32"))));

        assertTrue(checker.classify(names("Line", "Point")).isValueSafe(QualifiedName.of("Line")));
    }

    @Test
    void virtualTableMakesStructUnsafe() {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Shape",
                field(ByValueChecker.VTABLE_FIELD, TypeExpr.ptr(false, TypeExpr.path("Shape__bindgen_vtable")))));

        assertThrows(PodSafetyException.class, () -> checker.classify(names("Shape")));
    }

    @Test
    void unanalysableFieldShapeIsUnsafe() {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Callback", field("f", new TypeExpr.OtherType("fn(i32) -> i32"))));

        assertThrows(PodSafetyException.class, () -> checker.classify(names("Callback")));
    }

    @Test
    void arrayOfPrimitivesIsSafe() throws Exception {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Buf", field("data", new TypeExpr.ArrayType(TypeExpr.path("u8"), "16"))));
        assertTrue(checker.classify(names("Buf")).isValueSafe(QualifiedName.of("Buf")));
    }

    @Test
    void unsafeTransitiveDependencyFailsWithChain() {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Outer", field("inner", TypeExpr.path("Inner"))));
        checker.ingestStruct(struct("Inner", field("s", TypeExpr.path("std_string"))));

        final PodSafetyException ex = assertThrows(PodSafetyException.class,
                () -> checker.classify(names("Outer")));
        assertEquals(QualifiedName.of("std_string"), ex.offendingType());
        assertTrue(ex.getMessage().startsWith("Type Outer could not be POD"), ex.getMessage());
    }

    @Test
    void classifyingDoesNotChangeTheChecker() throws Exception {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Point", field("x", TypeExpr.path("i32"))));

        assertTrue(checker.classify(names("Point")).isValueSafe(QualifiedName.of("Point")));
        assertFalse(checker.classify(List.of()).isValueSafe(QualifiedName.of("Point")));
    }

    @Test
    void ingestionOrderDoesNotMatter() throws Exception {
        final ByValueChecker checker = new ByValueChecker();
        checker.ingestStruct(struct("Line", field("a", TypeExpr.path("Point")), field("b", TypeExpr.path("Point"))));
        checker.ingestStruct(struct("Point", field("x", TypeExpr.path("i32"))));

        assertTrue(checker.classify(names("Line")).isValueSafe(QualifiedName.of("Point")));
    }

    @Test
    void reingestingIsIdempotent() throws Exception {
        final ByValueChecker checker = new ByValueChecker();
        final RawAst.Struct point = struct("Point", field("x", TypeExpr.path("i32")));
        checker.ingestStruct(point);
        checker.ingestStruct(point);

        assertEquals(1, checker.classify(names("Point")).verdicts().size());
    }
}
