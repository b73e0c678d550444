package ai.bridgegen.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ItemPrinterTest {

    @Test
    void rendersStructWithAttributesAndFields() {
        final RawAst.Struct s = new RawAst.Struct("Point",
                List.of(new RawAst.Attribute("repr", "(C)")),
                "pub",
                List.of(new RawAst.Field("x", "pub", TypeExpr.path("i32")),
                        new RawAst.Field("next", null, TypeExpr.ptr(false, TypeExpr.path("Point")))));

        assertEquals("#[repr(C)]\n"
                + "pub struct Point {\n"
                + "    pub x: i32,\n"
                + "    next: *const Point,\n"
                + "}\n", ItemPrinter.render(s));
    }

    @Test
    void rendersNestedModuleWithForeignBlock() {
        final RawAst.ForeignMod fm = new RawAst.ForeignMod(List.of(), true, "C++", List.of(
                new RawAst.ForeignInclude("a.h"),
                new RawAst.ForeignType("Foo"),
                new RawAst.ForeignFn("go", List.of(), "pub",
                        List.of(new RawAst.FnParam("self", TypeExpr.ref(true, TypeExpr.path("Foo")))),
                        TypeExpr.path("u8"))));
        final RawAst.Module m = new RawAst.Module("ffi",
                List.of(new RawAst.Attribute("cxx::bridge", "")), "pub", List.of(fm));

        assertEquals("#[cxx::bridge]\n"
                + "pub mod ffi {\n"
                + "    unsafe extern \"C++\" {\n"
                + "        include!(\"a.h\");\n"
                + "        type Foo;\n"
                + "        pub fn go(self: &mut Foo) -> u8;\n"
                + "    }\n"
                + "}\n", ItemPrinter.render(m));
    }

    @Test
    void moduleWithoutBodyIsDeclaration() {
        assertEquals("mod outside;\n",
                ItemPrinter.render(new RawAst.Module("outside", List.of(), null, null)));
    }

    @Test
    void rendersEnumDiscriminantsAndImplBodies() {
        final RawAst.Enum e = new RawAst.Enum("Colour", List.of(), "pub", List.of(
                new RawAst.Variant("Red", "0"),
                new RawAst.Variant("Green", null)));
        final RawAst.Impl impl = new RawAst.Impl(List.of(), TypeExpr.path("Colour"), List.of(
                new RawAst.ImplMethod("make_unique", List.of(), "pub", false, List.of(),
                        TypeExpr.path("Self"), "Colour_make_unique()")));

        assertEquals("pub enum Colour {\n"
                + "    Red = 0,\n"
                + "    Green,\n"
                + "}\n"
                + "\n"
                + "impl Colour {\n"
                + "    pub fn make_unique() -> Self {\n"
                + "        Colour_make_unique()\n"
                + "    }\n"
                + "}\n", ItemPrinter.render(List.of(e, impl)));
    }

    @Test
    void verbatimTextIsKeptLineByLine() {
        final RawAst.Module m = new RawAst.Module("m", List.of(), null,
                List.of(new RawAst.Verbatim("pub type A = u8;\npub type B = u16;")));

        assertEquals("mod m {\n"
                + "    pub type A = u8;\n"
                + "    pub type B = u16;\n"
                + "}\n", ItemPrinter.render(m));
    }
}
