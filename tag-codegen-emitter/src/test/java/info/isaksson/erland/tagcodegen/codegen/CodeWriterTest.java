package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrSourceSpan;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CodeWriterTest {

    @Test
    void scopesIndentByFourSpaces() {
        CodeWriter w = new CodeWriter();
        w.writeLine("if (x)");
        try (CodeWriter.Block outer = w.buildScope()) {
            w.writeLine("a();");
            try (CodeWriter.Block inner = w.buildScope()) {
                w.writeLine("b();");
            }
        }

        String expected = """
                if (x)
                {
                    a();
                    {
                        b();
                    }
                }
                """;
        assertEquals(expected, w.generatedCode());
        assertEquals(0, w.indentLevel());
    }

    @Test
    void asyncLambdaClosesOnItsOwnLine() {
        CodeWriter w = new CodeWriter();
        w.writeStartMethodInvocation("Begin");
        try (CodeWriter.Block lambda = w.buildAsyncLambda()) {
            w.writeMethodInvocation("WriteLiteral", "\"x\"");
        }
        w.writeEndMethodInvocation();

        assertEquals("Begin(async() => {\n    WriteLiteral(\"x\");\n}\n);\n", w.generatedCode());
    }

    @Test
    void linePragmaIsSkippedWithoutSpan() {
        CodeWriter w = new CodeWriter();
        try (CodeWriter.Block p = w.buildLinePragma(null)) {
            w.writeLine("x = 1;");
        }
        assertEquals("x = 1;\n", w.generatedCode());
    }

    @Test
    void linePragmaUsesOneBasedLine() {
        CodeWriter w = new CodeWriter();
        w.write("a");
        try (CodeWriter.Block p = w.buildLinePragma(new IrSourceSpan("Views/A.cshtml", 40, 2, 5, 3))) {
            w.write("x = 1;");
        }
        assertEquals("a\n#line 3 \"Views/A.cshtml\"\nx = 1;\n#line default\n#line hidden\n", w.generatedCode());
    }

    @Test
    void stringLiteralsAreEscaped() {
        assertEquals("a\\\"b\\\\c\\n\\t\\0", CodeWriter.escape("a\"b\\c\n\t\0"));
        assertEquals("\\u2028\\u2029\\u0085", CodeWriter.escape("\u2028\u2029\u0085"));

        CodeWriter w = new CodeWriter();
        w.writeStringLiteral("say \"hi\"");
        assertEquals("\"say \\\"hi\\\"\"", w.generatedCode());
    }

    @Test
    void paddingReplacesIndentationAndAlignsToTemplateColumn() {
        CodeWriter w = new CodeWriter();
        try (CodeWriter.Block scope = w.buildScope()) {
            w.writePadding(6, new IrSourceSpan("a", 0, 0, 10, 1));
            w.write("__o = ");
            assertEquals(10, w.characterIndex());
        }
    }

    @Test
    void tracksPositionOfNextCharacter() {
        CodeWriter w = new CodeWriter();
        w.writeLine("ab");
        w.write("cd");
        assertEquals(5, w.absoluteIndex());
        assertEquals(1, w.lineIndex());
        assertEquals(2, w.characterIndex());

        try (CodeWriter.Block scope = w.buildScope()) {
            assertEquals(4, w.pendingIndent());
        }
    }
}
