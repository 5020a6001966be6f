package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.emitter.DiagnosticKind;
import info.isaksson.erland.tagcodegen.emitter.EmitterDiagnostic;
import info.isaksson.erland.tagcodegen.emitter.TagHelperEmitter;
import info.isaksson.erland.tagcodegen.ir.AttributeValueStyle;
import info.isaksson.erland.tagcodegen.ir.IrBoundAttribute;
import info.isaksson.erland.tagcodegen.ir.IrCodeBlock;
import info.isaksson.erland.tagcodegen.ir.IrDocument;
import info.isaksson.erland.tagcodegen.ir.IrExpression;
import info.isaksson.erland.tagcodegen.ir.IrHtmlContent;
import info.isaksson.erland.tagcodegen.ir.IrSourceSpan;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperProperty;
import info.isaksson.erland.tagcodegen.ir.IrTemplate;
import info.isaksson.erland.tagcodegen.ir.IrToken;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.tagcodegen.codegen.TagHelperFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class TagHelperPropertyTest {

    private static final IrBoundAttribute GREETING = IrBoundAttribute.property("Greeting", "System.String");
    private static final IrBoundAttribute COUNT = IrBoundAttribute.property("Count", "System.Int32");
    private static final IrBoundAttribute ITEMS = IrBoundAttribute.indexer(
            "Items", "System.Collections.Generic.IDictionary<System.String, System.Int32>", "System.Int32", "item-");

    @Test
    void stringPropertyAtDesignTimeAssignsLiteral() {
        IrDocument doc = document(tagHelper("foo", property("greeting", GREETING, IrHtmlContent.text("hello"))));

        assertEquals("__FooTagHelper.Greeting = \"hello\";\n", emit(doc, designTime()).code);
    }

    @Test
    void stringPropertyWithBareMarkupTokenAtDesignTimeAssignsLiteral() {
        IrDocument doc = document(tagHelper("foo", property("greeting", GREETING, IrToken.html("hello"))));

        assertEquals("__FooTagHelper.Greeting = \"hello\";\n", emit(doc, designTime()).code);
    }

    @Test
    void stringPropertyWithBareMarkupTokenAtRuntimeWritesLiteral() {
        IrDocument doc = document(tagHelper("foo", property("greeting", GREETING, IrToken.html("hello"))));

        String code = emit(doc, runtime()).code;

        assertTrue(code.startsWith("BeginWriteTagHelperAttribute();\nWriteLiteral(\"hello\");\n"), code);
    }

    @Test
    void stringPropertyWithMixedContentAtDesignTimeAssignsEmptyString() {
        IrDocument doc = document(tagHelper("foo",
                property("greeting", GREETING, IrHtmlContent.text("hi "), IrExpression.code("Model.Name"))));

        String code = emit(doc, designTime()).code;

        assertEquals("__o = Model.Name;\n__FooTagHelper.Greeting = string.Empty;\n", code);
    }

    @Test
    void stringPropertyAtRuntimeIsBufferedThenAssigned() {
        IrDocument doc = document(tagHelper("foo", property("greeting", GREETING, IrHtmlContent.text("hello"))));

        String expected = """
                BeginWriteTagHelperAttribute();
                WriteLiteral("hello");
                __tagHelperStringValueBuffer = EndWriteTagHelperAttribute();
                __FooTagHelper.Greeting = __tagHelperStringValueBuffer;
                __tagHelperExecutionContext.AddTagHelperAttribute("greeting", __FooTagHelper.Greeting, global::Microsoft.AspNetCore.Razor.TagHelpers.HtmlAttributeValueStyle.DoubleQuotes);
                """;
        assertEquals(expected, emit(doc, runtime()).code);
    }

    @Test
    void expressionsInStringValuesAreWrittenAsLiterals() {
        IrDocument doc = document(tagHelper("foo",
                property("greeting", GREETING, IrHtmlContent.text("hi "), IrExpression.code("Model.Name"))));

        String code = emit(doc, runtime()).code;

        assertTrue(code.contains("WriteLiteral(\"hi \");\nWriteLiteral(Model.Name);\n"), code);
    }

    @Test
    void nonStringPropertyIsAssignedInlineInsideLinePragma() {
        IrDocument doc = document(tagHelper("foo",
                property("count", COUNT, span(30, 2, 12, 2), IrToken.code("40"))));

        String expected = """
                #line 3 "Views/Home/Index.cshtml"
                __FooTagHelper.Count = 40;
                #line default
                #line hidden
                __tagHelperExecutionContext.AddTagHelperAttribute("count", __FooTagHelper.Count, global::Microsoft.AspNetCore.Razor.TagHelpers.HtmlAttributeValueStyle.DoubleQuotes);
                """;
        assertEquals(expected, emit(doc, runtime()).code);
    }

    @Test
    void enumValueIsQualifiedWithTypeName() {
        IrBoundAttribute mode = IrBoundAttribute.enumProperty("Mode", "Shop.Web.InputMode");
        IrDocument doc = document(tagHelper("foo", property("mode", mode, IrToken.code("Email"))));

        String code = emit(doc, runtime()).code;

        assertTrue(code.startsWith("__FooTagHelper.Mode = global::Shop.Web.InputMode.Email;\n"), code);
    }

    @Test
    void enumValueWrittenAsExpressionIsNotQualified() {
        IrBoundAttribute mode = IrBoundAttribute.enumProperty("Mode", "Shop.Web.InputMode");
        IrDocument doc = document(tagHelper("foo", property("mode", mode, IrExpression.code("Model.Mode"))));

        assertTrue(emit(doc, runtime()).code.startsWith("__FooTagHelper.Mode = Model.Mode;\n"));
    }

    @Test
    void repeatedAttributeReusesFirstAccessor() {
        IrTagHelperProperty first = property("greeting", GREETING, IrHtmlContent.text("hello"));
        IrTagHelperProperty alias = new IrTagHelperProperty("greeting", AttributeValueStyle.DOUBLE_QUOTES,
                "__BarTagHelper", "Shop.Web.BarTagHelper", IrBoundAttribute.property("Text", "System.String"),
                false, List.of(IrHtmlContent.text("hello")), null);

        String code = emit(document(tagHelper("foo", first, alias)), runtime()).code;

        assertEquals(1, count(code, "BeginWriteTagHelperAttribute();"));
        assertEquals(1, count(code, "AddTagHelperAttribute("));
        assertTrue(code.endsWith("__BarTagHelper.Text = __FooTagHelper.Greeting;\n"), code);
    }

    @Test
    void attributeMemoIsScopedToOneOccurrence() {
        IrDocument doc = document(
                tagHelper("foo", property("greeting", GREETING, IrHtmlContent.text("a"))),
                tagHelper("foo", property("greeting", GREETING, IrHtmlContent.text("b"))));

        String code = emit(doc, runtime()).code;

        assertEquals(2, count(code, "BeginWriteTagHelperAttribute();"));
    }

    @Test
    void indexerGuardIsWrittenOncePerPropertyAndOccurrence() {
        IrDocument doc = document(tagHelper("foo",
                indexerProperty("item-a", ITEMS, IrToken.code("1")),
                indexerProperty("item-b", ITEMS, IrToken.code("2"))));

        String code = emit(doc, runtime()).code;

        String guard = """
                if (__FooTagHelper.Items == null)
                {
                    throw new InvalidOperationException(InvalidTagHelperIndexerAssignment("item-a", "Shop.Web.FooTagHelper", "Items"));
                }
                __FooTagHelper.Items["a"] = 1;
                """;
        assertTrue(code.startsWith(guard), code);
        assertEquals(1, count(code, "InvalidTagHelperIndexerAssignment("));
        assertTrue(code.contains("__FooTagHelper.Items[\"b\"] = 2;\n"));
        assertTrue(code.contains("AddTagHelperAttribute(\"item-b\", __FooTagHelper.Items[\"b\"], "));
    }

    @Test
    void indexerGuardIsOmittedAtDesignTime() {
        IrDocument doc = document(tagHelper("foo", indexerProperty("item-a", ITEMS, IrToken.code("1"))));

        assertEquals("__FooTagHelper.Items[\"a\"] = 1;\n", emit(doc, designTime()).code);
    }

    @Test
    void stringValuedIndexerIsBuffered() {
        IrBoundAttribute routes = IrBoundAttribute.indexer(
                "RouteValues", "System.Collections.Generic.IDictionary<System.String, System.String>", "System.String", "route-");
        IrDocument doc = document(tagHelper("a", indexerProperty("route-id", routes, IrHtmlContent.text("7"))));

        String code = emit(doc, runtime()).code;

        assertTrue(code.contains("__FooTagHelper.RouteValues[\"id\"] = __tagHelperStringValueBuffer;\n"), code);
    }

    @Test
    void codeBlockInValueReportsDiagnosticAndSkipsOnlyThatProperty() {
        IrSourceSpan countSpan = span(30, 2, 12, 20);
        IrDocument doc = document(tagHelper("foo",
                property("count", COUNT, countSpan, IrCodeBlock.code("var x = 23;")),
                property("greeting", GREETING, IrHtmlContent.text("hello"))));

        TagHelperEmitter.Result result = emit(doc, runtime());

        assertEquals(1, result.diagnostics.size());
        EmitterDiagnostic d = result.diagnostics.get(0);
        assertEquals(DiagnosticKind.CODE_BLOCK_NOT_SUPPORTED_IN_ATTRIBUTE, d.kind);
        assertEquals("TH1001", d.code);
        assertEquals(countSpan, d.span);
        assertFalse(result.code.contains("__FooTagHelper.Count"));
        assertFalse(result.code.contains("AddTagHelperAttribute(\"count\""));
        assertTrue(result.code.contains("__FooTagHelper.Greeting = __tagHelperStringValueBuffer;"));
    }

    @Test
    void codeBlockNestedInExpressionIsFound() {
        IrDocument doc = document(tagHelper("foo",
                property("count", COUNT, IrExpression.of(IrToken.code("x"), IrCodeBlock.code("y();")))));

        TagHelperEmitter.Result result = emit(doc, designTime());

        assertEquals(1, result.diagnostics.size());
        assertEquals("", result.code);
    }

    @Test
    void templateInValueNamesTheExpectedType() {
        IrBoundAttribute renderer = IrBoundAttribute.property("Renderer", "System.Func<dynamic, object>");
        IrDocument doc = document(tagHelper("foo",
                property("renderer", renderer, IrTemplate.of(IrHtmlContent.text("<p>x</p>")))));

        TagHelperEmitter.Result result = emit(doc, runtime());

        assertEquals(1, result.diagnostics.size());
        EmitterDiagnostic d = result.diagnostics.get(0);
        assertEquals("TH1002", d.code);
        assertTrue(d.message.contains("Expected a 'System.Func<dynamic, object>' attribute value, not a string."), d.message);
        assertEquals("", result.code);
    }

    @Test
    void skippedPropertyIsNotMemoized() {
        IrDocument doc = document(tagHelper("foo",
                property("count", COUNT, IrCodeBlock.code("var x = 1;")),
                property("count", COUNT, IrToken.code("5"))));

        TagHelperEmitter.Result result = emit(doc, runtime());

        assertEquals(1, result.diagnostics.size());
        assertTrue(result.code.startsWith("__FooTagHelper.Count = 5;\n"), result.code);
    }

    @Test
    void designTimeValueIsPaddedAndMapped() {
        IrSourceSpan valueSpan = span(31, 1, 31, 2);
        IrDocument doc = document(tagHelper("foo",
                property("count", COUNT, span(30, 1, 30, 4), IrToken.code("40", valueSpan))));

        TagHelperEmitter.Result result = emit(doc, designTime());

        assertEquals(1, result.lineMappings.size());
        LineMapping mapping = result.lineMappings.get(0);
        assertEquals(valueSpan, mapping.original);
        assertEquals(1, mapping.generated.lineIndex);
        assertEquals(30, mapping.generated.characterIndex);
        int start = mapping.generated.absoluteIndex;
        assertEquals("40", result.code.substring(start, start + mapping.generated.length));
        assertTrue(result.code.contains("\n       __FooTagHelper.Count = 40;\n"), result.code);
    }

    @Test
    void propertyOutsideTagOccurrenceIsAContractFailure() {
        IrDocument doc = document(property("count", COUNT, IrToken.code("1")));
        assertThrows(IllegalStateException.class, () -> emit(doc, runtime()));
    }

    @Test
    void tagHelperInsideStringValueIsAContractFailure() {
        IrDocument doc = document(tagHelper("foo",
                property("greeting", GREETING, tagHelper("b", IrExpression.code("x")))));
        assertThrows(IllegalStateException.class, () -> emit(doc, runtime()));
    }
}
