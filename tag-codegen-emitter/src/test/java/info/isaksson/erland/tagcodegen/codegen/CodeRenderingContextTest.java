package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.emitter.EmitterDiagnostics;
import info.isaksson.erland.tagcodegen.emitter.UniqueIdStrategy;
import info.isaksson.erland.tagcodegen.ir.IrBoundAttribute;
import info.isaksson.erland.tagcodegen.ir.IrCodeBlock;
import info.isaksson.erland.tagcodegen.ir.IrDocument;
import info.isaksson.erland.tagcodegen.ir.IrHtmlContent;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperBody;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperHtmlAttribute;
import info.isaksson.erland.tagcodegen.ir.IrExpressionAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrToken;
import info.isaksson.erland.tagcodegen.ir.TagMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static info.isaksson.erland.tagcodegen.codegen.TagHelperFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class CodeRenderingContextTest {

    private static CodeRenderingContext newContext(boolean designTime, Map<String, Object> items) {
        return new CodeRenderingContext(
                new CodeWriter(),
                new EmitterDiagnostics(),
                new DocumentWriter(new DefaultTagHelperTargetExtension()),
                designTime,
                items,
                UniqueIdStrategy.counter().open(FILE));
    }

    @Test
    void writerStackIsBalancedAfterPassWithDiagnostics() {
        CodeRenderingContext context = newContext(false, null);
        IrDocument doc = document(tagHelper("foo",
                IrTagHelperBody.of(IrHtmlContent.text("x")),
                property("count", IrBoundAttribute.property("Count", "System.Int32"), IrCodeBlock.code("x();")),
                new IrTagHelperHtmlAttribute("class", null, List.of(
                        new IrExpressionAttributeValue("", List.of(IrToken.code("css")), null)), null)));

        RuntimeNodeWriter root = new RuntimeNodeWriter();
        try (CodeRenderingContext.WriterScope scope = context.push(root)) {
            context.renderNode(doc);
            assertEquals(1, context.writerDepth());
            assertSame(root, context.nodeWriter());
        }

        assertEquals(0, context.writerDepth());
        assertEquals(1, context.diagnostics().size());
        assertNull(context.tagHelperContext());
    }

    @Test
    void closingOutOfOrderIsDetected() {
        CodeRenderingContext context = newContext(false, null);
        CodeRenderingContext.WriterScope outer = context.push(new RuntimeNodeWriter());
        context.push(new LiteralRuntimeNodeWriter());

        assertThrows(IllegalStateException.class, outer::close);
    }

    @Test
    void nodeWriterIsRequired() {
        assertThrows(IllegalStateException.class, () -> newContext(true, null).nodeWriter());
    }

    @Test
    void tagOccurrencesNestAndRestore() {
        CodeRenderingContext context = newContext(false, null);
        TagHelperRenderingContext outer = new TagHelperRenderingContext("p", TagMode.START_TAG_AND_END_TAG);
        TagHelperRenderingContext inner = new TagHelperRenderingContext("b", TagMode.SELF_CLOSING);

        try (CodeRenderingContext.WriterScope o = context.enterTagHelper(outer)) {
            try (CodeRenderingContext.WriterScope i = context.enterTagHelper(inner)) {
                assertSame(inner, context.tagHelperContext());
            }
            assertSame(outer, context.tagHelperContext());
        }
        assertNull(context.tagHelperContext());
    }

    @Test
    void suppressedUniqueIdOverridesStrategy() {
        CodeRenderingContext plain = newContext(false, null);
        assertEquals("1", plain.nextUniqueId());
        assertEquals("2", plain.nextUniqueId());

        CodeRenderingContext suppressed = newContext(false, Map.of(CodeRenderingContext.SUPPRESS_UNIQUE_IDS, "test"));
        assertEquals("test", suppressed.nextUniqueId());
        assertEquals("test", suppressed.nextUniqueId());
    }

    @Test
    void runtimeScaffoldingCanBeClaimedOnce() {
        CodeRenderingContext context = newContext(false, null);
        assertTrue(context.claimRuntimeScaffolding());
        assertFalse(context.claimRuntimeScaffolding());
    }
}
