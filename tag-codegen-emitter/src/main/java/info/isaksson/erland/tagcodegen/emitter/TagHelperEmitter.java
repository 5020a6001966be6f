package info.isaksson.erland.tagcodegen.emitter;

import info.isaksson.erland.tagcodegen.codegen.CodeRenderingContext;
import info.isaksson.erland.tagcodegen.codegen.CodeWriter;
import info.isaksson.erland.tagcodegen.codegen.DefaultTagHelperTargetExtension;
import info.isaksson.erland.tagcodegen.codegen.DesignTimeNodeWriter;
import info.isaksson.erland.tagcodegen.codegen.DocumentWriter;
import info.isaksson.erland.tagcodegen.codegen.LineMapping;
import info.isaksson.erland.tagcodegen.codegen.NodeWriter;
import info.isaksson.erland.tagcodegen.codegen.RuntimeNodeWriter;
import info.isaksson.erland.tagcodegen.codegen.TagHelperTargetExtension;
import info.isaksson.erland.tagcodegen.ir.IrDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Public API: generate C# tag helper code from an IR document.
 *
 * <p>One call is one generation pass with its own rendering context, so independent documents may be
 * emitted concurrently from different threads.</p>
 */
public final class TagHelperEmitter {

    private static final Logger log = LoggerFactory.getLogger(TagHelperEmitter.class);

    /** Generated code plus everything recorded while producing it. */
    public static final class Result {
        public final String code;
        public final List<EmitterDiagnostic> diagnostics;
        /** Design-time only; empty for runtime output. */
        public final List<LineMapping> lineMappings;

        Result(String code, List<EmitterDiagnostic> diagnostics, List<LineMapping> lineMappings) {
            this.code = code;
            this.diagnostics = diagnostics == null ? List.of() : diagnostics;
            this.lineMappings = lineMappings == null ? List.of() : lineMappings;
        }

        public boolean hasDiagnostics() {
            return !diagnostics.isEmpty();
        }
    }

    private final TagHelperTargetExtension extension;

    public TagHelperEmitter() {
        this(new DefaultTagHelperTargetExtension());
    }

    public TagHelperEmitter(TagHelperTargetExtension extension) {
        if (extension == null) throw new IllegalArgumentException("extension must not be null");
        this.extension = extension;
    }

    public Result emit(IrDocument document, EmitterOptions options) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        if (options == null) options = EmitterOptions.runtime();

        CodeWriter writer = new CodeWriter();
        EmitterDiagnostics diagnostics = new EmitterDiagnostics();
        CodeRenderingContext context = new CodeRenderingContext(
                writer,
                diagnostics,
                new DocumentWriter(extension),
                options.designTime,
                options.items,
                options.uniqueIds.open(document.filePath)
        );

        NodeWriter root = options.designTime ? new DesignTimeNodeWriter() : new RuntimeNodeWriter();
        try (CodeRenderingContext.WriterScope scope = context.push(root)) {
            context.renderNode(document);
        }
        if (context.writerDepth() != 0) {
            throw new IllegalStateException("Node writer stack not empty after generation: depth " + context.writerDepth());
        }

        if (log.isDebugEnabled()) {
            log.debug("Generated {} chars for {} ({} mode, {} nodes, {} diagnostics)",
                    writer.absoluteIndex(),
                    document.filePath.isEmpty() ? "<unnamed>" : document.filePath,
                    options.designTime ? "design-time" : "runtime",
                    document.subtreeSize(),
                    diagnostics.size());
        }

        return new Result(writer.generatedCode(), diagnostics.toList(), List.copyOf(context.lineMappings()));
    }

    /** Convenience for callers that only need the generated text. */
    public String emitToString(IrDocument document, EmitterOptions options) {
        return emit(document, options).code;
    }
}
