package info.isaksson.erland.tagcodegen.core;

import info.isaksson.erland.tagcodegen.emitter.TagHelperEmitter;
import info.isaksson.erland.tagcodegen.ir.IrDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Core (server-friendly) API for generating tag helper code.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline. One
 * instance may be shared; IR files loaded through it are cached by path and modification time.</p>
 */
public final class TagCodegenService {

    private static final Logger log = LoggerFactory.getLogger(TagCodegenService.class);

    private final TagHelperEmitter emitter;
    private final IrDocumentCache cache = new IrDocumentCache();

    public TagCodegenService() {
        this(new TagHelperEmitter());
    }

    public TagCodegenService(TagHelperEmitter emitter) {
        if (emitter == null) throw new IllegalArgumentException("emitter must not be null");
        this.emitter = emitter;
    }

    /** Generate code from an in-memory IR document. */
    public TagCodegenResult generateFromIr(IrDocument document, TagCodegenOptions options) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        if (options == null) options = new TagCodegenOptions();

        TagHelperEmitter.Result res = emitter.emit(document, options.toEmitterOptions());

        log.info("Generated {} ({} mode): {} chars, {} diagnostics",
                document.filePath.isEmpty() ? "<unnamed>" : document.filePath,
                options.designTime ? "design-time" : "runtime",
                res.code.length(),
                res.diagnostics.size());

        return new TagCodegenResult(res.code, res.diagnostics, res.lineMappings, document);
    }

    /** Generate code from an IR JSON file. */
    public TagCodegenResult generateFromFile(Path irFile, TagCodegenOptions options) throws IOException {
        if (irFile == null) throw new IllegalArgumentException("irFile must not be null");
        return generateFromIr(cache.load(irFile), options);
    }

    IrDocumentCache cache() {
        return cache;
    }
}
