package info.isaksson.erland.tagcodegen.core;

import info.isaksson.erland.tagcodegen.codegen.LineMapping;
import info.isaksson.erland.tagcodegen.emitter.EmitterDiagnostic;
import info.isaksson.erland.tagcodegen.ir.IrDocument;

import java.nio.charset.StandardCharsets;
import java.util.List;

/** Generation result container for programmatic usage. */
public final class TagCodegenResult {
    /** Generated C# source. */
    public final String code;

    /** Convenience: UTF-8 encoded {@link #code}. */
    public final byte[] codeBytes;

    public final List<EmitterDiagnostic> diagnostics;

    /** Empty for runtime output. */
    public final List<LineMapping> lineMappings;

    /** The IR the code was generated from. */
    public final IrDocument document;

    TagCodegenResult(String code, List<EmitterDiagnostic> diagnostics, List<LineMapping> lineMappings, IrDocument document) {
        this.code = code;
        this.codeBytes = code.getBytes(StandardCharsets.UTF_8);
        this.diagnostics = diagnostics;
        this.lineMappings = lineMappings;
        this.document = document;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
