package info.isaksson.erland.tagcodegen.emitter;

import info.isaksson.erland.tagcodegen.ir.IrSourceSpan;

import java.util.Objects;

/** A recoverable problem reported during emission. Generation continues after it is recorded. */
public final class EmitterDiagnostic {

    public final DiagnosticKind kind;

    /** Stable code, e.g. {@code TH1001}. */
    public final String code;

    public final Severity severity;

    /** Human-readable message with arguments applied. */
    public final String message;

    /** Template location the diagnostic applies to; null when unknown. */
    public final IrSourceSpan span;

    public EmitterDiagnostic(DiagnosticKind kind, String message, IrSourceSpan span) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.code = kind.code;
        this.severity = kind.severity;
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.span = span;
    }

    /** Compiler-style rendering: {@code file(line,col): error TH1001: message}. */
    @Override
    public String toString() {
        String head = severity.label() + " " + code + ": " + message;
        return span == null ? head : span + ": " + head;
    }
}
