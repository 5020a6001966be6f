package info.isaksson.erland.tagcodegen.emitter;

import info.isaksson.erland.tagcodegen.ir.IrSourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only diagnostics sink for one generation pass.
 *
 * <p>Entries keep the order in which their nodes were visited; nothing reads the sink until the pass completes.</p>
 */
public final class EmitterDiagnostics {

    private final List<EmitterDiagnostic> diagnostics = new ArrayList<>();

    public void add(DiagnosticKind kind, IrSourceSpan span, Object... args) {
        diagnostics.add(new EmitterDiagnostic(kind, kind.format(args), span));
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        for (EmitterDiagnostic d : diagnostics) {
            if (d.severity == Severity.ERROR) return true;
        }
        return false;
    }

    public List<EmitterDiagnostic> toList() {
        return List.copyOf(diagnostics);
    }
}
