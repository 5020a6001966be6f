package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.emitter.EmitterDiagnostics;
import info.isaksson.erland.tagcodegen.emitter.UniqueIdSource;
import info.isaksson.erland.tagcodegen.ir.IrNode;
import info.isaksson.erland.tagcodegen.ir.IrSourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State threaded through one generation pass: output, diagnostics, the node writer stack and the
 * active tag occurrence.
 *
 * <p>Not thread-safe. Each pass owns its own instance.</p>
 */
public final class CodeRenderingContext {

    /** Item key whose string value replaces every generated unique id. */
    public static final String SUPPRESS_UNIQUE_IDS = "SuppressUniqueIds";

    /** Closes a writer push; closing out of order is a traversal bug. */
    public interface WriterScope extends AutoCloseable {
        @Override
        void close();
    }

    private final CodeWriter codeWriter;
    private final EmitterDiagnostics diagnostics;
    private final DocumentWriter documentWriter;
    private final boolean designTime;
    private final Map<String, Object> items;
    private final UniqueIdSource uniqueIds;
    private final Deque<NodeWriter> writers = new ArrayDeque<>();
    private final List<LineMapping> lineMappings = new ArrayList<>();

    private TagHelperRenderingContext tagHelperContext;
    private boolean runtimeScaffoldingWritten;

    public CodeRenderingContext(
            CodeWriter codeWriter,
            EmitterDiagnostics diagnostics,
            DocumentWriter documentWriter,
            boolean designTime,
            Map<String, Object> items,
            UniqueIdSource uniqueIds
    ) {
        if (codeWriter == null) throw new IllegalArgumentException("codeWriter must not be null");
        if (diagnostics == null) throw new IllegalArgumentException("diagnostics must not be null");
        if (documentWriter == null) throw new IllegalArgumentException("documentWriter must not be null");
        if (uniqueIds == null) throw new IllegalArgumentException("uniqueIds must not be null");
        this.codeWriter = codeWriter;
        this.diagnostics = diagnostics;
        this.documentWriter = documentWriter;
        this.designTime = designTime;
        this.items = items == null ? new LinkedHashMap<>() : new LinkedHashMap<>(items);
        this.uniqueIds = uniqueIds;
    }

    public CodeWriter codeWriter() {
        return codeWriter;
    }

    public EmitterDiagnostics diagnostics() {
        return diagnostics;
    }

    public boolean isDesignTime() {
        return designTime;
    }

    public Map<String, Object> items() {
        return items;
    }

    public NodeWriter nodeWriter() {
        NodeWriter top = writers.peek();
        if (top == null) throw new IllegalStateException("No node writer is active");
        return top;
    }

    public int writerDepth() {
        return writers.size();
    }

    /** Makes {@code writer} active until the returned scope is closed. */
    public WriterScope push(NodeWriter writer) {
        if (writer == null) throw new IllegalArgumentException("writer must not be null");
        writers.push(writer);
        return () -> {
            NodeWriter popped = writers.poll();
            if (popped != writer) {
                throw new IllegalStateException("Unbalanced node writer stack: expected "
                        + writer.getClass().getSimpleName() + " on top but found "
                        + (popped == null ? "nothing" : popped.getClass().getSimpleName()));
            }
        };
    }

    /** Enters a tag occurrence; closing the scope restores the enclosing occurrence, if any. */
    public WriterScope enterTagHelper(TagHelperRenderingContext occurrence) {
        if (occurrence == null) throw new IllegalArgumentException("occurrence must not be null");
        TagHelperRenderingContext parent = tagHelperContext;
        tagHelperContext = occurrence;
        return () -> tagHelperContext = parent;
    }

    /** The active tag occurrence, or null outside one. */
    public TagHelperRenderingContext tagHelperContext() {
        return tagHelperContext;
    }

    public TagHelperRenderingContext requireTagHelperContext(IrNode node) {
        if (tagHelperContext == null) {
            throw new IllegalStateException(node.kind() + " node must be rendered inside a tag helper occurrence"
                    + (node.source == null ? "" : " at " + node.source));
        }
        return tagHelperContext;
    }

    public String nextUniqueId() {
        Object suppressed = items.get(SUPPRESS_UNIQUE_IDS);
        if (suppressed instanceof String) return (String) suppressed;
        return uniqueIds.next();
    }

    /** Returns true the first time it is called in a pass. */
    public boolean claimRuntimeScaffolding() {
        if (runtimeScaffoldingWritten) return false;
        runtimeScaffoldingWritten = true;
        return true;
    }

    /** Records that the code about to be written at the current position came from {@code node}. */
    public void addLineMappingFor(IrNode node) {
        if (node.source == null) return;
        int indent = codeWriter.pendingIndent();
        IrSourceSpan generated = new IrSourceSpan(
                "",
                codeWriter.absoluteIndex() + indent,
                codeWriter.lineIndex(),
                codeWriter.characterIndex() + indent,
                node.source.length);
        lineMappings.add(new LineMapping(node.source, generated));
    }

    public List<LineMapping> lineMappings() {
        return Collections.unmodifiableList(lineMappings);
    }

    public void renderNode(IrNode node) {
        documentWriter.visit(this, node);
    }

    public void renderChildren(IrNode node) {
        for (IrNode child : node.children) {
            documentWriter.visit(this, child);
        }
    }
}
