package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrSourceSpan;

/**
 * Text sink for generated C# statements.
 *
 * <p>Indentation is applied automatically at the start of each line. The writer tracks the absolute,
 * line and column position of the next character so that line mappings can point into the output.</p>
 */
public final class CodeWriter {

    public static final int INDENT_SIZE = 4;
    public static final String NEW_LINE = "\n";

    /** A region that must be closed in reverse order of opening. */
    public interface Block extends AutoCloseable {
        @Override
        void close();
    }

    private static final Block NO_OP = () -> { };

    private final StringBuilder builder = new StringBuilder();
    private int indentLevel;
    private boolean atLineStart = true;

    private int absoluteIndex;
    private int lineIndex;
    private int characterIndex;

    public CodeWriter write(String text) {
        if (text == null || text.isEmpty()) return this;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (atLineStart && c != '\n') {
                atLineStart = false;
                appendRaw(" ".repeat(indentLevel * INDENT_SIZE));
            }
            appendRaw(c);
        }
        return this;
    }

    public CodeWriter writeLine() {
        return write(NEW_LINE);
    }

    public CodeWriter writeLine(String text) {
        return write(text).write(NEW_LINE);
    }

    /** Starts a new line unless the writer already sits at the start of one. */
    public CodeWriter ensureNewLine() {
        if (!atLineStart) writeLine();
        return this;
    }

    /**
     * Pads the current line so that text written after {@code offset} characters lands on the
     * template column of {@code span}. Replaces indentation for the line.
     */
    public CodeWriter writePadding(int offset, IrSourceSpan span) {
        if (span == null) return this;
        int padding = span.characterIndex - offset;
        if (atLineStart) {
            atLineStart = false;
            if (padding > 0) appendRaw(" ".repeat(padding));
        } else if (padding > 0) {
            appendRaw(" ".repeat(padding));
        }
        return this;
    }

    public CodeWriter writeStringLiteral(String literal) {
        return write("\"").write(escape(literal)).write("\"");
    }

    public CodeWriter writeStartAssignment(String name) {
        return write(name).write(" = ");
    }

    public CodeWriter writeParameterSeparator() {
        return write(", ");
    }

    public CodeWriter writeStartMethodInvocation(String methodName) {
        return write(methodName).write("(");
    }

    public CodeWriter writeStartInstanceMethodInvocation(String instanceName, String methodName) {
        return write(instanceName).write(".").write(methodName).write("(");
    }

    public CodeWriter writeEndMethodInvocation() {
        return writeEndMethodInvocation(true);
    }

    public CodeWriter writeEndMethodInvocation(boolean endLine) {
        write(")");
        if (endLine) writeLine(";");
        return this;
    }

    public CodeWriter writeMethodInvocation(String methodName, String... arguments) {
        writeStartMethodInvocation(methodName);
        writeArguments(arguments);
        return writeEndMethodInvocation();
    }

    public CodeWriter writeInstanceMethodInvocation(String instanceName, String methodName, String... arguments) {
        writeStartInstanceMethodInvocation(instanceName, methodName);
        writeArguments(arguments);
        return writeEndMethodInvocation();
    }

    public CodeWriter writeStartNewObject(String typeName) {
        return write("new ").write(typeName).write("(");
    }

    public CodeWriter writeField(String modifier, String typeName, String fieldName) {
        return write(modifier).write(" ").write(typeName).write(" ").write(fieldName).writeLine(";");
    }

    /** {@code type name = value;} where a null value is written as {@code null}. */
    public CodeWriter writeVariableDeclaration(String typeName, String name, String value) {
        return write(typeName).write(" ").write(name).write(" = ").write(value == null ? "null" : value).writeLine(";");
    }

    /** Writes <code>{</code> and indents until the returned block is closed, which writes <code>}</code>. */
    public Block buildScope() {
        writeLine("{");
        indentLevel++;
        return () -> {
            indentLevel--;
            ensureNewLine();
            writeLine("}");
        };
    }

    /** {@code async() => { ... }} */
    public Block buildAsyncLambda() {
        write("async() => ");
        return buildScope();
    }

    /** {@code async(parameter) => { ... }} */
    public Block buildAsyncLambda(String parameterName) {
        write("async(").write(parameterName).write(") => ");
        return buildScope();
    }

    /**
     * Brackets the statements written inside the block with a {@code #line} directive pointing at
     * {@code span}. Without a span nothing is written.
     */
    public Block buildLinePragma(IrSourceSpan span) {
        if (span == null) return NO_OP;
        ensureNewLine();
        write("#line ").write(Integer.toString(span.lineIndex + 1)).write(" ").writeStringLiteral(span.filePath).writeLine();
        return () -> {
            ensureNewLine();
            writeLine("#line default");
            writeLine("#line hidden");
        };
    }

    /** Indentation that will be written before the next character, if the writer sits at a line start. */
    public int pendingIndent() {
        return atLineStart ? indentLevel * INDENT_SIZE : 0;
    }

    public int indentLevel() {
        return indentLevel;
    }

    public int absoluteIndex() {
        return absoluteIndex;
    }

    public int lineIndex() {
        return lineIndex;
    }

    public int characterIndex() {
        return characterIndex;
    }

    public String generatedCode() {
        return builder.toString();
    }

    @Override
    public String toString() {
        return generatedCode();
    }

    /** C# regular string literal escaping. */
    public static String escape(String literal) {
        if (literal == null) return "";
        StringBuilder sb = new StringBuilder(literal.length());
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\0':
                    sb.append("\\0");
                    break;
                case '\u0085':
                    sb.append("\\u0085");
                    break;
                case '\u2028':
                    sb.append("\\u2028");
                    break;
                case '\u2029':
                    sb.append("\\u2029");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    private void writeArguments(String[] arguments) {
        if (arguments == null) return;
        for (int i = 0; i < arguments.length; i++) {
            if (i > 0) writeParameterSeparator();
            write(arguments[i]);
        }
    }

    private void appendRaw(String s) {
        for (int i = 0; i < s.length(); i++) appendRaw(s.charAt(i));
    }

    private void appendRaw(char c) {
        builder.append(c);
        absoluteIndex++;
        if (c == '\n') {
            lineIndex++;
            characterIndex = 0;
            atLineStart = true;
        } else {
            characterIndex++;
        }
    }
}
