package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Root of one generation unit (one template).
 */
@JsonPropertyOrder({"schemaVersion","filePath","children"})
public final class IrDocument extends IrNode {
    public static final String SCHEMA_VERSION = "1.0";

    public final String schemaVersion;

    /** Template path; used for line pragmas and deterministic ids. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String filePath;

    @JsonCreator
    public IrDocument(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("filePath") String filePath,
            @JsonProperty("children") List<IrNode> children
    ) {
        super(children, null);
        this.schemaVersion = (schemaVersion == null || schemaVersion.isBlank()) ? SCHEMA_VERSION : schemaVersion;
        this.filePath = filePath == null ? "" : filePath;
    }

    public static IrDocument of(String filePath, IrNode... children) {
        return new IrDocument(SCHEMA_VERSION, filePath, List.of(children));
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.DOCUMENT;
    }
}
