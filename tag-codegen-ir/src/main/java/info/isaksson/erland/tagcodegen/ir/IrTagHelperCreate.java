package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Instantiates one tag helper into its per-occurrence field. */
@JsonPropertyOrder({"field","typeName","source"})
public final class IrTagHelperCreate extends IrNode {

    /** Name of the generated field holding the instance. */
    public final String field;

    /** Fully qualified tag helper type name. */
    public final String typeName;

    @JsonCreator
    public IrTagHelperCreate(
            @JsonProperty("field") String field,
            @JsonProperty("typeName") String typeName,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(List.of(), source);
        this.field = requireText(field, "a field", IrTagHelperCreate.class);
        this.typeName = requireText(typeName, "a typeName", IrTagHelperCreate.class);
    }

    public static IrTagHelperCreate of(String field, String typeName) {
        return new IrTagHelperCreate(field, typeName, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TAG_HELPER_CREATE;
    }
}
