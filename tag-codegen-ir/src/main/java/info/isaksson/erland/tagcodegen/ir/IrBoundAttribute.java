package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Static metadata about one bindable property of a tag helper, as resolved by the binder.
 *
 * <p>Indexer metadata ({@link #indexerTypeName}, {@link #indexerNamePrefix}) is only present for
 * dictionary-like properties that bind every attribute sharing a name prefix.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"propertyName","typeName","isStringProperty","isIndexerStringProperty","isEnum","indexerTypeName","indexerNamePrefix"})
public final class IrBoundAttribute {
    public final String propertyName;

    /** Fully qualified type name of the property. */
    public final String typeName;

    public final boolean isStringProperty;
    public final boolean isIndexerStringProperty;
    public final boolean isEnum;

    /** Value type of the indexer, or null when the property has no indexer. */
    public final String indexerTypeName;

    /** Attribute name prefix selecting the indexer, or null when the property has no indexer. */
    public final String indexerNamePrefix;

    @JsonCreator
    public IrBoundAttribute(
            @JsonProperty("propertyName") String propertyName,
            @JsonProperty("typeName") String typeName,
            @JsonProperty("isStringProperty") boolean isStringProperty,
            @JsonProperty("isIndexerStringProperty") boolean isIndexerStringProperty,
            @JsonProperty("isEnum") boolean isEnum,
            @JsonProperty("indexerTypeName") String indexerTypeName,
            @JsonProperty("indexerNamePrefix") String indexerNamePrefix
    ) {
        if (propertyName == null || propertyName.isBlank()) {
            throw new IllegalArgumentException("bound attribute propertyName must not be blank");
        }
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("bound attribute typeName must not be blank: " + propertyName);
        }
        this.propertyName = propertyName;
        this.typeName = typeName;
        this.isStringProperty = isStringProperty;
        this.isIndexerStringProperty = isIndexerStringProperty;
        this.isEnum = isEnum;
        this.indexerTypeName = indexerTypeName;
        this.indexerNamePrefix = indexerNamePrefix;
    }

    public static IrBoundAttribute property(String propertyName, String typeName) {
        return new IrBoundAttribute(propertyName, typeName, "System.String".equals(typeName) || "string".equals(typeName),
                false, false, null, null);
    }

    public static IrBoundAttribute enumProperty(String propertyName, String enumTypeName) {
        return new IrBoundAttribute(propertyName, enumTypeName, false, false, true, null, null);
    }

    public static IrBoundAttribute indexer(String propertyName, String typeName, String indexerTypeName, String indexerNamePrefix) {
        boolean stringValued = "System.String".equals(indexerTypeName) || "string".equals(indexerTypeName);
        return new IrBoundAttribute(propertyName, typeName, false, stringValued, false, indexerTypeName, indexerNamePrefix);
    }

    /** True when the descriptor carries indexer metadata. */
    public boolean hasIndexer() {
        return indexerNamePrefix != null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrBoundAttribute)) return false;
        IrBoundAttribute that = (IrBoundAttribute) o;
        return isStringProperty == that.isStringProperty &&
                isIndexerStringProperty == that.isIndexerStringProperty &&
                isEnum == that.isEnum &&
                Objects.equals(propertyName, that.propertyName) &&
                Objects.equals(typeName, that.typeName) &&
                Objects.equals(indexerTypeName, that.indexerTypeName) &&
                Objects.equals(indexerNamePrefix, that.indexerNamePrefix);
    }

    @Override public int hashCode() {
        return Objects.hash(propertyName, typeName, isStringProperty, isIndexerStringProperty, isEnum, indexerTypeName, indexerNamePrefix);
    }
}
