package info.isaksson.erland.tagcodegen.emitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Options for one tag helper generation pass. */
public final class EmitterOptions {

    /** Design-time output keeps the structure for tooling and emits no runtime calls. */
    public final boolean designTime;

    public final UniqueIdStrategy uniqueIds;

    /** Side-channel items copied into the rendering context, e.g. {@code CodeRenderingContext.SUPPRESS_UNIQUE_IDS}. */
    public final Map<String, Object> items;

    public EmitterOptions(boolean designTime, UniqueIdStrategy uniqueIds, Map<String, Object> items) {
        this.designTime = designTime;
        this.uniqueIds = uniqueIds == null ? UniqueIdStrategy.random() : uniqueIds;
        if (items == null || items.isEmpty()) {
            this.items = Collections.emptyMap();
        } else {
            this.items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
        }
    }

    public static EmitterOptions runtime() {
        return new EmitterOptions(false, UniqueIdStrategy.random(), null);
    }

    public static EmitterOptions designTime() {
        return new EmitterOptions(true, UniqueIdStrategy.random(), null);
    }

    public EmitterOptions withDesignTime(boolean designTime) {
        return new EmitterOptions(designTime, uniqueIds, items);
    }

    public EmitterOptions withUniqueIds(UniqueIdStrategy strategy) {
        return new EmitterOptions(designTime, strategy, items);
    }

    public EmitterOptions withItem(String key, Object value) {
        if (key == null) throw new IllegalArgumentException("key must not be null");
        Map<String, Object> copy = new LinkedHashMap<>(items);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new EmitterOptions(designTime, uniqueIds, copy);
    }

    @Override
    public String toString() {
        return "EmitterOptions{" +
                "designTime=" + designTime +
                ", items=" + items.keySet() +
                '}';
    }
}
