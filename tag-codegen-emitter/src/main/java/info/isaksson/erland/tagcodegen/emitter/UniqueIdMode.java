package info.isaksson.erland.tagcodegen.emitter;

import java.util.Locale;

/** Named identifier strategies selectable from the command line. */
public enum UniqueIdMode {
    /** Fresh random id per occurrence; output differs between runs. */
    RANDOM("random"),
    /** "1", "2", ... per pass. */
    COUNTER("counter"),
    /** Hash of document path and occurrence index; stable across runs. */
    HASHED("hashed");

    public final String cliValue;

    UniqueIdMode(String cliValue) {
        this.cliValue = cliValue;
    }

    public UniqueIdStrategy strategy() {
        switch (this) {
            case COUNTER:
                return UniqueIdStrategy.counter();
            case HASHED:
                return UniqueIdStrategy.hashed();
            case RANDOM:
            default:
                return UniqueIdStrategy.random();
        }
    }

    public static UniqueIdMode parseCli(String v) {
        if (v == null) return RANDOM;
        String s = v.trim().toLowerCase(Locale.ROOT);
        for (UniqueIdMode m : values()) {
            if (m.cliValue.equals(s)) return m;
        }
        throw new IllegalArgumentException("Invalid value for --unique-ids: " + v + " (expected one of: random|counter|hashed)");
    }
}
