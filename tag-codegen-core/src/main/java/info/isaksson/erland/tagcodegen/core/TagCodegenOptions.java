package info.isaksson.erland.tagcodegen.core;

import info.isaksson.erland.tagcodegen.emitter.EmitterOptions;
import info.isaksson.erland.tagcodegen.emitter.UniqueIdMode;
import info.isaksson.erland.tagcodegen.emitter.UniqueIdStrategy;

/**
 * Core (server-friendly) options for tag helper code generation.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class TagCodegenOptions {

    /** Generate editor-oriented design-time code instead of executable runtime code. */
    public boolean designTime = false;

    public UniqueIdMode uniqueIdMode = UniqueIdMode.RANDOM;

    /**
     * When set, every tag helper occurrence gets this id, regardless of {@link #uniqueIdMode}.
     * Intended for golden-output tests.
     */
    public String fixedUniqueId = null;

    /**
     * If true, callers may treat diagnostics as a failure.
     * (Core still returns the generated code; this is for upstream policy.)
     */
    public boolean failOnDiagnostics = false;

    EmitterOptions toEmitterOptions() {
        UniqueIdStrategy ids = fixedUniqueId != null
                ? UniqueIdStrategy.fixed(fixedUniqueId)
                : (uniqueIdMode == null ? UniqueIdMode.RANDOM : uniqueIdMode).strategy();
        return EmitterOptions.runtime()
                .withDesignTime(designTime)
                .withUniqueIds(ids);
    }
}
