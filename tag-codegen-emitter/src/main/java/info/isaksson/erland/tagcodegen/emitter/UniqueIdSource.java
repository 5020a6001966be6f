package info.isaksson.erland.tagcodegen.emitter;

/** Supplies the per-occurrence identifier passed to the scope manager. One source serves one generation pass. */
@FunctionalInterface
public interface UniqueIdSource {
    String next();
}
