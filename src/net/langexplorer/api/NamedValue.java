package net.langexplorer.api;

/**
 * A generic interface for marking objects with textual names.
 */
public interface NamedValue {

    /**
     * The name of this object.
     * For grammars, this is a human-readable name that is suitable as a
     * storage key, i.e. it should not contain path separators.
     */
    String getName();

}
