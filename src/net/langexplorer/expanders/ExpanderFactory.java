package net.langexplorer.expanders;

import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.util.grammar.Grammar;

/**
 * Creates one expander per generating thread.
 */
public interface ExpanderFactory<T extends BinarySerializable, I> {

    Expander<T, I> create(Grammar<T, I> grammar, long seed);

}
