package net.langexplorer.languages;

import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.util.grammar.Grammar;

/**
 * A language definition.
 */
public interface GrammarBuilder<T extends BinarySerializable, I> {

    Grammar<T, I> buildGrammar();

}
