package net.langexplorer.languages;

import java.util.Arrays;
import net.langexplorer.util.grammar.Grammar;
import net.langexplorer.util.grammar.Production;
import net.langexplorer.util.grammar.ProductionRule;
import net.langexplorer.util.grammar.Symbol;

/**
 * Balanced pairs: S -> 'a' S 'b' | epsilon.
 */
public class ToyLanguage implements GrammarBuilder<StringValue, String> {

    public static final String NAME = "toy";

    public Grammar<StringValue, String> buildGrammar() {
        Symbol<StringValue, String> a = Symbol.terminal(StringValue.of("a"));
        Symbol<StringValue, String> b = Symbol.terminal(StringValue.of("b"));
        Symbol<StringValue, String> s = Symbol.nonterminal("S");
        Symbol<StringValue, String> eps = Symbol.epsilon();
        return new Grammar<StringValue, String>("S", Arrays.asList(
            Production.contextFree("S",
                ProductionRule.of(a, s, b),
                ProductionRule.of(eps))),
            NAME);
    }

}
