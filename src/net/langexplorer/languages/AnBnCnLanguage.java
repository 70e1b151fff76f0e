package net.langexplorer.languages;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.langexplorer.util.grammar.Grammar;
import net.langexplorer.util.grammar.LeftHandSide;
import net.langexplorer.util.grammar.Production;
import net.langexplorer.util.grammar.ProductionRule;
import net.langexplorer.util.grammar.Symbol;

/**
 * The context-sensitive language a^n b^n c^n (n >= 1).
 * S yields a^n (B C)^n; the C B pairs are then reordered through the
 * helper non-terminals Z and W, and B and C are finally rewritten into
 * terminals from left to right. Some derivation orders get stuck, e.g.
 * when a C is turned into c while a B still follows it.
 */
public class AnBnCnLanguage implements GrammarBuilder<StringValue, String> {

    public static final String NAME = "anbncn";

    private static List<Symbol<StringValue, String>> ctx(
            Symbol<StringValue, String> s) {
        return Collections.singletonList(s);
    }

    public Grammar<StringValue, String> buildGrammar() {
        Symbol<StringValue, String> a = Symbol.terminal(StringValue.of("a"));
        Symbol<StringValue, String> b = Symbol.terminal(StringValue.of("b"));
        Symbol<StringValue, String> c = Symbol.terminal(StringValue.of("c"));
        Symbol<StringValue, String> ntS = Symbol.nonterminal("S");
        Symbol<StringValue, String> ntB = Symbol.nonterminal("B");
        Symbol<StringValue, String> ntC = Symbol.nonterminal("C");
        Symbol<StringValue, String> ntW = Symbol.nonterminal("W");
        Symbol<StringValue, String> ntZ = Symbol.nonterminal("Z");
        return new Grammar<StringValue, String>("S", Arrays.asList(
            Production.contextFree("S",
                ProductionRule.of(a, ntB, ntC),
                ProductionRule.of(a, ntS, ntB, ntC)),
            // C B -> C Z -> W Z -> W C -> B C
            Production.of(LeftHandSide.withPrefix(ctx(ntC), "B"),
                ProductionRule.of(ntZ)),
            Production.of(LeftHandSide.withSuffix("C", ctx(ntZ)),
                ProductionRule.of(ntW)),
            Production.of(LeftHandSide.withPrefix(ctx(ntW), "Z"),
                ProductionRule.of(ntC)),
            Production.of(LeftHandSide.withSuffix("W", ctx(ntC)),
                ProductionRule.of(ntB)),
            Production.of(LeftHandSide.withPrefix(ctx(a), "B"),
                ProductionRule.of(b)),
            Production.of(LeftHandSide.withPrefix(ctx(b), "B"),
                ProductionRule.of(b)),
            Production.of(LeftHandSide.withPrefix(ctx(b), "C"),
                ProductionRule.of(c)),
            Production.of(LeftHandSide.withPrefix(ctx(c), "C"),
                ProductionRule.of(c))),
            NAME);
    }

}
