package net.langexplorer.util.grammar;

import java.nio.charset.StandardCharsets;
import java.util.List;
import net.langexplorer.TestGrammars;
import net.langexplorer.api.grammar.NoRootProductionException;
import net.langexplorer.api.grammar.UnknownNonterminalException;
import net.langexplorer.expanders.Expander;
import net.langexplorer.expanders.UniformRandomExpander;
import net.langexplorer.languages.AnBnCnLanguage;
import net.langexplorer.languages.StringValue;
import net.langexplorer.languages.ToyLanguage;
import org.junit.jupiter.api.Test;

import static net.langexplorer.TestGrammars.*;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

    private static String text(ProgramInstance<?, ?> p) {
        return new String(p.serialize(), StandardCharsets.UTF_8);
    }

    private static void assertNoNonterminalLeaves(ProgramInstance<?, ?> p) {
        for (ProgramInstance<?, ?> n : p.getAllNodes()) {
            if (n.isNonterminal())
                assertTrue(n.childCount() > 0, "unexpanded node " + n);
        }
    }

    @Test
    void contextFreeGenerationProducesOnlyTerminals() throws Exception {
        Grammar<StringValue, String> g = arithmetic();
        assertFalse(g.isContextSensitive());
        for (long seed = 0; seed < 50; seed++) {
            ProgramInstance<StringValue, String> p = g.generate(
                new UniformRandomExpander<StringValue, String>(seed));
            assertNoNonterminalLeaves(p);
            assertTrue(text(p).matches("[012](\\+[012])*"), text(p));
        }
    }

    @Test
    void scriptedDerivation() throws Exception {
        Grammar<StringValue, String> g = arithmetic();
        // E -> N '+' E, N -> '1', E -> N, N -> '2'
        ProgramInstance<StringValue, String> p =
            g.generate(new ScriptedExpander(1, 1, 0, 2));
        assertEquals("1+2", text(p));
        assertEquals("EN1+EN2", p.toString());
        assertEquals(1, p.getId());
        assertNull(p.getParentId());
        // Ids are handed out depth-first.
        assertEquals(2, p.childAt(0).getId());
        assertEquals(3, p.childAt(0).childAt(0).getId());
        assertEquals(4, p.childAt(1).getId());
        assertEquals(5, p.childAt(2).getId());
        assertEquals(Long.valueOf(5), p.childAt(2).childAt(0).getParentId());
    }

    @Test
    void balancedPairs() throws Exception {
        Grammar<StringValue, String> g = new ToyLanguage().buildGrammar();
        for (long seed = 0; seed < 100; seed++) {
            ProgramInstance<StringValue, String> p = g.generate(
                new UniformRandomExpander<StringValue, String>(seed));
            String s = text(p);
            int n = s.length() / 2;
            StringBuilder expected = new StringBuilder();
            for (int i = 0; i < n; i++) expected.append('a');
            for (int i = 0; i < n; i++) expected.append('b');
            assertEquals(expected.toString(), s);
            assertTrue(p.depth() <= n + 2);
            assertTrue(p.depth() < 100);
        }
    }

    @Test
    void missingRoot() {
        Grammar<StringValue, String> g = grammar("X",
            Production.contextFree("E", ProductionRule.of(A)));
        assertThrows(NoRootProductionException.class, () ->
            g.generate(new ScriptedExpander()));
    }

    @Test
    void unknownNonterminal() {
        Grammar<StringValue, String> g = grammar("E",
            Production.contextFree("E", ProductionRule.of(A, nt("Q"))));
        assertThrows(UnknownNonterminalException.class, () ->
            g.generate(new ScriptedExpander()));
    }

    @Test
    void foreignRuleIsRejected() {
        Grammar<StringValue, String> g = arithmetic();
        Expander<StringValue, String> bad = new ScriptedExpander() {
            public ProductionRule<StringValue, String> chooseRule(
                    Grammar<StringValue, String> grammar,
                    ProgramInstance<StringValue, String> context,
                    Production<StringValue, String> production) {
                return ProductionRule.of(C);
            }
        };
        assertThrows(IllegalStateException.class, () -> g.generate(bad));
    }

    @Test
    void lastProductionWins() {
        Grammar<StringValue, String> g = grammar("E",
            Production.contextFree("E", ProductionRule.of(A)),
            Production.contextFree("N", ProductionRule.of(B)),
            Production.contextFree("E", ProductionRule.of(C)));
        assertEquals(2, g.getProductions().size());
        List<LeftHandSide<StringValue, String>> keys =
            new java.util.ArrayList<>(g.getProductions().keySet());
        assertEquals(LeftHandSide.contextFree("E"), keys.get(0));
        assertEquals(ProductionRule.of(C),
            g.getProduction(LeftHandSide.contextFree("E")).get(0));
    }

    @Test
    void bnfPutsRootFirst() {
        Grammar<StringValue, String> g = grammar("E",
            Production.contextFree("N",
                ProductionRule.of(t("0")), ProductionRule.of(t("1"))),
            Production.contextFree("E",
                ProductionRule.of(nt("N")),
                ProductionRule.of(nt("N"), t("+"), nt("E"))));
        assertEquals("<E> ::= <N> | <N> '+' <E>\n\n<N> ::= '0' | '1'",
                     g.toBNF());
        assertEquals("<S> ::= 'a' <S> 'b' | 'ε'",
                     new ToyLanguage().buildGrammar().toBNF());
    }

    @Test
    void digestIsDeterministic() {
        Grammar<StringValue, String> a = arithmetic();
        Grammar<StringValue, String> b = arithmetic();
        Grammar<StringValue, String> c = new ToyLanguage().buildGrammar();
        assertEquals(a.generateUuid(), b.generateUuid());
        assertNotEquals(a.generateUuid(), c.generateUuid());
        assertEquals(64, a.generateUuid().length());
        assertTrue(a.generateUuid().matches("[0-9a-f]+"));
        assertEquals("test_" + a.generateUuid().substring(0, 16),
                     a.getName());
    }

    @Test
    void contextSensitivityIsDetected() {
        assertTrue(new AnBnCnLanguage().buildGrammar().isContextSensitive());
        assertFalse(new ToyLanguage().buildGrammar().isContextSensitive());
    }

    @Test
    void allSymbols() {
        Grammar<StringValue, String> g = new ToyLanguage().buildGrammar();
        assertEquals(4, g.getAllSymbols().size());
        assertTrue(g.getAllSymbols().contains(eps()));
    }

}
