package net.langexplorer.util.grammar;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import net.langexplorer.TestGrammars;
import net.langexplorer.api.grammar.NoValidExpansionException;
import net.langexplorer.expanders.UniformRandomExpander;
import net.langexplorer.languages.AnBnCnLanguage;
import net.langexplorer.languages.StringValue;
import org.junit.jupiter.api.Test;

import static net.langexplorer.TestGrammars.*;
import static org.junit.jupiter.api.Assertions.*;

public class ContextSensitiveGenerationTest {

    private static boolean isAnBnCn(String s) {
        int n = s.length() / 3;
        if (n == 0 || s.length() != 3 * n) return false;
        for (int i = 0; i < s.length(); i++) {
            char expected = (i < n) ? 'a' : (i < 2 * n) ? 'b' : 'c';
            if (s.charAt(i) != expected) return false;
        }
        return true;
    }

    @Test
    void anbncnSucceedsOrGetsStuck() {
        Grammar<StringValue, String> g = new AnBnCnLanguage().buildGrammar();
        int successes = 0;
        for (long seed = 0; seed < 50; seed++) {
            try {
                ProgramInstance<StringValue, String> p = g.generate(
                    new UniformRandomExpander<StringValue, String>(seed));
                String s = new String(p.serialize(), StandardCharsets.UTF_8);
                assertTrue(isAnBnCn(s), s);
                assertEquals(p.nodeCount() - 1, p.getEdgeList().size());
                successes++;
            } catch (NoValidExpansionException exc) {
                // Stuck derivations are expected for some seeds.
            } catch (Exception exc) {
                fail(exc);
            }
        }
        assertTrue(successes > 0);
    }

    @Test
    void scriptedDerivationOfAbc() throws Exception {
        Grammar<StringValue, String> g = new AnBnCnLanguage().buildGrammar();
        // S -> 'a' B C; then [a]B -> 'b'; then [b]C -> 'c'
        ProgramInstance<StringValue, String> p =
            g.generate(new ScriptedExpander(0, 0, 0));
        assertEquals("abc",
                     new String(p.serialize(), StandardCharsets.UTF_8));
        assertEquals("SaBbCc", p.toString());
        assertEquals(6, p.nodeCount());
        for (ProgramInstance<StringValue, String> child : p.getChildren()) {
            assertEquals(Long.valueOf(1), child.getParentId());
        }
    }

    @Test
    void stuckDerivationThrows() {
        // S -> 'a' X, but X only rewrites after a 'b'.
        Grammar<StringValue, String> g = grammar("S",
            Production.contextFree("S", ProductionRule.of(A, nt("X"))),
            Production.of(LeftHandSide.withPrefix(Arrays.asList(B), "X"),
                ProductionRule.of(C)));
        assertTrue(g.isContextSensitive());
        assertThrows(NoValidExpansionException.class, () ->
            g.generate(new TestGrammars.ScriptedExpander()));
    }

    @Test
    void foreignSlotIsRejected() {
        Grammar<StringValue, String> g = new AnBnCnLanguage().buildGrammar();
        ScriptedExpander bad = new ScriptedExpander() {
            public Slot<StringValue, String> chooseLhsAndSlot(
                    Grammar<StringValue, String> grammar,
                    ProgramInstance<StringValue, String> context,
                    java.util.List<Candidate<StringValue, String>> cands) {
                return new Slot<StringValue, String>(
                    cands.get(0).getLhs(), 42);
            }
        };
        assertThrows(IllegalStateException.class, () -> g.generate(bad));
    }

}
