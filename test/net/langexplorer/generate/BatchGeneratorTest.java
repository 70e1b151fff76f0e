package net.langexplorer.generate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import net.langexplorer.api.grammar.UnknownNonterminalException;
import net.langexplorer.expanders.Expander;
import net.langexplorer.expanders.ExpanderFactory;
import net.langexplorer.expanders.ExpanderType;
import net.langexplorer.expanders.ExpansionPolicy;
import net.langexplorer.languages.AnBnCnLanguage;
import net.langexplorer.languages.StringValue;
import net.langexplorer.languages.ToyLanguage;
import net.langexplorer.util.grammar.Grammar;
import net.langexplorer.util.grammar.LeftHandSide;
import net.langexplorer.util.grammar.Production;
import net.langexplorer.util.grammar.ProductionRule;
import net.langexplorer.util.grammar.ProgramInstance;
import net.langexplorer.util.grammar.Symbol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static net.langexplorer.TestGrammars.*;
import static org.junit.jupiter.api.Assertions.*;

public class BatchGeneratorTest {

    private static final Logger LOGGER = Logger.getLogger("BatchGenerator");

    private final List<LogRecord> records = new ArrayList<>();
    private final Handler capture = new Handler() {
        public void publish(LogRecord record) {
            synchronized (records) {
                records.add(record);
            }
        }
        public void flush() {}
        public void close() {}
    };

    @BeforeEach
    void attach() {
        LOGGER.addHandler(capture);
    }

    @AfterEach
    void detach() {
        LOGGER.removeHandler(capture);
    }

    private boolean logged(Level level, String fragment) {
        synchronized (records) {
            for (LogRecord r : records) {
                if (r.getLevel().equals(level) &&
                        r.getMessage().contains(fragment))
                    return true;
            }
        }
        return false;
    }

    private static List<String> texts(GenerationOutput out) {
        List<String> ret = new ArrayList<>();
        for (ProgramResult r : out.getCompletePrograms()) {
            ret.add(r.getProgram());
        }
        return ret;
    }

    @Test
    void singleWorkerYieldsDistinctPrograms() throws Exception {
        GenerationConfig cfg = new GenerationConfig().setCount(20)
            .setWorkers(1).setSeed(3);
        GenerationOutput out = BatchGenerator.generate(arithmetic(),
            ExpanderType.UNIFORM.<StringValue, String>factory(), cfg);
        List<String> progs = texts(out);
        assertEquals(20, progs.size());
        assertEquals(20, new HashSet<String>(progs).size());
        assertEquals(20, out.getPrograms().size());
        assertNull(out.getGrammar());
        assertTrue(out.getGrammarName().startsWith("test_"));
    }

    @Test
    void sameSeedSameBatch() throws Exception {
        GenerationConfig cfg = new GenerationConfig().setCount(10)
            .setWorkers(1).setSeed(11);
        ExpanderFactory<StringValue, String> f =
            ExpanderType.WEIGHTED.factory();
        assertEquals(texts(BatchGenerator.generate(arithmetic(), f, cfg)),
                     texts(BatchGenerator.generate(arithmetic(), f, cfg)));
    }

    @Test
    void sharesAddUpToCount() throws Exception {
        assertEquals(8, BatchGenerator.shareOf(30, 4, 0));
        assertEquals(8, BatchGenerator.shareOf(30, 4, 1));
        assertEquals(7, BatchGenerator.shareOf(30, 4, 2));
        assertEquals(7, BatchGenerator.shareOf(30, 4, 3));
        assertEquals(0, BatchGenerator.shareOf(2, 4, 3));
        GenerationConfig cfg = new GenerationConfig().setCount(30)
            .setWorkers(4);
        GenerationOutput out = BatchGenerator.generate(arithmetic(),
            ExpanderType.UNIFORM.<StringValue, String>factory(), cfg);
        assertEquals(30, out.getPrograms().size());
    }

    @Test
    void workersGetStridedSeeds() throws Exception {
        final List<Long> seeds = new ArrayList<>();
        ExpanderFactory<StringValue, String> f =
            new ExpanderFactory<StringValue, String>() {
                public Expander<StringValue, String> create(
                        Grammar<StringValue, String> grammar, long seed) {
                    seeds.add(seed);
                    return ExpanderType.UNIFORM.create(seed);
                }
            };
        BatchGenerator.generate(arithmetic(), f, new GenerationConfig()
            .setCount(3).setWorkers(3).setSeed(100));
        assertEquals(Arrays.asList(100L, 105L, 110L), seeds);
    }

    @Test
    void emptyBatch() throws Exception {
        GenerationOutput out = BatchGenerator.generate(arithmetic(),
            ExpanderType.UNIFORM.<StringValue, String>factory(),
            new GenerationConfig().setCount(0).setWorkers(3));
        assertTrue(out.getPrograms().isEmpty());
    }

    @Test
    void invalidGrammarAbortsBatch() {
        Grammar<StringValue, String> g = grammar("E",
            Production.contextFree("E", ProductionRule.of(A, nt("Q"))));
        assertThrows(UnknownNonterminalException.class, () ->
            BatchGenerator.generate(g,
                ExpanderType.UNIFORM.<StringValue, String>factory(),
                new GenerationConfig().setCount(10).setWorkers(2)));
    }

    @Test
    void stuckDerivationsAreSkipped() throws Exception {
        // S -> 'a' X | 'b' ; X only rewrites after a 'b'
        Grammar<StringValue, String> g = grammar("S",
            Production.contextFree("S",
                ProductionRule.of(A, nt("X")), ProductionRule.of(B)),
            Production.of(LeftHandSide.withPrefix(Arrays.asList(B), "X"),
                ProductionRule.of(C)));
        final List<ScriptedExpander> expanders = new ArrayList<>();
        ExpanderFactory<StringValue, String> f =
            new ExpanderFactory<StringValue, String>() {
                public Expander<StringValue, String> create(
                        Grammar<StringValue, String> grammar, long seed) {
                    ScriptedExpander ret = new ScriptedExpander(0, 1);
                    expanders.add(ret);
                    return ret;
                }
            };
        GenerationOutput out = BatchGenerator.generate(g, f,
            new GenerationConfig().setCount(1).setWorkers(1));
        assertEquals(Arrays.asList("b"), texts(out));
        assertTrue(logged(Level.WARNING, "stuck derivation"));
        assertEquals(1, expanders.get(0).getAbandons());
        assertEquals(1, expanders.get(0).getCleanups());
    }

    /* Uniform scores; checks every update against the program it names. */
    private static class CountingPolicy
            implements ExpansionPolicy<StringValue, String> {

        final List<String> mismatches = new ArrayList<>();
        int updates;

        public double[] scoreRules(Grammar<StringValue, String> grammar,
                                   ProgramInstance<StringValue, String> ctx,
                                   Production<StringValue, String> prod) {
            return new double[prod.size()];
        }

        public double[] scoreSlots(Grammar<StringValue, String> grammar,
                                   ProgramInstance<StringValue, String> ctx,
                                   List<Expander.Slot<StringValue, String>> s) {
            return new double[s.size()];
        }

        public synchronized void update(
                ProgramInstance<StringValue, String> program,
                List<Decision> decisions) {
            updates++;
            int expansions = 0;
            for (ProgramInstance<StringValue, String> n :
                    program.getAllNodes()) {
                if (n.getNode().getKind() == Symbol.Kind.NONTERMINAL)
                    expansions++;
            }
            // one slot and one rule decision per expanded non-terminal
            if (decisions.size() != 2 * expansions)
                mismatches.add(decisions.size() + " decisions for " +
                               program);
        }

    }

    @Test
    void learnedUpdatesSeeOnlyTheirOwnDecisions() throws Exception {
        CountingPolicy policy = new CountingPolicy();
        BatchGenerator.generate(new AnBnCnLanguage().buildGrammar(),
            ExpanderType.LEARNED.factory(policy),
            new GenerationConfig().setCount(20).setWorkers(1).setSeed(3)
                .setMaxAttempts(500));
        assertTrue(policy.updates > 0);
        assertTrue(logged(Level.WARNING, "stuck derivation"));
        assertEquals(Collections.<String>emptyList(), policy.mismatches);
    }

    @Test
    void attemptLimitStopsExhaustedGrammars() throws Exception {
        Grammar<StringValue, String> g = grammar("S",
            Production.contextFree("S",
                ProductionRule.of(A), ProductionRule.of(B)));
        GenerationOutput out = BatchGenerator.generate(g,
            ExpanderType.UNIFORM.<StringValue, String>factory(),
            new GenerationConfig().setCount(5).setWorkers(1)
                .setMaxAttempts(50));
        assertEquals(new HashSet<String>(Arrays.asList("a", "b")),
                     new HashSet<String>(texts(out)));
        assertTrue(logged(Level.WARNING, "gave up"));
        assertTrue(logged(Level.INFO, "Generating 5 programs"));
    }

    @Test
    void partialsAreReported() throws Exception {
        GenerationConfig cfg = new GenerationConfig().setCount(3)
            .setWorkers(1).setReturnPartials(true).setReturnGrammar(true);
        GenerationOutput out = BatchGenerator.generate(
            new ToyLanguage().buildGrammar(),
            ExpanderType.UNIFORM.<StringValue, String>factory(), cfg);
        assertEquals(3, out.getCompletePrograms().size());
        assertTrue(out.getPrograms().size() > 3);
        List<String> partials = new ArrayList<>();
        for (ProgramResult r : out.getPrograms()) {
            if (r.isPartial()) partials.add(r.getProgram());
        }
        assertEquals(new HashSet<String>(partials).size(), partials.size());
        assertTrue(partials.contains("ε"));
        assertEquals(new ToyLanguage().buildGrammar().toBNF(),
                     out.getGrammar());
    }

}
