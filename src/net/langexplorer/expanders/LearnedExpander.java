package net.langexplorer.expanders;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.util.grammar.Grammar;
import net.langexplorer.util.grammar.Production;
import net.langexplorer.util.grammar.ProductionRule;
import net.langexplorer.util.grammar.ProgramInstance;

/**
 * An expander delegating its decisions to an ExpansionPolicy.
 * The decisions of every program are recorded and handed to the policy
 * on cleanup().
 */
public class LearnedExpander<T extends BinarySerializable, I>
        implements Expander<T, I> {

    private final ExpansionPolicy<T, I> policy;
    private final NormalizationStrategy normalization;
    private final SamplingStrategy sampling;
    private final Random random;
    private final List<ExpansionPolicy.Decision> decisions;
    private ProgramInstance<T, I> lastRoot;

    public LearnedExpander(ExpansionPolicy<T, I> policy,
                           NormalizationStrategy normalization,
                           SamplingStrategy sampling, long seed) {
        if (policy == null)
            throw new NullPointerException(
                "LearnedExpander policy may not be null");
        if (normalization == null || sampling == null)
            throw new NullPointerException(
                "LearnedExpander strategies may not be null");
        this.policy = policy;
        this.normalization = normalization;
        this.sampling = sampling;
        this.random = new Random(seed);
        this.decisions = new ArrayList<ExpansionPolicy.Decision>();
    }
    public LearnedExpander(ExpansionPolicy<T, I> policy, long seed) {
        this(policy, NormalizationStrategy.SOFTMAX, SamplingStrategy.SAMPLE,
             seed);
    }

    public String toString() {
        return String.format("%s@%h[policy=%s,normalization=%s,sampling=%s]",
            getClass().getName(), this, getPolicy(), getNormalization(),
            getSampling());
    }

    public ExpansionPolicy<T, I> getPolicy() {
        return policy;
    }

    public NormalizationStrategy getNormalization() {
        return normalization;
    }

    public SamplingStrategy getSampling() {
        return sampling;
    }

    public int getPendingDecisionCount() {
        return decisions.size();
    }

    private int decide(double[] scores, int expected) {
        if (scores == null || scores.length != expected)
            throw new IllegalStateException("Policy returned " +
                (scores == null ? "no" : String.valueOf(scores.length)) +
                " scores for " + expected + " choices");
        double[] normalized = normalization.normalize(scores);
        int ret = sampling.choose(normalized, normalization, random);
        decisions.add(new ExpansionPolicy.Decision(
            normalization.toProbabilities(normalized), ret));
        return ret;
    }

    public ProductionRule<T, I> chooseRule(Grammar<T, I> grammar,
                                           ProgramInstance<T, I> context,
                                           Production<T, I> production) {
        RandomExpander.checkNonEmpty(production);
        if (context.getParentId() == null) lastRoot = context;
        double[] scores = policy.scoreRules(grammar, context, production);
        return production.get(decide(scores, production.size()));
    }

    public Slot<T, I> chooseLhsAndSlot(Grammar<T, I> grammar,
                                       ProgramInstance<T, I> context,
                                       List<Candidate<T, I>> candidates) {
        lastRoot = context;
        List<Slot<T, I>> slots = new ArrayList<Slot<T, I>>();
        for (Candidate<T, I> c : candidates) {
            for (Integer idx : c.getIndices()) {
                slots.add(new Slot<T, I>(c.getLhs(), idx));
            }
        }
        if (slots.isEmpty())
            throw new IllegalArgumentException("No candidates to choose from");
        double[] scores = policy.scoreSlots(grammar, context, slots);
        return slots.get(decide(scores, slots.size()));
    }

    public void cleanup() {
        List<ExpansionPolicy.Decision> done =
            new ArrayList<ExpansionPolicy.Decision>(decisions);
        decisions.clear();
        ProgramInstance<T, I> root = lastRoot;
        lastRoot = null;
        policy.update(root, done);
    }

    public void abandon() {
        decisions.clear();
        lastRoot = null;
    }

}
