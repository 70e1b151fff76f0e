package net.langexplorer.expanders;

import java.util.List;
import java.util.Random;
import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.util.grammar.Grammar;
import net.langexplorer.util.grammar.Production;
import net.langexplorer.util.grammar.ProgramInstance;

/**
 * Common base of the seeded random expanders.
 * Frontier slots are chosen uniformly: first a candidate, then one of its
 * indices.
 */
public abstract class RandomExpander<T extends BinarySerializable, I>
        implements Expander<T, I> {

    private final long seed;
    private final Random random;

    protected RandomExpander(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public String toString() {
        return String.format("%s@%h[seed=%s]", getClass().getName(), this,
                             getSeed());
    }

    public long getSeed() {
        return seed;
    }

    protected Random getRandom() {
        return random;
    }

    protected static void checkNonEmpty(Production<?, ?> production) {
        if (production.size() == 0)
            throw new IllegalArgumentException("Production " +
                production.getLhs() + " has no rules");
    }

    public Slot<T, I> chooseLhsAndSlot(Grammar<T, I> grammar,
                                       ProgramInstance<T, I> context,
                                       List<Candidate<T, I>> candidates) {
        if (candidates.isEmpty())
            throw new IllegalArgumentException("No candidates to choose from");
        Candidate<T, I> c = candidates.get(random.nextInt(candidates.size()));
        List<Integer> indices = c.getIndices();
        return new Slot<T, I>(c.getLhs(),
                              indices.get(random.nextInt(indices.size())));
    }

    public void cleanup() {}

    public void abandon() {}

}
