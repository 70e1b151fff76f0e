package net.langexplorer.expanders;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.util.grammar.Grammar;
import net.langexplorer.util.grammar.LeftHandSide;
import net.langexplorer.util.grammar.Production;
import net.langexplorer.util.grammar.ProductionRule;
import net.langexplorer.util.grammar.ProgramInstance;

/**
 * A decision policy steering program generation.
 * Expanders are not required to be thread-safe; every generating thread
 * uses its own instance.
 */
public interface Expander<T extends BinarySerializable, I> {

    /**
     * A left-hand side together with every frontier index it matches at.
     */
    final class Candidate<T extends BinarySerializable, I> {

        private final LeftHandSide<T, I> lhs;
        private final List<Integer> indices;

        public Candidate(LeftHandSide<T, I> lhs, List<Integer> indices) {
            if (lhs == null)
                throw new NullPointerException(
                    "Candidate left-hand side may not be null");
            if (indices == null || indices.isEmpty())
                throw new IllegalArgumentException(
                    "Candidate must have at least one index");
            this.lhs = lhs;
            this.indices = Collections.unmodifiableList(
                new ArrayList<Integer>(indices));
        }

        public String toString() {
            return String.format("%s@%h[lhs=%s,indices=%s]",
                getClass().getName(), this, getLhs(), getIndices());
        }

        public LeftHandSide<T, I> getLhs() {
            return lhs;
        }

        public List<Integer> getIndices() {
            return indices;
        }

    }

    /**
     * The outcome of a frontier decision: which left-hand side to rewrite,
     * and at which frontier index its non-terminal sits.
     */
    final class Slot<T extends BinarySerializable, I> {

        private final LeftHandSide<T, I> lhs;
        private final int index;

        public Slot(LeftHandSide<T, I> lhs, int index) {
            if (lhs == null)
                throw new NullPointerException(
                    "Slot left-hand side may not be null");
            this.lhs = lhs;
            this.index = index;
        }

        public String toString() {
            return String.format("%s@%h[lhs=%s,index=%s]",
                getClass().getName(), this, getLhs(), getIndex());
        }

        public LeftHandSide<T, I> getLhs() {
            return lhs;
        }

        public int getIndex() {
            return index;
        }

    }

    /**
     * Pick one of production's rules for expanding context.
     */
    ProductionRule<T, I> chooseRule(Grammar<T, I> grammar,
                                    ProgramInstance<T, I> context,
                                    Production<T, I> production);

    /**
     * Pick a left-hand side and one of its matching frontier indices.
     * candidates is never empty; context is the root of the tree under
     * construction.
     */
    Slot<T, I> chooseLhsAndSlot(Grammar<T, I> grammar,
                                ProgramInstance<T, I> context,
                                List<Candidate<T, I>> candidates);

    /**
     * Called once after every completed program.
     */
    void cleanup();

    /**
     * Called instead of cleanup() when an attempt ended without a program.
     * Any state gathered during the attempt must be discarded.
     */
    void abandon();

}
