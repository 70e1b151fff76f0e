package net.langexplorer.expanders;

import java.util.List;
import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.util.grammar.Grammar;
import net.langexplorer.util.grammar.Production;
import net.langexplorer.util.grammar.ProgramInstance;

/**
 * An external scoring model consulted by LearnedExpander.
 * Higher scores mean more preferable choices; scores need not be
 * normalized.
 */
public interface ExpansionPolicy<T extends BinarySerializable, I> {

    /**
     * A record of one decision taken during the generation of a program.
     */
    final class Decision {

        private final double[] probabilities;
        private final int chosen;

        public Decision(double[] probabilities, int chosen) {
            this.probabilities = probabilities.clone();
            this.chosen = chosen;
        }

        public double[] getProbabilities() {
            return probabilities.clone();
        }

        public int getChosen() {
            return chosen;
        }

    }

    /**
     * One score per rule of production.
     */
    double[] scoreRules(Grammar<T, I> grammar, ProgramInstance<T, I> context,
                        Production<T, I> production);

    /**
     * One score per slot, in order.
     */
    double[] scoreSlots(Grammar<T, I> grammar, ProgramInstance<T, I> context,
                        List<Expander.Slot<T, I>> slots);

    /**
     * Learn from the decisions that produced program.
     */
    void update(ProgramInstance<T, I> program, List<Decision> decisions);

}
