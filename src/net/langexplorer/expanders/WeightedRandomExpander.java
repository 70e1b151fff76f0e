package net.langexplorer.expanders;

import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.util.grammar.Grammar;
import net.langexplorer.util.grammar.Production;
import net.langexplorer.util.grammar.ProductionRule;
import net.langexplorer.util.grammar.ProgramInstance;

/**
 * Weighted Monte Carlo expansion: rules are drawn proportionally to their
 * weights.
 * Unweighted rules take the integer average of the production's explicit
 * weights, or 1 if the production has none.
 */
public class WeightedRandomExpander<T extends BinarySerializable, I>
        extends RandomExpander<T, I> {

    public WeightedRandomExpander(long seed) {
        super(seed);
    }

    public ProductionRule<T, I> chooseRule(Grammar<T, I> grammar,
                                           ProgramInstance<T, I> context,
                                           Production<T, I> production) {
        checkNonEmpty(production);
        double[] dist = distribution(production);
        double u = getRandom().nextDouble();
        double cumsum = 0;
        for (int i = 0; i < dist.length; i++) {
            cumsum += dist[i];
            if (u <= cumsum) return production.get(i);
        }
        return production.get(production.size() - 1);
    }

    public static long[] effectiveWeights(Production<?, ?> production) {
        long sum = 0;
        int count = 0;
        for (ProductionRule<?, ?> r : production.getRules()) {
            if (! r.hasWeight()) continue;
            sum += r.getWeight();
            count++;
        }
        long avg = (count == 0) ? 1 : Math.max(1, sum / count);
        long[] ret = new long[production.size()];
        for (int i = 0; i < ret.length; i++) {
            ProductionRule<?, ?> r = production.get(i);
            ret[i] = r.hasWeight() ? r.getWeight() : avg;
        }
        return ret;
    }

    public static double[] distribution(Production<?, ?> production) {
        long[] weights = effectiveWeights(production);
        double total = 0;
        for (long w : weights) total += w;
        double[] ret = new double[weights.length];
        for (int i = 0; i < ret.length; i++) ret[i] = weights[i] / total;
        return ret;
    }

}
