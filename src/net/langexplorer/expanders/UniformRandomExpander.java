package net.langexplorer.expanders;

import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.util.grammar.Grammar;
import net.langexplorer.util.grammar.Production;
import net.langexplorer.util.grammar.ProductionRule;
import net.langexplorer.util.grammar.ProgramInstance;

/**
 * Monte Carlo expansion: every rule is equally likely.
 */
public class UniformRandomExpander<T extends BinarySerializable, I>
        extends RandomExpander<T, I> {

    public UniformRandomExpander(long seed) {
        super(seed);
    }

    public ProductionRule<T, I> chooseRule(Grammar<T, I> grammar,
                                           ProgramInstance<T, I> context,
                                           Production<T, I> production) {
        checkNonEmpty(production);
        return production.get(getRandom().nextInt(production.size()));
    }

}
