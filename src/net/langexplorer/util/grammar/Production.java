package net.langexplorer.util.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.langexplorer.api.grammar.BinarySerializable;

/**
 * All alternative rules for one left-hand side.
 */
public class Production<T extends BinarySerializable, I> {

    private final LeftHandSide<T, I> lhs;
    private final List<ProductionRule<T, I>> rules;

    public Production(LeftHandSide<T, I> lhs,
                      List<ProductionRule<T, I>> rules) {
        if (lhs == null)
            throw new NullPointerException(
                "Production left-hand side may not be null");
        if (rules == null)
            throw new NullPointerException(
                "Production rules may not be null");
        this.lhs = lhs;
        this.rules = Collections.unmodifiableList(
            new ArrayList<ProductionRule<T, I>>(rules));
    }

    public String toString() {
        return String.format("%s@%h[lhs=%s,rules=%s]",
            getClass().getName(), this, getLhs(), getRules());
    }

    /**
     * The right-hand side in BNF form, e.g. 'a' <S> 'b' | 'ε'.
     */
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        for (ProductionRule<T, I> r : rules) {
            if (sb.length() != 0) sb.append(" | ");
            sb.append(r.toDisplayString());
        }
        return sb.toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof Production)) return false;
        Production<?, ?> po = (Production<?, ?>) other;
        return (getLhs().equals(po.getLhs()) &&
                getRules().equals(po.getRules()));
    }

    public int hashCode() {
        return getLhs().hashCode() ^ getRules().hashCode();
    }

    public LeftHandSide<T, I> getLhs() {
        return lhs;
    }

    public List<ProductionRule<T, I>> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public ProductionRule<T, I> get(int index) {
        return rules.get(index);
    }

    /**
     * Convenience factory for context-free productions.
     */
    @SafeVarargs
    public static <T extends BinarySerializable, I> Production<T, I>
            contextFree(I nonterminal, ProductionRule<T, I>... rules) {
        return new Production<T, I>(
            LeftHandSide.<T, I>contextFree(nonterminal),
            Arrays.asList(rules));
    }

    @SafeVarargs
    public static <T extends BinarySerializable, I> Production<T, I> of(
            LeftHandSide<T, I> lhs, ProductionRule<T, I>... rules) {
        return new Production<T, I>(lhs, Arrays.asList(rules));
    }

}
