package net.langexplorer.util.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.langexplorer.api.grammar.BinarySerializable;

/**
 * One alternative of a Production: an ordered list of symbols, optionally
 * weighted.
 * A weight of null or zero marks the rule as unweighted; weighted
 * expanders substitute a per-production default for such rules.
 */
public class ProductionRule<T extends BinarySerializable, I> {

    private final List<Symbol<T, I>> symbols;
    private final Long weight;

    public ProductionRule(List<? extends Symbol<T, I>> symbols, Long weight) {
        if (symbols == null)
            throw new NullPointerException(
                "ProductionRule symbols may not be null");
        if (weight != null && weight < 0)
            throw new IllegalArgumentException(
                "ProductionRule weight may not be negative");
        this.symbols = Collections.unmodifiableList(
            new ArrayList<Symbol<T, I>>(symbols));
        this.weight = weight;
    }
    public ProductionRule(List<? extends Symbol<T, I>> symbols) {
        this(symbols, null);
    }

    /* Debug form: the symbols' debug forms, concatenated. */
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Symbol<T, I> s : symbols) sb.append(s);
        return sb.toString();
    }

    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        for (Symbol<T, I> s : symbols) {
            if (sb.length() != 0) sb.append(' ');
            sb.append(s.toDisplayString());
        }
        return sb.toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof ProductionRule)) return false;
        ProductionRule<?, ?> ro = (ProductionRule<?, ?>) other;
        return (getSymbols().equals(ro.getSymbols()) &&
                (weight == null ? ro.getWeight() == null :
                                  weight.equals(ro.getWeight())));
    }

    public int hashCode() {
        return symbols.hashCode() ^ (weight == null ? 0 : weight.hashCode());
    }

    public List<Symbol<T, I>> getSymbols() {
        return symbols;
    }

    public int size() {
        return symbols.size();
    }

    public Long getWeight() {
        return weight;
    }

    public boolean hasWeight() {
        return (weight != null && weight > 0);
    }

    @SafeVarargs
    public static <T extends BinarySerializable, I> ProductionRule<T, I> of(
            Symbol<T, I>... symbols) {
        return new ProductionRule<T, I>(Arrays.asList(symbols));
    }

    @SafeVarargs
    public static <T extends BinarySerializable, I> ProductionRule<T, I>
            weighted(long weight, Symbol<T, I>... symbols) {
        return new ProductionRule<T, I>(Arrays.asList(symbols), weight);
    }

}
