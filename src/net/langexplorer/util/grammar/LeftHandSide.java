package net.langexplorer.util.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.langexplorer.api.grammar.BinarySerializable;

/**
 * The left-hand side of a production: a non-terminal, optionally
 * surrounded by prefix and suffix context that must be present in the
 * sentential form for the production to apply.
 * With empty prefix and suffix, this is a plain context-free left-hand
 * side.
 */
public class LeftHandSide<T extends BinarySerializable, I>
        implements Comparable<LeftHandSide<T, I>> {

    private enum State { START, IN_PREFIX, MIDDLE, IN_SUFFIX }

    private final List<Symbol<T, I>> prefix;
    private final Nonterminal<T, I> nonterminal;
    private final List<Symbol<T, I>> suffix;

    public LeftHandSide(List<? extends Symbol<T, I>> prefix, I nonterminal,
                        List<? extends Symbol<T, I>> suffix) {
        if (prefix == null)
            throw new NullPointerException(
                "LeftHandSide prefix may not be null");
        if (suffix == null)
            throw new NullPointerException(
                "LeftHandSide suffix may not be null");
        this.prefix = Collections.unmodifiableList(
            new ArrayList<Symbol<T, I>>(prefix));
        this.nonterminal = new Nonterminal<T, I>(nonterminal);
        this.suffix = Collections.unmodifiableList(
            new ArrayList<Symbol<T, I>>(suffix));
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (! prefix.isEmpty()) sb.append(prefix);
        sb.append(nonterminal);
        if (! suffix.isEmpty()) sb.append(suffix);
        return sb.toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof LeftHandSide)) return false;
        LeftHandSide<?, ?> lo = (LeftHandSide<?, ?>) other;
        return (getNonterminal().equals(lo.getNonterminal()) &&
                getPrefix().equals(lo.getPrefix()) &&
                getSuffix().equals(lo.getSuffix()));
    }

    public int hashCode() {
        return (prefix.hashCode() * 31 + nonterminal.hashCode()) * 31 +
            suffix.hashCode();
    }

    /**
     * Order left-hand sides by hash code.
     * The order is only meant to be stable for use as a table key and does
     * not carry any meaning.
     */
    public int compareTo(LeftHandSide<T, I> other) {
        int res = Integer.compare(hashCode(), other.hashCode());
        if (res != 0) return res;
        return toString().compareTo(other.toString());
    }

    public List<Symbol<T, I>> getPrefix() {
        return prefix;
    }

    public Nonterminal<T, I> getNonterminal() {
        return nonterminal;
    }

    public I getReference() {
        return nonterminal.getReference();
    }

    public List<Symbol<T, I>> getSuffix() {
        return suffix;
    }

    public boolean isContextSensitive() {
        return (! prefix.isEmpty() || ! suffix.isEmpty());
    }

    /**
     * All symbols of this left-hand side, i.e. the prefix, the
     * non-terminal, and the suffix, in order.
     */
    public List<Symbol<T, I>> getAllTokens() {
        List<Symbol<T, I>> ret = new ArrayList<Symbol<T, I>>(
            prefix.size() + suffix.size() + 1);
        ret.addAll(prefix);
        ret.add(nonterminal);
        ret.addAll(suffix);
        return ret;
    }

    /**
     * Locate the first occurrence of this left-hand side in sequence.
     * Returns the index of the non-terminal of the first occurrence that is
     * directly preceded by the whole prefix and directly followed by the
     * whole suffix, or null if there is none.
     */
    public Integer checkForContext(List<? extends Symbol<T, I>> sequence) {
        return checkForContext(sequence, 0);
    }

    /**
     * Locate the first occurrence of this left-hand side in sequence whose
     * window starts at or after from.
     * This is a naive scan: after a mismatch, only the offending symbol is
     * considered again as a potential start of a new match.
     */
    public Integer checkForContext(List<? extends Symbol<T, I>> sequence,
                                   int from) {
        State state = State.START;
        int count = 0;
        int middle = -1;
        int idx = from;
        while (idx < sequence.size()) {
            Symbol<T, I> sym = sequence.get(idx);
            boolean retry = false;
            switch (state) {
                case START:
                    if (! prefix.isEmpty()) {
                        if (sym.equals(prefix.get(0))) {
                            state = State.IN_PREFIX;
                            count = 1;
                        }
                    } else if (sym.equals(nonterminal)) {
                        if (suffix.isEmpty()) return idx;
                        state = State.MIDDLE;
                        middle = idx;
                    }
                    break;
                case IN_PREFIX:
                    if (count == prefix.size()) {
                        if (sym.equals(nonterminal)) {
                            if (suffix.isEmpty()) return idx;
                            state = State.MIDDLE;
                            middle = idx;
                        } else {
                            retry = true;
                        }
                    } else if (sym.equals(prefix.get(count))) {
                        count++;
                    } else {
                        retry = true;
                    }
                    break;
                case MIDDLE:
                    if (sym.equals(suffix.get(0))) {
                        if (suffix.size() == 1) return middle;
                        state = State.IN_SUFFIX;
                        count = 1;
                    } else {
                        retry = true;
                    }
                    break;
                case IN_SUFFIX:
                    if (sym.equals(suffix.get(count))) {
                        count++;
                        if (count == suffix.size()) return middle;
                    } else {
                        retry = true;
                    }
                    break;
            }
            if (retry) {
                // Start over, but give the current symbol another chance.
                state = State.START;
                continue;
            }
            idx++;
        }
        return null;
    }

    /**
     * Locate all occurrences of this left-hand side in sequence.
     * The scan of checkForContext() is repeated, each time starting right
     * after the non-terminal of the previous match; the indices of the
     * non-terminals are returned in ascending order.
     */
    public List<Integer> getAllContextInstances(
            List<? extends Symbol<T, I>> sequence) {
        List<Integer> ret = new ArrayList<Integer>();
        int from = 0;
        for (;;) {
            Integer idx = checkForContext(sequence, from);
            if (idx == null) break;
            ret.add(idx);
            from = idx + 1;
        }
        return ret;
    }

    public static <T extends BinarySerializable, I> LeftHandSide<T, I>
            contextFree(I nonterminal) {
        return new LeftHandSide<T, I>(
            Collections.<Symbol<T, I>>emptyList(), nonterminal,
            Collections.<Symbol<T, I>>emptyList());
    }

    public static <T extends BinarySerializable, I> LeftHandSide<T, I>
            withPrefix(List<? extends Symbol<T, I>> prefix, I nonterminal) {
        return new LeftHandSide<T, I>(prefix, nonterminal,
            Collections.<Symbol<T, I>>emptyList());
    }

    public static <T extends BinarySerializable, I> LeftHandSide<T, I>
            withSuffix(I nonterminal, List<? extends Symbol<T, I>> suffix) {
        return new LeftHandSide<T, I>(
            Collections.<Symbol<T, I>>emptyList(), nonterminal, suffix);
    }

}
