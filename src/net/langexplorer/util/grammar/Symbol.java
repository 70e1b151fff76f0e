package net.langexplorer.util.grammar;

import java.nio.charset.StandardCharsets;
import net.langexplorer.api.grammar.BinarySerializable;

/**
 * An atomic element of a grammar: a terminal, a non-terminal, or epsilon.
 * Symbols are immutable and compared by kind and payload.
 */
public abstract class Symbol<T extends BinarySerializable, I> {

    public enum Kind { TERMINAL, NONTERMINAL, EPSILON }

    protected Symbol() {}

    /* Debug form; used for canonical program strings and digests. */
    public String toString() {
        return toStringBase();
    }

    public boolean equals(Object other) {
        if (! (other instanceof Symbol)) return false;
        Symbol<?, ?> so = (Symbol<?, ?>) other;
        return (getKind() == so.getKind() && matches(so) && so.matches(this));
    }

    public int hashCode() {
        return hashCodeBase() ^ getKind().hashCode();
    }

    protected abstract String toStringBase();

    protected abstract boolean matches(Symbol<?, ?> other);

    protected abstract int hashCodeBase();

    public abstract Kind getKind();

    /**
     * The form used in BNF renderings: 'x' for terminals, <x> for
     * non-terminals.
     */
    public abstract String toDisplayString();

    /**
     * The bytes this symbol contributes to a finished program.
     * Non-terminals contribute nothing by themselves.
     */
    public abstract byte[] serialize();

    /**
     * The bytes identifying this symbol as a tree node label.
     */
    public byte[] labelBytes() {
        return toStringBase().getBytes(StandardCharsets.UTF_8);
    }

    public boolean isTerminal() {
        return getKind() == Kind.TERMINAL;
    }
    public boolean isNonterminal() {
        return getKind() == Kind.NONTERMINAL;
    }
    public boolean isEpsilon() {
        return getKind() == Kind.EPSILON;
    }

    public static <T extends BinarySerializable, I> Terminal<T, I> terminal(
            T value) {
        return new Terminal<T, I>(value);
    }
    public static <T extends BinarySerializable, I> Nonterminal<T, I>
            nonterminal(I reference) {
        return new Nonterminal<T, I>(reference);
    }
    public static <T extends BinarySerializable, I> Epsilon<T, I> epsilon() {
        return Epsilon.instance();
    }

}
