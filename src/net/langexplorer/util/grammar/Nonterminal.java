package net.langexplorer.util.grammar;

import net.langexplorer.api.grammar.BinarySerializable;

public class Nonterminal<T extends BinarySerializable, I>
        extends Symbol<T, I> {

    private static final byte[] NO_BYTES = new byte[0];

    private final I reference;

    public Nonterminal(I reference) {
        if (reference == null)
            throw new NullPointerException(
                "Nonterminal reference may not be null");
        this.reference = reference;
    }

    protected String toStringBase() {
        return reference.toString();
    }

    protected boolean matches(Symbol<?, ?> other) {
        return ((other instanceof Nonterminal) &&
            reference.equals(((Nonterminal<?, ?>) other).getReference()));
    }

    protected int hashCodeBase() {
        return reference.hashCode();
    }

    public Kind getKind() {
        return Kind.NONTERMINAL;
    }

    public String toDisplayString() {
        return "<" + toStringBase() + ">";
    }

    public byte[] serialize() {
        return NO_BYTES;
    }

    public I getReference() {
        return reference;
    }

}
