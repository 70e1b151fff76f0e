package net.langexplorer.util.grammar;

import net.langexplorer.api.grammar.BinarySerializable;

public class Terminal<T extends BinarySerializable, I> extends Symbol<T, I> {

    private final T value;

    public Terminal(T value) {
        if (value == null)
            throw new NullPointerException("Terminal value may not be null");
        this.value = value;
    }

    protected String toStringBase() {
        return value.toString();
    }

    protected boolean matches(Symbol<?, ?> other) {
        return ((other instanceof Terminal) &&
                value.equals(((Terminal<?, ?>) other).getValue()));
    }

    protected int hashCodeBase() {
        return value.hashCode();
    }

    public Kind getKind() {
        return Kind.TERMINAL;
    }

    public String toDisplayString() {
        return "'" + toStringBase() + "'";
    }

    public byte[] serialize() {
        return value.serialize();
    }

    public T getValue() {
        return value;
    }

}
