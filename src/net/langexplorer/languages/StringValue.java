package net.langexplorer.languages;

import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.util.Encodings;

/**
 * A terminal value consisting of literal text.
 */
public final class StringValue implements BinarySerializable {

    private final String value;

    public StringValue(String value) {
        if (value == null)
            throw new NullPointerException("StringValue may not be null");
        this.value = value;
    }

    public String toString() {
        return value;
    }

    public boolean equals(Object other) {
        return (other instanceof StringValue &&
                value.equals(((StringValue) other).value));
    }

    public int hashCode() {
        return value.hashCode();
    }

    public String getValue() {
        return value;
    }

    public byte[] serialize() {
        return Encodings.toBytes(value);
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }

}
