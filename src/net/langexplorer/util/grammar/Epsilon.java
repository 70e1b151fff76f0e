package net.langexplorer.util.grammar;

import java.nio.charset.StandardCharsets;
import net.langexplorer.api.grammar.BinarySerializable;

/**
 * The empty symbol. All instances are equal; use Symbol.epsilon().
 */
public final class Epsilon<T extends BinarySerializable, I>
        extends Symbol<T, I> {

    private static final Epsilon<?, ?> INSTANCE =
        new Epsilon<BinarySerializable, Object>();

    private static final byte[] NO_BYTES = new byte[0];
    private static final byte[] LABEL =
        "epsilon".getBytes(StandardCharsets.UTF_8);

    private Epsilon() {}

    protected String toStringBase() {
        return "ε";
    }

    protected boolean matches(Symbol<?, ?> other) {
        return (other instanceof Epsilon);
    }

    protected int hashCodeBase() {
        return 0x45505331;
    }

    public Kind getKind() {
        return Kind.EPSILON;
    }

    public String toDisplayString() {
        return "'" + toStringBase() + "'";
    }

    public byte[] serialize() {
        return NO_BYTES;
    }

    public byte[] labelBytes() {
        return LABEL.clone();
    }

    @SuppressWarnings("unchecked")
    public static <T extends BinarySerializable, I> Epsilon<T, I> instance() {
        return (Epsilon<T, I>) INSTANCE;
    }

}
