package net.langexplorer.api.grammar;

/**
 * A terminal payload that can be written into a generated program.
 * The bytes returned by serialize() are what ends up in the program text
 * when a terminal carrying this value is part of a finished derivation.
 * Implementations should be immutable and should implement equals() and
 * hashCode() by value, since terminals are compared when matching
 * context-sensitive left-hand sides.
 */
public interface BinarySerializable {

    /**
     * Return the byte encoding of this value.
     * The returned array is owned by the caller.
     */
    byte[] serialize();

}
