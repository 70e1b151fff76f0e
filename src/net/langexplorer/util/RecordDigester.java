package net.langexplorer.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * A SHA-256 digest over a sequence of typed records.
 * Every record is tagged with its type (and, for variable-length ones,
 * its length), so that different record sequences never collide by
 * concatenation. A domain string is mixed in before the first record.
 */
public class RecordDigester {

    private static final String ALGORITHM = "SHA-256";

    private static final byte TAG_FINISH = 0;
    private static final byte TAG_START  = 1;
    private static final byte TAG_LONG   = 5;
    private static final byte TAG_BYTES  = 6;
    private static final byte TAG_STRING = 7;

    private final MessageDigest digest;
    private final byte[] domain;
    private final byte[] scratch;
    private boolean initialized;

    public RecordDigester(String domain) throws NoSuchAlgorithmException {
        if (domain == null)
            throw new NullPointerException(
                "RecordDigester domain may not be null");
        this.digest = MessageDigest.getInstance(ALGORITHM);
        this.domain = Encodings.toBytes(domain);
        this.scratch = new byte[9];
        this.initialized = false;
    }

    private void addTaggedInt(byte tag, int value) {
        start();
        scratch[0] = tag;
        scratch[1] = (byte) (value >> 24);
        scratch[2] = (byte) (value >> 16);
        scratch[3] = (byte) (value >>  8);
        scratch[4] = (byte) (value      );
        digest.update(scratch, 0, 5);
    }

    private void start() {
        if (initialized) return;
        initialized = true;
        addTaggedInt(TAG_START, domain.length);
        digest.update(domain);
    }

    public void addLong(long value) {
        start();
        scratch[0] = TAG_LONG;
        for (int i = 1; i < 9; i++) {
            scratch[i] = (byte) (value >> (8 * (8 - i)));
        }
        digest.update(scratch, 0, 9);
    }

    public void addByteArray(byte[] value) {
        addTaggedInt(TAG_BYTES, value.length);
        digest.update(value);
    }

    public void addString(String value) {
        byte[] data = Encodings.toBytes(value);
        addTaggedInt(TAG_STRING, data.length);
        digest.update(data);
    }

    public byte[] finish() {
        start();
        digest.update(TAG_FINISH);
        initialized = false;
        return digest.digest();
    }
    public String finishHex() {
        return Encodings.toHex(finish());
    }

    public static RecordDigester getInstance(String domain) {
        try {
            return new RecordDigester(domain);
        } catch (NoSuchAlgorithmException exc) {
            throw new RuntimeException(exc);
        }
    }

}
