package net.langexplorer.util;

import java.nio.charset.StandardCharsets;

public final class Encodings {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    /* Avoid constructions */
    private Encodings() {}

    public static byte[] toBytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    public static String fromBytes(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }

    /**
     * The eight bytes of l, least significant first.
     */
    public static byte[] toLittleEndian(long l) {
        byte[] ret = new byte[8];
        for (int i = 0; i < 8; i++) {
            ret[i] = (byte) (l >>> (8 * i));
        }
        return ret;
    }

    public static String toHex(byte[] buf) {
        char[] ret = new char[2 * buf.length];
        int p = 0;
        for (int i = 0; i < buf.length; i++) {
            ret[p++] = HEX[buf[i] >> 4 & 0x0F];
            ret[p++] = HEX[buf[i] & 0x0F];
        }
        return new String(ret);
    }

}
