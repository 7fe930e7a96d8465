package com.coinscript.tree;

import java.math.BigInteger;

import com.coinscript.error.ConversionError;

public final class Converters {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Converters() {}

    public static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    public static String toPrefixedHex(byte[] bytes) {
        return "0x" + toHex(bytes);
    }

    /** Accepts an optional 0x prefix; an odd digit count is left-padded with 0. */
    public static byte[] hexToBytes(String hex) {
        if (hex == null) throw new ConversionError(null, "hex input is null");
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() % 2 == 1) digits = "0" + digits;
        byte[] out = new byte[digits.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(digits.charAt(i * 2), 16);
            int lo = Character.digit(digits.charAt(i * 2 + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new ConversionError(hex, "Invalid hex digit in '" + hex + "'");
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    public static boolean isHex(String text) {
        if (text == null || !(text.startsWith("0x") || text.startsWith("0X"))) return false;
        for (int i = 2; i < text.length(); i++) {
            if (Character.digit(text.charAt(i), 16) < 0) return false;
        }
        return true;
    }

    /** Minimal signed big-endian encoding; zero is the empty byte string. */
    public static byte[] bigIntegerToBytes(BigInteger value) {
        if (value.signum() == 0) return new byte[0];
        return value.toByteArray();
    }

    public static BigInteger bytesToBigInteger(byte[] bytes) {
        if (bytes.length == 0) return BigInteger.ZERO;
        return new BigInteger(bytes);
    }

    /** Interprets an atom as a fixed-size hash, failing when the length differs. */
    public static byte[] requireLength(byte[] bytes, int length, String what) {
        if (bytes.length != length) {
            throw new ConversionError(toHex(bytes), what + " must be " + length + " bytes, got " + bytes.length);
        }
        return bytes;
    }
}
