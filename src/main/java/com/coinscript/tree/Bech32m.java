package com.coinscript.tree;

import java.io.ByteArrayOutputStream;
import java.util.Locale;

import com.coinscript.error.ConversionError;

/** Bech32m address codec (BIP-350) for {@code xch1...} / {@code txch1...} puzzle hash addresses. */
public final class Bech32m {

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int BECH32M_CONST = 0x2bc830a3;
    private static final int[] GENERATOR = { 0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3 };

    private Bech32m() {}

    public static boolean isAddress(String text) {
        return text != null && (text.startsWith("xch1") || text.startsWith("txch1"));
    }

    /** Decodes an address to its 32-byte puzzle hash. */
    public static byte[] decodeAddress(String address) {
        byte[] data = decode(address);
        return Converters.requireLength(data, 32, "Address payload");
    }

    public static String encodeAddress(byte[] puzzleHash, String prefix) {
        return encode(prefix, Converters.requireLength(puzzleHash, 32, "Puzzle hash"));
    }

    public static byte[] decode(String address) {
        if (address == null) throw new ConversionError(null, "Address is null");
        String lower = address.toLowerCase(Locale.ROOT);
        if (!lower.equals(address) && !address.toUpperCase(Locale.ROOT).equals(address)) {
            throw new ConversionError(address, "Mixed-case address");
        }
        int sep = lower.lastIndexOf('1');
        if (sep < 1 || sep + 7 > lower.length()) {
            throw new ConversionError(address, "Malformed address '" + address + "'");
        }
        String hrp = lower.substring(0, sep);
        int[] values = new int[lower.length() - sep - 1];
        for (int i = 0; i < values.length; i++) {
            int v = CHARSET.indexOf(lower.charAt(sep + 1 + i));
            if (v < 0) throw new ConversionError(address, "Invalid address character '" + lower.charAt(sep + 1 + i) + "'");
            values[i] = v;
        }
        if (polymod(concat(expandHrp(hrp), values)) != BECH32M_CONST) {
            throw new ConversionError(address, "Bad address checksum in '" + address + "'");
        }
        int[] payload = new int[values.length - 6];
        System.arraycopy(values, 0, payload, 0, payload.length);
        return convertBits(payload, 5, 8, false, address);
    }

    public static String encode(String hrp, byte[] data) {
        int[] raw = new int[data.length];
        for (int i = 0; i < data.length; i++) raw[i] = data[i] & 0xff;
        byte[] five = convertBits(raw, 8, 5, true, hrp);
        int[] values = new int[five.length];
        for (int i = 0; i < five.length; i++) values[i] = five[i];

        int[] checksumInput = concat(concat(expandHrp(hrp), values), new int[6]);
        int mod = polymod(checksumInput) ^ BECH32M_CONST;
        StringBuilder sb = new StringBuilder(hrp).append('1');
        for (int v : values) sb.append(CHARSET.charAt(v));
        for (int i = 0; i < 6; i++) sb.append(CHARSET.charAt((mod >>> (5 * (5 - i))) & 31));
        return sb.toString();
    }

    private static int polymod(int[] values) {
        int chk = 1;
        for (int v : values) {
            int top = chk >>> 25;
            chk = ((chk & 0x1ffffff) << 5) ^ v;
            for (int i = 0; i < 5; i++) {
                if (((top >>> i) & 1) != 0) chk ^= GENERATOR[i];
            }
        }
        return chk;
    }

    private static int[] expandHrp(String hrp) {
        int[] out = new int[hrp.length() * 2 + 1];
        for (int i = 0; i < hrp.length(); i++) {
            out[i] = hrp.charAt(i) >> 5;
            out[i + hrp.length() + 1] = hrp.charAt(i) & 31;
        }
        return out;
    }

    private static int[] concat(int[] a, int[] b) {
        int[] out = new int[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    private static byte[] convertBits(int[] data, int from, int to, boolean pad, String input) {
        int acc = 0;
        int bits = 0;
        int maxv = (1 << to) - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int value : data) {
            acc = (acc << from) | value;
            bits += from;
            while (bits >= to) {
                bits -= to;
                out.write((acc >> bits) & maxv);
            }
        }
        if (pad) {
            if (bits > 0) out.write((acc << (to - bits)) & maxv);
        } else if (bits >= from || ((acc << (to - bits)) & maxv) != 0) {
            throw new ConversionError(input, "Invalid address padding");
        }
        return out.toByteArray();
    }
}
