package com.project.attest.io;

import java.util.HexFormat;

/**
 * Hex helpers. Every digest leaves this process as lowercase hex without a {@code 0x} prefix;
 * parsing accepts either form.
 */
public final class ByteEncoding {

    private static final HexFormat HEX = HexFormat.of();

    private ByteEncoding() {
    }

    public static String toHex(byte[] data) {
        return HEX.formatHex(data);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex string must not be null");
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex string must have even length");
        }
        try {
            return HEX.parseHex(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + e.getMessage(), e);
        }
    }
}
