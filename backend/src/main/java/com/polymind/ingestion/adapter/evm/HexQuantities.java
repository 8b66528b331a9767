package com.polymind.ingestion.adapter.evm;

/**
 * JSON-RPC quantity encoding (0x-prefixed, no leading zeros).
 */
final class HexQuantities {

    private HexQuantities() {
    }

    static String toHex(long value) {
        return "0x" + Long.toHexString(value);
    }

    static boolean isHex(String value) {
        return value != null && value.length() > 2 && (value.startsWith("0x") || value.startsWith("0X"));
    }

    static long parseLong(String hex) {
        return Long.parseLong(hex.substring(2), 16);
    }

    static int parseInt(String hex) {
        return Integer.parseInt(hex.substring(2), 16);
    }
}
