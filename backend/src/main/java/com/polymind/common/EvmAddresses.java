package com.polymind.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * EVM address helpers. Addresses are compared and stored lower-case.
 */
public final class EvmAddresses {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private EvmAddresses() {
    }

    public static boolean isValid(String address) {
        return address != null && EVM_ADDRESS.matcher(address.trim()).matches();
    }

    /** Lower-cased, trimmed; null stays null. */
    public static String normalize(String address) {
        return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }
}
