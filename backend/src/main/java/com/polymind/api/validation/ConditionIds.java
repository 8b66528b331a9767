package com.polymind.api.validation;

import java.util.regex.Pattern;

/**
 * CTF condition id: 0x + 64 hex.
 */
public final class ConditionIds {

    private static final Pattern BYTES32 = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private ConditionIds() {
    }

    public static boolean isValid(String conditionId) {
        return conditionId != null && BYTES32.matcher(conditionId.trim()).matches();
    }
}
