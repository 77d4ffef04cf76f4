package com.autorestake.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Converts on-chain integer amounts (smallest unit) into display units.
 */
public final class AmountUtil {
    private AmountUtil(){}

    /** e.g. toDisplay(5e18, 18, 4) = "5.0000". Truncates, never rounds up. */
    public static String toDisplay(BigInteger raw, int decimals, int scale) {
        BigInteger v = raw == null ? BigInteger.ZERO : raw;
        return new BigDecimal(v, decimals).setScale(scale, RoundingMode.DOWN).toPlainString();
    }

    /** Parses a 0x-prefixed or bare hex word as an unsigned integer. */
    public static BigInteger parseHex(String hex) {
        if (hex == null || hex.isBlank()) return BigInteger.ZERO;
        String h = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (h.isEmpty()) return BigInteger.ZERO;
        return new BigInteger(h, 16);
    }
}
