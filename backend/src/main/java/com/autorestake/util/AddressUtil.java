package com.autorestake.util;

import java.util.regex.Pattern;

/**
 * Simple validators/normalizers for EVM addresses.
 */
public final class AddressUtil {
    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]{40}");

    private AddressUtil(){}

    public static String normalize(String addr) {
        if (addr == null) throw new IllegalArgumentException("address is null");
        if (!addr.startsWith("0x")) throw new IllegalArgumentException("address must start with 0x: " + addr);
        String hex = addr.substring(2);
        if (!HEX.matcher(hex).matches()) throw new IllegalArgumentException("invalid address (need 40 hex chars): " + addr);
        return "0x" + hex.toLowerCase();
    }
}
