package com.lendrisk.util;

import java.util.regex.Pattern;

/**
 * Validators/normalizers for wallet account addresses used to register credit records.
 */
public final class AddressUtil {
    private AddressUtil(){}

    private static final Pattern HEX_40 = Pattern.compile("[0-9a-fA-F]{40}");

    /** Lower-cases a 0x-prefixed 20-byte address so one wallet maps to one credit record. */
    public static String normalize(String addr) {
        if (addr == null) throw new IllegalArgumentException("account address is null");
        String trimmed = addr.trim();
        if (!trimmed.startsWith("0x")) throw new IllegalArgumentException("account address must start with 0x: " + addr);
        String hex = trimmed.substring(2);
        if (!HEX_40.matcher(hex).matches()) {
            throw new IllegalArgumentException("account address needs exactly 40 hex chars: " + addr);
        }
        return "0x" + hex.toLowerCase();
    }
}
