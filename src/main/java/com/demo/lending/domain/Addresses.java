package com.demo.lending.domain;

import java.util.Locale;

public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private Addresses() {}

    public static String normalize(String address) {
        return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isEmpty(String address) {
        return address == null || address.isBlank() || ZERO.equals(normalize(address));
    }
}
