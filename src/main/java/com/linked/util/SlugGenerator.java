package com.linked.util;

import java.security.SecureRandom;
import java.util.Random;

public final class SlugGenerator {

    /** Lowercase letters and digits without the easily confused {@code i} and {@code l}. */
    public static final String ALPHABET = "abcdefghjkmnopqrstuvwxyz0123456789";

    public static final int LENGTH = 6;

    private static final Random RANDOM = new SecureRandom();

    private SlugGenerator() {}

    public static String generate() {
        StringBuilder sb = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
