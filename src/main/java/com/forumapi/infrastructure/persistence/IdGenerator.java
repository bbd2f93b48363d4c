package com.forumapi.infrastructure.persistence;

import java.security.SecureRandom;

/**
 * Generates row ids of the form {@code <prefix>-<random>}.
 */
@FunctionalInterface
public interface IdGenerator {

    String next(String prefix);

    static IdGenerator random() {
        String alphabet = "useandom-26T198340PX75pxJACKVERYMINDBUSHWOLF_GQZbfghjklqvwyzrict";
        SecureRandom random = new SecureRandom();
        return prefix -> {
            char[] id = new char[21];
            for (int i = 0; i < id.length; i++) {
                id[i] = alphabet.charAt(random.nextInt(alphabet.length()));
            }
            return prefix + "-" + new String(id);
        };
    }
}
