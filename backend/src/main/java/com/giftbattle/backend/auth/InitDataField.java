package com.giftbattle.backend.auth;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@code key=value} segment of a Telegram init data string, kept exactly as received.
 */
public record InitDataField(String key, String value) {

    /**
     * Splits {@code a=1&b=2} into fields, in order. Each segment is split on its first {@code '='}.
     *
     * @throws IllegalArgumentException if a segment has no {@code '='} or an empty key
     */
    public static List<InitDataField> parse(String payload) {
        List<InitDataField> fields = new ArrayList<>();
        for (String segment : payload.split("&", -1)) {
            int separator = segment.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Malformed init data segment");
            }
            fields.add(new InitDataField(segment.substring(0, separator), segment.substring(separator + 1)));
        }
        return fields;
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
