package com.giftbattle.backend.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Checks the signature of Telegram Mini App init data.
 * <p>
 * The {@code hash} field must equal the lowercase hex HMAC-SHA256 of the remaining fields,
 * sorted by key and joined as {@code key=value} lines, keyed with SHA-256 of the bot token.
 */
@Component
@Slf4j
public class TelegramInitDataVerifier {

    static final String HASH_KEY = "hash";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final byte[] secretKey;

    public TelegramInitDataVerifier(@Value("${telegram.bot-token}") String botToken) {
        if (!StringUtils.hasText(botToken)) {
            throw new IllegalStateException("telegram.bot-token must be configured");
        }
        this.secretKey = sha256(botToken.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns whether the payload carries a valid signature. Never throws for malformed input.
     */
    public boolean verify(String payload) {
        if (!StringUtils.hasText(payload)) {
            return false;
        }
        List<InitDataField> fields;
        try {
            fields = InitDataField.parse(payload);
        } catch (IllegalArgumentException ex) {
            log.debug("Unparseable init data: {}", ex.getMessage());
            return false;
        }

        String hash = null;
        List<InitDataField> signed = new ArrayList<>(fields.size());
        for (InitDataField field : fields) {
            if (HASH_KEY.equals(field.key())) {
                if (hash != null) {
                    return false;
                }
                hash = field.value();
            } else {
                signed.add(field);
            }
        }
        if (hash == null) {
            return false;
        }

        byte[] expected = sign(checkString(signed)).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, hash.getBytes(StandardCharsets.UTF_8));
    }

    String sign(String checkString) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secretKey, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(checkString.getBytes(StandardCharsets.UTF_8));
            return new String(Hex.encode(digest));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    static String checkString(List<InitDataField> fields) {
        return fields.stream()
                .sorted(Comparator.comparing(InitDataField::key))
                .map(InitDataField::toString)
                .collect(Collectors.joining("\n"));
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
