package com.giftbattle.backend.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.giftbattle.backend.entity.User;
import com.giftbattle.backend.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Service;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TelegramAuthService {

    private static final String USER_KEY = "user";
    private static final String ROLE_USER = "ROLE_USER";

    private final TelegramInitDataVerifier verifier;
    private final UserService userService;
    private final ObjectMapper objectMapper;

    /**
     * Verifies the init data and resolves (or lazily creates) the user it identifies.
     *
     * @return the principal, or empty if the payload is forged, malformed or carries no user
     */
    public Optional<AuthPrincipal> authenticate(String initData) {
        if (!verifier.verify(initData)) {
            return Optional.empty();
        }
        Optional<TelegramIdentity> identity = extractIdentity(initData);
        if (identity.isEmpty()) {
            log.warn("Signed init data without a usable user field");
            return Optional.empty();
        }
        User user = userService.getOrCreate(identity.get());
        return Optional.of(new AuthPrincipal(
                user.getId(),
                user.getTelegramId(),
                user.getUsername(),
                List.of(new SimpleGrantedAuthority(ROLE_USER))
        ));
    }

    Optional<TelegramIdentity> extractIdentity(String initData) {
        return InitDataField.parse(initData).stream()
                .filter(field -> USER_KEY.equals(field.key()))
                .findFirst()
                .flatMap(field -> readIdentity(field.value()))
                .filter(identity -> identity.id() != null);
    }

    private Optional<TelegramIdentity> readIdentity(String encodedJson) {
        try {
            String json = URLDecoder.decode(encodedJson, StandardCharsets.UTF_8);
            return Optional.ofNullable(objectMapper.readValue(json, TelegramIdentity.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Failed to parse init data user field: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
