package com.giftbattle.backend.auth;

import org.springframework.security.core.GrantedAuthority;

import java.util.Collection;

public record AuthPrincipal(Long id, Long telegramId, String username, Collection<? extends GrantedAuthority> authorities) {}
