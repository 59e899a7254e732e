package com.giftbattle.backend.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.giftbattle.backend.auth.AuthPrincipal;
import com.giftbattle.backend.auth.TelegramAuthService;
import com.giftbattle.backend.dto.ApiError;
import com.giftbattle.backend.exception.EconomyErrorCode;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Authenticates requests carrying {@code Authorization: tma <initData>}.
 * Requests without the header pass through anonymously; the security chain decides whether that is enough.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAuthFilter extends OncePerRequestFilter {

    public static final String AUTH_SCHEME = "tma ";

    private final TelegramAuthService telegramAuthService;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String authHeader = request.getHeader("Authorization");

        if (authHeader == null || !authHeader.startsWith(AUTH_SCHEME)) {
            filterChain.doFilter(request, response);
            return;
        }

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            String initData = authHeader.substring(AUTH_SCHEME.length()).trim();
            Optional<AuthPrincipal> principal;
            try {
                principal = telegramAuthService.authenticate(initData);
            } catch (DataAccessException e) {
                log.error("Store failure while resolving user for URI: {}", request.getRequestURI(), e);
                EconomyErrorCode code = EconomyErrorCode.STORE_UNAVAILABLE;
                response.setStatus(code.getStatus().value());
                response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                objectMapper.writeValue(response.getWriter(), ApiError.of(code, "Storage is temporarily unavailable"));
                return;
            }

            if (principal.isPresent()) {
                var auth = new UsernamePasswordAuthenticationToken(principal.get(), null, principal.get().authorities());
                SecurityContextHolder.getContext().setAuthentication(auth);
            } else {
                log.warn("Rejected Telegram init data for URI: {}", request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
