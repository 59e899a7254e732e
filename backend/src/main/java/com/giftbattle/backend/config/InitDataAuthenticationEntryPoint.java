package com.giftbattle.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.giftbattle.backend.dto.ApiError;
import com.giftbattle.backend.exception.EconomyErrorCode;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@RequiredArgsConstructor
@Slf4j
public class InitDataAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException, ServletException {
        log.warn("Authentication entry point triggered for URI: {}. Exception: {}", request.getRequestURI(), authException.getMessage());
        EconomyErrorCode code = EconomyErrorCode.AUTHENTICATION_FAILURE;
        response.setStatus(code.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(),
                ApiError.of(code, "Valid Telegram init data is required"));
    }
}
