package com.e_com.rating.security;

import com.e_com.rating.exception.GlobalExceptionHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;

import java.io.IOException;

/**
 * Rejections raised by the filter chain, before any controller runs.
 * Writes the same error body as {@link GlobalExceptionHandler}; missing credentials are a 403.
 */
@Slf4j
@RequiredArgsConstructor
public class JsonAccessDeniedHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        log.warn("Unauthenticated {} {} rejected", request.getMethod(), request.getRequestURI());
        write(response, "Authentication with the required capability is needed for this operation");
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        log.warn("Capability check failed on {} {}: {}", request.getMethod(), request.getRequestURI(),
                accessDeniedException.getMessage());
        write(response, "Insufficient capability for this operation");
    }

    private void write(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), GlobalExceptionHandler.body("FORBIDDEN", message));
    }
}
