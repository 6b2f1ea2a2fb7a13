package com.e_com.rating.feign;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Used when the user-service is unavailable or fails.
 * Keeps the author id so listings still identify who wrote a review.
 */
@Slf4j
@Component
public class UserServiceClientFallback implements UserServiceClient {

    public static final String UNKNOWN_USER_NAME = "Unknown user";

    @Override
    public UserDto getUserById(Long userId) {
        log.warn("Fallback triggered for getUserById({}). User service is unavailable.", userId);
        return new UserDto(userId, UNKNOWN_USER_NAME);
    }
}
