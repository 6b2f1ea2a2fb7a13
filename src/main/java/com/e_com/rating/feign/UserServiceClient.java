package com.e_com.rating.feign;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

// Resolves review authors to their public identity; base URL comes from "user.service.url"
@FeignClient(name = "user-service", url = "${user.service.url}", fallback = UserServiceClientFallback.class)
public interface UserServiceClient {

    @GetMapping("/api/users/{userId}")
    UserDto getUserById(@PathVariable("userId") Long userId);

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    class UserDto {

        private Long id;
        private String name;
    }
}
