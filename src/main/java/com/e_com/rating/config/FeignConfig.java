package com.e_com.rating.config;

import com.e_com.rating.feign.UserServiceClient;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

// Kept off the application class so sliced tests do not register Feign clients
@Configuration
@EnableFeignClients(clients = UserServiceClient.class)
public class FeignConfig {
}
