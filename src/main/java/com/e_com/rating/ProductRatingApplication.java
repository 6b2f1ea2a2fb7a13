package com.e_com.rating;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProductRatingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProductRatingApplication.class, args);
    }
}
