package com.e_com.rating.dto;

import com.e_com.rating.model.Product;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {

    private String slug;
    private String name;
    private boolean active;
    private BigDecimal rating;

    public static ProductResponse from(Product product) {
        return new ProductResponse(product.getSlug(), product.getName(), product.isActive(), product.getRating());
    }
}
