package com.e_com.rating.service;

import com.e_com.rating.exception.ResourceNotFoundException;
import com.e_com.rating.model.Product;
import com.e_com.rating.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ProductService {

    private final ProductRepository productRepository;

    @Transactional(readOnly = true)
    public Product getProductBySlug(String slug) {
        return productRepository.findBySlug(slug)
                .orElseThrow(() -> ResourceNotFoundException.product(slug));
    }
}
