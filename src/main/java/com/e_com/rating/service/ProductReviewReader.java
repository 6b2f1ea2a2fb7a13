package com.e_com.rating.service;

import com.e_com.rating.exception.ResourceNotFoundException;
import com.e_com.rating.model.Product;
import com.e_com.rating.model.Review;
import com.e_com.rating.model.ReviewState;
import com.e_com.rating.repository.ProductRepository;
import com.e_com.rating.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;

/**
 * Database side of the per-product listing. Kept apart from {@link ReviewService} so the
 * read transaction is closed before authors are resolved over HTTP.
 */
@Component
@RequiredArgsConstructor
public class ProductReviewReader {

    private final ProductRepository productRepository;
    private final ReviewRepository reviewRepository;

    @Transactional(readOnly = true)
    public List<Review> findActiveForProduct(String productSlug, int limit) {
        Product product = productRepository.findBySlug(productSlug)
                .orElseThrow(() -> ResourceNotFoundException.product(productSlug));
        if (limit == 0) {
            return Collections.emptyList();
        }
        return reviewRepository.findByProductIdAndStateOrderBySubmittedOnDescIdDesc(
                product.getId(), ReviewState.ACTIVE, PageRequest.of(0, limit));
    }
}
