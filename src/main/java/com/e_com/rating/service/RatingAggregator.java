package com.e_com.rating.service;

import com.e_com.rating.model.Product;
import com.e_com.rating.model.ReviewState;
import com.e_com.rating.repository.ProductRepository;
import com.e_com.rating.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Owns {@link Product#getRating()}. Recomputes it from the product's active reviews
 * inside the transaction of the review mutation that triggered it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RatingAggregator {

    static final int RATING_SCALE = 1;
    static final BigDecimal EMPTY_RATING = BigDecimal.ZERO.setScale(RATING_SCALE);

    private final ReviewRepository reviewRepository;
    private final ProductRepository productRepository;

    /**
     * Caller must already hold the product row lock.
     *
     * @return the rating written to the product
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal recompute(Product product) {
        ReviewRepository.GradeTally tally = reviewRepository.tallyGrades(product.getId(), ReviewState.ACTIVE);
        BigDecimal rating = averageOf(tally.getGradeTotal().longValue(), tally.getActiveCount().longValue());

        product.setRating(rating);
        productRepository.save(product);

        log.debug("Recomputed rating of product {} to {} over {} active reviews",
                product.getSlug(), rating, tally.getActiveCount());
        return rating;
    }

    /**
     * Mean rounded half-up to one decimal; 0.0 when there are no grades.
     */
    static BigDecimal averageOf(long gradeTotal, long count) {
        if (count == 0) {
            return EMPTY_RATING;
        }
        return BigDecimal.valueOf(gradeTotal).divide(BigDecimal.valueOf(count), RATING_SCALE, RoundingMode.HALF_UP);
    }
}
