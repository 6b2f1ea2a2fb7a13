package com.e_com.rating.service;

import com.e_com.rating.model.Product;
import com.e_com.rating.model.ReviewState;
import com.e_com.rating.repository.ProductRepository;
import com.e_com.rating.repository.ReviewRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RatingAggregatorTest {

    @Mock
    private ReviewRepository reviewRepository;

    @Mock
    private ProductRepository productRepository;

    @InjectMocks
    private RatingAggregator ratingAggregator;

    @ParameterizedTest(name = "total {0} over {1} reviews -> {2}")
    @CsvSource({
            "8, 3, 2.7",   // 5, 2, 1
            "7, 2, 3.5",   // 5, 2
            "13, 4, 3.3",  // 3.25 rounds half up
            "5, 1, 5.0",
            "3, 3, 1.0",
            "0, 0, 0.0"
    })
    @DisplayName("Mean is rounded half-up to one decimal")
    void testAverageOf(long total, long count, String expected) {
        assertEquals(new BigDecimal(expected), RatingAggregator.averageOf(total, count));
    }

    @Test
    @DisplayName("Empty active set resolves to a concrete zero rating")
    void testRecomputeWithNoActiveReviewsStoresZero() {
        Product product = Product.builder().id(3L).slug("book").name("Book").rating(new BigDecimal("4.5")).build();
        when(reviewRepository.tallyGrades(3L, ReviewState.ACTIVE)).thenReturn(tally(0, 0));

        BigDecimal rating = ratingAggregator.recompute(product);

        assertEquals(0, rating.compareTo(BigDecimal.ZERO));
        assertEquals(rating, product.getRating());
        verify(productRepository, times(1)).save(product);
    }

    @Test
    @DisplayName("Recompute writes the rounded mean onto the product")
    void testRecomputeWritesRoundedMean() {
        Product product = Product.builder().id(1L).slug("laptop").name("Laptop").build();
        when(reviewRepository.tallyGrades(1L, ReviewState.ACTIVE)).thenReturn(tally(3, 8));

        BigDecimal rating = ratingAggregator.recompute(product);

        assertEquals(new BigDecimal("2.7"), rating);
        assertEquals(new BigDecimal("2.7"), product.getRating());
        verify(productRepository).save(product);
    }

    private static ReviewRepository.GradeTally tally(long count, long total) {
        return new ReviewRepository.GradeTally() {
            @Override
            public Number getActiveCount() {
                return count;
            }

            @Override
            public Number getGradeTotal() {
                return total;
            }
        };
    }
}
