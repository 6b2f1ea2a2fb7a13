package com.e_com.rating.service;

import com.e_com.rating.dto.ReviewView;
import com.e_com.rating.event.ReviewAddedEvent;
import com.e_com.rating.event.ReviewRetractedEvent;
import com.e_com.rating.exception.ResourceNotFoundException;
import com.e_com.rating.exception.ReviewValidationException;
import com.e_com.rating.feign.UserServiceClient;
import com.e_com.rating.model.Product;
import com.e_com.rating.model.Review;
import com.e_com.rating.model.ReviewState;
import com.e_com.rating.repository.ProductRepository;
import com.e_com.rating.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Review store. Every mutation recomputes the product rating in the same transaction,
 * so a committed review change is never visible next to a stale rating.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewService {

    static final int MAX_COMMENT_LENGTH = 2000;

    private final ReviewRepository reviewRepository;
    private final ProductRepository productRepository;
    private final RatingAggregator ratingAggregator;
    private final ProductReviewReader productReviewReader;
    private final UserServiceClient userServiceClient;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Review> listActive() {
        return reviewRepository.findByStateOrderByIdAsc(ReviewState.ACTIVE);
    }

    /**
     * Active reviews of a product, newest first (ties broken by most recently created),
     * each joined with its author's public identity. Authors are looked up after the
     * read transaction has ended.
     */
    public List<ReviewView> listForProduct(String productSlug, int limit) {
        if (limit < 0) {
            throw new ReviewValidationException("limit", "Limit must not be negative: " + limit);
        }
        List<Review> reviews = productReviewReader.findActiveForProduct(productSlug, limit);

        Map<Long, ReviewView.AuthorSummary> authors = new HashMap<>();
        return reviews.stream()
                .map(review -> ReviewView.builder()
                        .id(review.getId())
                        .productSlug(productSlug)
                        .author(authors.computeIfAbsent(review.getAuthorId(), this::resolveAuthor))
                        .comment(review.getComment())
                        .grade(review.getGrade())
                        .submittedOn(review.getSubmittedOn())
                        .active(review.isActive())
                        .build())
                .toList();
    }

    @Transactional
    public Review submit(String productSlug, Long authorId, int grade, String comment) {
        if (!Review.isValidGrade(grade)) {
            throw new ReviewValidationException("grade",
                    "Grade must be between " + Review.MIN_GRADE + " and " + Review.MAX_GRADE + ": " + grade);
        }
        if (comment != null && comment.length() > MAX_COMMENT_LENGTH) {
            throw new ReviewValidationException("comment", "Comment must not exceed " + MAX_COMMENT_LENGTH + " characters");
        }

        Product product = productRepository.findBySlugForUpdate(productSlug)
                .filter(Product::isActive)
                .orElseThrow(() -> ResourceNotFoundException.product(productSlug));

        Review review = reviewRepository.saveAndFlush(
                new Review(product, authorId, grade, comment, LocalDate.now(clock)));
        BigDecimal rating = ratingAggregator.recompute(product);

        log.info("Review {} submitted for product {} by user {}, rating now {}",
                review.getId(), productSlug, authorId, rating);
        eventPublisher.publishEvent(new ReviewAddedEvent(review.getId(), productSlug, authorId,
                review.getGrade(), review.getComment(), review.getSubmittedOn(), rating));
        return review;
    }

    /**
     * Retracts an active review. An unknown or already retracted id is reported as not found.
     */
    @Transactional
    public Review softDelete(Long reviewId) {
        Review review = reviewRepository.findByIdAndStateForUpdate(reviewId, ReviewState.ACTIVE)
                .orElseThrow(() -> ResourceNotFoundException.review(reviewId));
        Product product = productRepository.findByIdForUpdate(review.getProduct().getId())
                .orElseThrow(() -> new IllegalStateException("Review " + reviewId + " references a missing product"));

        review.retract();
        reviewRepository.saveAndFlush(review);
        BigDecimal rating = ratingAggregator.recompute(product);

        log.info("Review {} retracted from product {}, rating now {}", reviewId, product.getSlug(), rating);
        eventPublisher.publishEvent(new ReviewRetractedEvent(reviewId, product.getSlug(), review.getGrade(), rating));
        return review;
    }

    private ReviewView.AuthorSummary resolveAuthor(Long authorId) {
        UserServiceClient.UserDto user = userServiceClient.getUserById(authorId);
        if (user == null) {
            return new ReviewView.AuthorSummary(authorId, null);
        }
        return new ReviewView.AuthorSummary(authorId, user.getName());
    }
}
