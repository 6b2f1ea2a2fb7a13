package com.e_com.rating.repository;

import com.e_com.rating.model.Product;
import com.e_com.rating.model.Review;
import com.e_com.rating.model.ReviewState;
import jakarta.persistence.EntityManager;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DataJpaTest
class ReviewRepositoryTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 20);

    @Autowired
    private ReviewRepository reviewRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private EntityManager entityManager;

    private Product product;

    @BeforeEach
    void setUp() {
        product = productRepository.save(Product.builder().slug("headphones").name("Headphones").build());
    }

    @Test
    @DisplayName("Same-day reviews list most recently created first")
    void sameDayReviewsListNewestCreatedFirst() {
        Review a = reviewRepository.save(new Review(product, 1L, 5, "A", DAY));
        Review b = reviewRepository.save(new Review(product, 2L, 3, "B", DAY));
        Review c = reviewRepository.save(new Review(product, 3L, 4, "C", DAY));

        List<Review> reviews = reviewRepository.findByProductIdAndStateOrderBySubmittedOnDescIdDesc(
                product.getId(), ReviewState.ACTIVE, PageRequest.of(0, 10));

        assertThat(reviews).extracting(Review::getId).containsExactly(c.getId(), b.getId(), a.getId());
    }

    @Test
    @DisplayName("Listing orders by date before creation order and honours the limit")
    void listingOrdersByDateThenTruncates() {
        Review recent = reviewRepository.save(new Review(product, 1L, 5, null, DAY));
        reviewRepository.save(new Review(product, 2L, 3, null, DAY.minusDays(10)));
        Review older = reviewRepository.save(new Review(product, 3L, 4, null, DAY.minusDays(1)));

        List<Review> reviews = reviewRepository.findByProductIdAndStateOrderBySubmittedOnDescIdDesc(
                product.getId(), ReviewState.ACTIVE, PageRequest.of(0, 2));

        assertThat(reviews).extracting(Review::getId).containsExactly(recent.getId(), older.getId());
    }

    @Test
    @DisplayName("Retracted reviews are excluded from listings and the tally")
    void retractedReviewsAreExcluded() {
        reviewRepository.save(new Review(product, 1L, 5, null, DAY));
        reviewRepository.save(new Review(product, 2L, 2, null, DAY));
        Review retracted = new Review(product, 3L, 1, null, DAY);
        retracted.retract();
        reviewRepository.save(retracted);

        ReviewRepository.GradeTally tally = reviewRepository.tallyGrades(product.getId(), ReviewState.ACTIVE);

        assertThat(tally.getActiveCount().longValue()).isEqualTo(2L);
        assertThat(tally.getGradeTotal().longValue()).isEqualTo(7L);
        assertThat(reviewRepository.findByStateOrderByIdAsc(ReviewState.ACTIVE)).hasSize(2);
        assertThat(reviewRepository.findByIdAndStateForUpdate(retracted.getId(), ReviewState.ACTIVE)).isEmpty();
    }

    @Test
    @DisplayName("Tally of a product without reviews is zero")
    void tallyOfEmptyProductIsZero() {
        ReviewRepository.GradeTally tally = reviewRepository.tallyGrades(product.getId(), ReviewState.ACTIVE);

        assertThat(tally.getActiveCount().longValue()).isZero();
        assertThat(tally.getGradeTotal().longValue()).isZero();
    }

    @Test
    @DisplayName("Database rejects a grade outside 1..5 written around the entity")
    void gradeCheckConstraintRejectsOutOfRange() {
        Throwable thrown = catchThrowable(() -> entityManager.createNativeQuery(
                        "insert into reviews (author_id, product_id, grade, submitted_on, state) "
                                + "values (?1, ?2, ?3, ?4, ?5)")
                .setParameter(1, 1L)
                .setParameter(2, product.getId())
                .setParameter(3, 9)
                .setParameter(4, DAY)
                .setParameter(5, ReviewState.ACTIVE.name())
                .executeUpdate());

        assertThat(causeChain(thrown)).hasAtLeastOneElementOfType(ConstraintViolationException.class);
    }

    private static List<Throwable> causeChain(Throwable thrown) {
        List<Throwable> chain = new ArrayList<>();
        for (Throwable t = thrown; t != null && !chain.contains(t); t = t.getCause()) {
            chain.add(t);
        }
        return chain;
    }
}
