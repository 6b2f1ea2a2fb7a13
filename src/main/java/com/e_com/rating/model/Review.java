package com.e_com.rating.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Check;

import java.time.LocalDate;

@Entity
@Table(name = "reviews", indexes = {
        @Index(name = "idx_reviews_product_state", columnList = "product_id, state")
})
@Check(name = "ck_reviews_grade", constraints = "grade between 1 and 5")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = "product")
public class Review {

    public static final int MIN_GRADE = 1;
    public static final int MAX_GRADE = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "author_id", nullable = false, updatable = false)
    private Long authorId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false, updatable = false)
    private Product product;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String comment;

    @Min(MIN_GRADE)
    @Max(MAX_GRADE)
    @Column(nullable = false, updatable = false)
    private int grade;

    @Column(name = "submitted_on", nullable = false, updatable = false)
    private LocalDate submittedOn;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ReviewState state;

    public Review(Product product, Long authorId, int grade, String comment, LocalDate submittedOn) {
        if (!isValidGrade(grade)) {
            throw new IllegalArgumentException("Grade must be between " + MIN_GRADE + " and " + MAX_GRADE + ": " + grade);
        }
        this.product = product;
        this.authorId = authorId;
        this.grade = grade;
        this.comment = comment;
        this.submittedOn = submittedOn;
        this.state = ReviewState.ACTIVE;
    }

    public static boolean isValidGrade(int grade) {
        return grade >= MIN_GRADE && grade <= MAX_GRADE;
    }

    public boolean isActive() {
        return state == ReviewState.ACTIVE;
    }

    /**
     * Moves the review out of the aggregate. A retracted review can never come back.
     */
    public void retract() {
        if (state != ReviewState.ACTIVE) {
            throw new IllegalStateException("Review " + id + " is already retracted");
        }
        state = ReviewState.RETRACTED;
    }
}
