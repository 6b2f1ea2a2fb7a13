package com.e_com.rating.dto;

import com.e_com.rating.model.Review;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewResponse {

    private Long id;
    private String productSlug;
    private Long authorId;
    private String comment;
    private Integer grade;
    private LocalDate submittedOn;
    private boolean active;

    public static ReviewResponse from(Review review) {
        return ReviewResponse.builder()
                .id(review.getId())
                .productSlug(review.getProduct().getSlug())
                .authorId(review.getAuthorId())
                .comment(review.getComment())
                .grade(review.getGrade())
                .submittedOn(review.getSubmittedOn())
                .active(review.isActive())
                .build();
    }
}
