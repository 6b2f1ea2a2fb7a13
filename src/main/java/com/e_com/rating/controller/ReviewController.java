package com.e_com.rating.controller;

import com.e_com.rating.dto.ReviewResponse;
import com.e_com.rating.service.ReviewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/reviews")
@RequiredArgsConstructor
@Tag(name = "Review API", description = "Review moderation and listing")
public class ReviewController {

    private final ReviewService reviewService;

    @Operation(summary = "List active reviews", description = "Retrieve every active review across all products")
    @GetMapping
    public ResponseEntity<List<ReviewResponse>> listActiveReviews() {
        List<ReviewResponse> reviews = reviewService.listActive().stream()
                .map(ReviewResponse::from)
                .toList();
        return ResponseEntity.ok(reviews);
    }

    @Operation(summary = "Retract a review",
            description = "Soft-delete an active review and recompute its product's rating",
            security = @SecurityRequirement(name = "bearerAuth"))
    @DeleteMapping("/{reviewId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ReviewResponse> retractReview(@PathVariable Long reviewId) {
        return ResponseEntity.ok(ReviewResponse.from(reviewService.softDelete(reviewId)));
    }
}
