package com.e_com.rating.controller;

import com.e_com.rating.dto.ProductResponse;
import com.e_com.rating.dto.ReviewResponse;
import com.e_com.rating.dto.ReviewView;
import com.e_com.rating.dto.SubmitReviewRequest;
import com.e_com.rating.security.ReviewActor;
import com.e_com.rating.service.ProductService;
import com.e_com.rating.service.ReviewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
@Tag(name = "Product API", description = "Product rating and product reviews")
public class ProductController {

    private final ProductService productService;
    private final ReviewService reviewService;

    @Operation(summary = "Get Product by slug", description = "Retrieve a product with its current rating")
    @GetMapping("/{slug}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable String slug) {
        return ResponseEntity.ok(ProductResponse.from(productService.getProductBySlug(slug)));
    }

    @Operation(summary = "Get reviews of a product", description = "Active reviews of a product, newest first")
    @GetMapping("/{slug}/reviews")
    public ResponseEntity<List<ReviewView>> getProductReviews(
            @PathVariable String slug,
            @Parameter(description = "Maximum number of reviews to return")
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(reviewService.listForProduct(slug, limit));
    }

    @Operation(summary = "Add a review",
            description = "Submit a review for a product and recompute its rating",
            security = @SecurityRequirement(name = "bearerAuth"))
    @PostMapping("/{slug}/reviews")
    @PreAuthorize("hasRole('CUSTOMER')")
    public ResponseEntity<ReviewResponse> submitReview(@PathVariable String slug,
                                                       @Valid @RequestBody SubmitReviewRequest request,
                                                       @AuthenticationPrincipal ReviewActor actor) {
        ReviewResponse created = ReviewResponse.from(
                reviewService.submit(slug, actor.getUserId(), request.getGrade(), request.getComment()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
}
