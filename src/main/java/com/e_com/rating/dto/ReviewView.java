package com.e_com.rating.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A review as shown on a product page, joined with its author's public identity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewView {

    private Long id;
    private String productSlug;
    private AuthorSummary author;
    private String comment;
    private Integer grade;
    private LocalDate submittedOn;
    private boolean active;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthorSummary {

        private Long id;
        private String displayName;
    }
}
