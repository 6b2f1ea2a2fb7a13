package com.e_com.rating.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// Range of grade is checked by ReviewService so the same rule applies to every caller
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitReviewRequest {

    @NotNull
    private Integer grade;

    private String comment;
}
