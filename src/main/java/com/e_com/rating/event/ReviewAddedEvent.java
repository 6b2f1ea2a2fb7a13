package com.e_com.rating.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewAddedEvent {

    private Long reviewId;
    private String productSlug;
    private Long authorId;
    private Integer grade;
    private String comment;
    private LocalDate submittedOn;
    private BigDecimal productRating;
}
