package com.e_com.rating.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRetractedEvent {

    private Long reviewId;
    private String productSlug;
    private Integer grade;
    private BigDecimal productRating;
}
