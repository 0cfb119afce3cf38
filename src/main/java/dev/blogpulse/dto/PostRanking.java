package dev.blogpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One leaderboard row; {@code value} is the metric the list is ranked by.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostRanking {
    private Long postId;
    private String title;
    private String slug;
    private double value;
    private long totalViews;
}
