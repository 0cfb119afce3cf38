package dev.blogpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Leaderboard {
    private List<PostRanking> mostViewed;
    private List<PostRanking> highestEngagement;
    private List<PostRanking> mostShared;
    private List<PostRanking> longestReadTime;
    private List<PostRanking> bestConversion;
}
