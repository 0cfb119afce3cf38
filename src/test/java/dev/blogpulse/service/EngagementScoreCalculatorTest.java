package dev.blogpulse.service;

import dev.blogpulse.entity.PostEngagementStat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("EngagementScoreCalculator")
class EngagementScoreCalculatorTest {

    private final EngagementScoreCalculator calculator = EngagementScoreCalculator.defaults();

    private static PostEngagementStat perfect() {
        return PostEngagementStat.builder()
                .postId(1L)
                .totalViews(10)
                .scroll25Percent(10)
                .scroll50Percent(10)
                .scroll75Percent(10)
                .scroll100Percent(10)
                .avgTimeOnPage(300)
                .totalShares(1)
                .build();
    }

    @Nested
    @DisplayName("score")
    class Score {

        @Test
        @DisplayName("Should be zero for a post nobody read")
        void zeroCounters() {
            assertThat(calculator.score(PostEngagementStat.builder().postId(1L).build())).isZero();
        }

        @Test
        @DisplayName("Should reach 100 when every term is saturated")
        void saturated() {
            assertThat(calculator.score(perfect())).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Should stay within bounds when counters overshoot the views")
        void overshootingCounters() {
            PostEngagementStat stat = perfect();
            stat.setScroll100Percent(50);
            stat.setTotalShares(500);
            stat.setAvgTimeOnPage(99_999);

            assertThat(calculator.score(stat)).isBetween(0.0, 100.0);
        }

        @Test
        @DisplayName("Should be zero when every weight is zero or negative")
        void zeroWeights() {
            EngagementScoreCalculator flat = new EngagementScoreCalculator(0, -1, 0, 0, 300, 0.1);

            assertThat(flat.score(perfect())).isZero();
        }

        @Test
        @DisplayName("Should weight the normalized terms")
        void weightedTerms() {
            PostEngagementStat stat = PostEngagementStat.builder()
                    .postId(1L)
                    .totalViews(10)
                    .scroll25Percent(10)
                    .scroll50Percent(10)
                    .scroll75Percent(5)
                    .scroll100Percent(5)
                    .avgTimeOnPage(150)
                    .build();

            // rate 0.5, scroll 75%, time 0.5, shares 0
            assertThat(calculator.score(stat)).isEqualTo(45.0);
        }
    }

    @Test
    @DisplayName("Should compute the completion rate")
    void engagementRate() {
        PostEngagementStat stat = PostEngagementStat.builder().postId(1L).totalViews(8).scroll100Percent(4).build();

        assertThat(calculator.engagementRate(stat)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should derive mean scroll depth from cumulative checkpoints")
    void avgScrollDepth() {
        PostEngagementStat stat = PostEngagementStat.builder()
                .postId(1L)
                .totalViews(4)
                .scroll25Percent(4)
                .scroll50Percent(2)
                .scroll75Percent(1)
                .build();

        assertThat(calculator.avgScrollDepth(stat)).isCloseTo(43.75, within(0.0001));
    }

    @Test
    @DisplayName("Should express conversions per 100 views")
    void conversionRate() {
        PostEngagementStat stat = PostEngagementStat.builder().postId(1L).totalViews(200).newsletterSignups(3).build();

        assertThat(calculator.conversionRate(stat)).isEqualTo(1.5);
    }
}
