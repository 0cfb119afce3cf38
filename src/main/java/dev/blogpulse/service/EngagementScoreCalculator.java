package dev.blogpulse.service;

import dev.blogpulse.entity.PostEngagementStat;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Derived engagement metrics of a post, computed from its counters on every read.
 * <p>
 * {@code score = 100 * (w1*rate + w2*scroll + w3*time + w4*shares) / (w1 + w2 + w3 + w4)} where every
 * term is normalized to [0, 1]. The result is always within [0, 100], including for all-zero counters.
 */
@Component
@Getter
@Slf4j
public class EngagementScoreCalculator {

    public static final double MAX_SCORE = 100.0;

    private final double rateWeight;
    private final double scrollWeight;
    private final double timeWeight;
    private final double shareWeight;
    private final double timeBoundSeconds;
    private final double shareRateBound;

    public EngagementScoreCalculator(
            @Value("${analytics.engagement.weights.rate:0.4}") double rateWeight,
            @Value("${analytics.engagement.weights.scroll:0.2}") double scrollWeight,
            @Value("${analytics.engagement.weights.time:0.2}") double timeWeight,
            @Value("${analytics.engagement.weights.shares:0.2}") double shareWeight,
            @Value("${analytics.engagement.time-bound-seconds:300}") double timeBoundSeconds,
            @Value("${analytics.engagement.share-rate-bound:0.1}") double shareRateBound) {
        this.rateWeight = nonNegative(rateWeight);
        this.scrollWeight = nonNegative(scrollWeight);
        this.timeWeight = nonNegative(timeWeight);
        this.shareWeight = nonNegative(shareWeight);
        this.timeBoundSeconds = timeBoundSeconds;
        this.shareRateBound = shareRateBound;
    }

    public static EngagementScoreCalculator defaults() {
        return new EngagementScoreCalculator(0.4, 0.2, 0.2, 0.2, 300, 0.1);
    }

    /** Completions over views, where a completion is reaching the 100% checkpoint. */
    public double engagementRate(PostEngagementStat stat) {
        return ratio(stat.getScroll100Percent(), stat.getTotalViews());
    }

    /**
     * Mean deepest checkpoint per view, in percent. The scroll counters are cumulative, so the
     * readers who stopped at a threshold are the difference to the next one.
     */
    public double avgScrollDepth(PostEngagementStat stat) {
        long views = stat.getTotalViews();
        if (views <= 0) {
            return 0.0;
        }
        long at25 = Math.max(0, stat.getScroll25Percent() - stat.getScroll50Percent());
        long at50 = Math.max(0, stat.getScroll50Percent() - stat.getScroll75Percent());
        long at75 = Math.max(0, stat.getScroll75Percent() - stat.getScroll100Percent());
        long at100 = Math.max(0, stat.getScroll100Percent());
        double depth = (25.0 * at25 + 50.0 * at50 + 75.0 * at75 + 100.0 * at100) / views;
        return clamp(depth, 0, 100);
    }

    public double score(PostEngagementStat stat) {
        double weightSum = rateWeight + scrollWeight + timeWeight + shareWeight;
        if (weightSum <= 0 || stat.getTotalViews() <= 0) {
            return 0.0;
        }
        double rate = clamp(engagementRate(stat), 0, 1);
        double scroll = avgScrollDepth(stat) / 100.0;
        double time = timeBoundSeconds > 0 ? clamp(stat.getAvgTimeOnPage() / timeBoundSeconds, 0, 1) : 0.0;
        double shares = shareRateBound > 0
                ? clamp(ratio(stat.getTotalShares(), stat.getTotalViews()) / shareRateBound, 0, 1)
                : 0.0;
        double weighted = rateWeight * rate + scrollWeight * scroll + timeWeight * time + shareWeight * shares;
        double score = MAX_SCORE * weighted / weightSum;
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return round2(clamp(score, 0, MAX_SCORE));
    }

    /** Signups per 100 views. */
    public double conversionRate(PostEngagementStat stat) {
        return round2(ratio(stat.getNewsletterSignups(), stat.getTotalViews()) * 100.0);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static double ratio(long numerator, long denominator) {
        if (denominator <= 0 || numerator <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) numerator / denominator);
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static double nonNegative(double weight) {
        if (weight < 0 || Double.isNaN(weight)) {
            log.warn("Ignoring invalid engagement weight {}", weight);
            return 0.0;
        }
        return weight;
    }
}
