package dev.blogpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelinePoint {
    private LocalDate date;
    private long views;
    private long uniqueVisitors;
    private long completions;
    private double engagementRate;
    private double avgTimeOnPage;
    private long shares;
    private long newsletterSignups;
}
