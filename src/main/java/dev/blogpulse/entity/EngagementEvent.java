package dev.blogpulse.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Table("blog_engagement_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngagementEvent {

    @Id
    private Long id;

    @Column("post_id")
    private Long postId;

    @Column("session_id")
    private String sessionId;

    @Column("visitor_id")
    private String visitorId;

    @Column("event_type")
    private String eventType;

    // scroll depth or seconds on page, depending on the event type
    @Column("metric_value")
    private Integer metricValue;

    // share platform or CTA id
    private String label;

    // JSON payload as sent by the client
    @Column("event_data")
    private String eventData;

    @Column("occurred_at")
    private LocalDateTime occurredAt;
}
