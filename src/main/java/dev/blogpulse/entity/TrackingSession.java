package dev.blogpulse.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One visit: a run of page views with no gap longer than the inactivity timeout.
 * {@code source} and {@code landingPath} are locked when the session starts. The id is
 * generated before insert, so {@code newRecord} decides between INSERT and UPDATE.
 */
@Table("user_sessions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackingSession implements Persistable<UUID> {

    @Id
    private UUID id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("visitor_id")
    private String visitorId;

    @Column("user_id")
    private String userId;

    private String source;

    @Column("landing_path")
    private String landingPath;

    @Column("user_agent")
    private String userAgent;

    private String ip;

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("last_seen_at")
    private LocalDateTime lastSeenAt;

    @Column("ended_at")
    private LocalDateTime endedAt;

    @Column("page_count")
    @Builder.Default
    private Integer pageCount = 1;
}
