package dev.blogpulse.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only record of one accepted beacon. {@code sessionId} is null when the
 * visitor or session stage failed and the beacon was logged as plain traffic.
 */
@Table("page_view_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageViewEvent {

    @Id
    private Long id;

    @Column("session_id")
    private UUID sessionId;

    @Column("occurred_at")
    private LocalDateTime occurredAt;

    private String path;

    private String referrer;

    private String source;

    private String ip;

    @Column("user_agent")
    private String userAgent;
}
