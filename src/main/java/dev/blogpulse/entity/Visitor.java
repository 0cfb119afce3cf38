package dev.blogpulse.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Anonymous browser identity. The id is the token held in the {@code ps_vid} cookie.
 * {@code firstSource} is written once at creation and never updated.
 */
@Table("visitors")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Visitor {

    @Id
    private String id;

    @Column("first_source")
    private String firstSource;

    @Column("first_referrer")
    private String firstReferrer;

    @Column("landing_path")
    private String landingPath;

    @Column("user_id")
    private String userId;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("last_seen_at")
    private LocalDateTime lastSeenAt;
}
