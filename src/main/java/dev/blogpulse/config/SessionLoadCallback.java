package dev.blogpulse.config;

import dev.blogpulse.entity.TrackingSession;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * A session read from {@code user_sessions} already exists, so a later save must update it.
 */
@Component
public class SessionLoadCallback implements AfterConvertCallback<TrackingSession> {

    @Override
    public Publisher<TrackingSession> onAfterConvert(TrackingSession session, SqlIdentifier table) {
        session.setNewRecord(false);
        return Mono.just(session);
    }
}
