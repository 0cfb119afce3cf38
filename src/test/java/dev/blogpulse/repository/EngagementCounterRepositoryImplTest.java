package dev.blogpulse.repository;

import dev.blogpulse.entity.SourceCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.r2dbc.core.FetchSpec;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("EngagementCounterRepositoryImpl")
class EngagementCounterRepositoryImplTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Mock
    private DatabaseClient databaseClient;

    @InjectMocks
    private EngagementCounterRepositoryImpl repository;

    private GenericExecuteSpec executeSpec;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        executeSpec = mock(GenericExecuteSpec.class);
        FetchSpec<Map<String, Object>> fetchSpec = mock(FetchSpec.class);
        lenient().when(databaseClient.sql(anyString())).thenReturn(executeSpec);
        lenient().when(executeSpec.bind(anyString(), any())).thenReturn(executeSpec);
        lenient().when(executeSpec.fetch()).thenReturn(fetchSpec);
        lenient().when(fetchSpec.rowsUpdated()).thenReturn(Mono.just(1L));
    }

    private String executedSql() {
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(databaseClient).sql(sql.capture());
        return sql.getValue();
    }

    @Test
    @DisplayName("Should increment every requested column in one statement")
    void incrementsInPlace() {
        StepVerifier.create(repository.increment(1L, List.of("total_shares", "twitter_shares"), NOW))
                .expectNext(1L)
                .verifyComplete();

        assertThat(executedSql())
                .contains("total_shares = total_shares + 1")
                .contains("twitter_shares = twitter_shares + 1")
                .contains("WHERE post_id = :postId");
        verify(executeSpec).bind("postId", 1L);
    }

    @Test
    @DisplayName("Should refuse a column that is not a counter")
    void rejectsUnknownColumn() {
        StepVerifier.create(repository.increment(1L, List.of("total_views; DROP TABLE visitors"), NOW))
                .expectError(IllegalArgumentException.class)
                .verify();
        verifyNoInteractions(databaseClient);
    }

    @Test
    @DisplayName("Should do nothing for an empty column list")
    void emptyColumns() {
        StepVerifier.create(repository.increment(1L, List.of(), NOW))
                .expectNext(0L)
                .verifyComplete();
        verifyNoInteractions(databaseClient);
    }

    @Test
    @DisplayName("Should bump the source column of the view")
    void recordView() {
        StepVerifier.create(repository.recordView(1L, SourceCategory.INSTAGRAM, true, NOW))
                .expectNext(1L)
                .verifyComplete();

        assertThat(executedSql())
                .contains("total_views = total_views + 1")
                .contains("source_instagram = source_instagram + 1");
        verify(executeSpec).bind("uniqueIncrement", 1);
    }

    @Test
    @DisplayName("Should fold time samples into a running mean")
    void recordTimeSample() {
        StepVerifier.create(repository.recordTimeSample(1L, 120, NOW))
                .expectNext(1L)
                .verifyComplete();

        assertThat(executedSql()).contains("(:sample - avg_time_on_page) / (time_samples + 1)");
        verify(executeSpec).bind("seconds", 120L);
    }

    @Test
    @DisplayName("Should map a missing source to the other column")
    void sourceColumn() {
        assertThat(EngagementCounterRepositoryImpl.sourceColumn(null)).isEqualTo("source_other");
        assertThat(EngagementCounterRepositoryImpl.sourceColumn(SourceCategory.GOOGLE)).isEqualTo("source_google");
    }
}
