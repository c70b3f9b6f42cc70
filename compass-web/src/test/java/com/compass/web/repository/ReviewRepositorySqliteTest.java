package com.compass.web.repository;

import com.compass.ai.agent.SummarySynthesizer;
import com.compass.ai.config.AiProperties;
import com.compass.common.dto.AspectScores;
import com.compass.common.dto.ClassifierResult;
import com.compass.common.dto.UniversityAggregate;
import com.compass.common.exception.NotFoundException;
import com.compass.common.model.Language;
import com.compass.common.model.ReviewStatus;
import com.compass.common.model.ReviewerType;
import com.compass.common.model.Sentiment;
import com.compass.common.model.SourceType;
import com.compass.web.config.PipelineProperties;
import com.compass.web.entity.ReviewEntity;
import com.compass.web.service.AggregateCache;
import com.compass.web.service.AggregationService;
import com.compass.web.service.JdbcClassificationStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.jdbc.DataJdbcTest;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * 在真实 SQLite 上跑仓库 SQL、schema 约束和枚举映射。
 */
@DataJdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ReviewRepositorySqliteTest {

    private static final String AALEN = "Aalen University";

    private static final Path DB_FILE = createDbFile();

    private final AtomicInteger sequence = new AtomicInteger();

    @Autowired
    private ReviewRepository reviewRepository;
    @Autowired
    private ClassificationCacheRepository classificationCacheRepository;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    private AggregationService aggregationService;
    private AggregateCache aggregateCache;

    @DynamicPropertySource
    static void sqlite(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", () -> "jdbc:sqlite:" + DB_FILE);
        registry.add("spring.datasource.driver-class-name", () -> "org.sqlite.JDBC");
        registry.add("spring.sql.init.mode", () -> "always");
    }

    @BeforeEach
    void setUp() {
        AiProperties aiProperties = new AiProperties();
        aggregateCache = new AggregateCache(aiProperties);
        aggregationService = new AggregationService(reviewRepository, aggregateCache,
                mock(SummarySynthesizer.class), new PipelineProperties(), aiProperties);
    }

    @Test
    void pendingAndRejectedRowsNeverReachTheAggregate() {
        reviewRepository.save(review(AALEN, SourceType.SURVEY, ReviewStatus.APPROVED, 4, 2, 5, 3));
        reviewRepository.save(review(AALEN, SourceType.WEB_SCRAPE, ReviewStatus.APPROVED, 2, 4, null, null));
        reviewRepository.save(review(AALEN, SourceType.USER_SUBMITTED, ReviewStatus.PENDING, 1, 1, 1, 1));
        reviewRepository.save(review(AALEN, SourceType.USER_SUBMITTED, ReviewStatus.REJECTED, 1, 1, 1, 1));

        UniversityAggregate aggregate = aggregationService.aggregate(AALEN);

        assertThat(aggregate.getReviewCount()).isEqualTo(2);
        assertThat(aggregate.getAvgAcademics()).isEqualByComparingTo("3.00");
        assertThat(aggregate.getAvgCost()).isEqualByComparingTo("3.00");
        assertThat(aggregate.getAvgSocial()).isEqualByComparingTo("5.00");
        assertThat(aggregate.getAvgAccommodation()).isEqualByComparingTo("3.00");
        assertThat(aggregate.getOverallScore()).isEqualByComparingTo("3.50");
    }

    @Test
    void universityWithOnlyPendingRowsIsNotFound() {
        reviewRepository.save(review(AALEN, SourceType.USER_SUBMITTED, ReviewStatus.PENDING, 5, 5, 5, 5));

        assertThatThrownBy(() -> aggregationService.aggregate(AALEN)).isInstanceOf(NotFoundException.class);
        assertThat(reviewRepository.findAllApproved()).isEmpty();
    }

    @Test
    void approvingAPendingRowChangesTheAggregate() {
        reviewRepository.save(review(AALEN, SourceType.SURVEY, ReviewStatus.APPROVED, 4, 4, 4, 4));
        ReviewEntity pending = reviewRepository.save(
                review(AALEN, SourceType.USER_SUBMITTED, ReviewStatus.PENDING, 2, 2, 2, 2));
        assertThat(aggregationService.aggregate(AALEN).getOverallScore()).isEqualByComparingTo("4.00");

        int updated = reviewRepository.transitionStatus(pending.getId(),
                ReviewStatus.PENDING.name(), ReviewStatus.APPROVED.name(), "2024-05-03 12:00:00");
        aggregateCache.invalidate(AALEN);

        assertThat(updated).isEqualTo(1);
        UniversityAggregate aggregate = aggregationService.aggregate(AALEN);
        assertThat(aggregate.getReviewCount()).isEqualTo(2);
        assertThat(aggregate.getOverallScore()).isEqualByComparingTo("3.00");
    }

    @Test
    void transitionOnlyAppliesFromTheExpectedStatus() {
        ReviewEntity pending = reviewRepository.save(
                review(AALEN, SourceType.USER_SUBMITTED, ReviewStatus.PENDING, 3, 3, 3, 3));

        int first = reviewRepository.transitionStatus(pending.getId(),
                ReviewStatus.PENDING.name(), ReviewStatus.REJECTED.name(), "2024-05-03 12:00:00");
        int second = reviewRepository.transitionStatus(pending.getId(),
                ReviewStatus.PENDING.name(), ReviewStatus.APPROVED.name(), "2024-05-03 12:00:01");

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        ReviewEntity stored = reviewRepository.findById(pending.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(ReviewStatus.REJECTED);
        assertThat(stored.getModeratedAt()).isEqualTo("2024-05-03 12:00:00");
        assertThat(reviewRepository.countByStatus(ReviewStatus.PENDING.name())).isZero();
    }

    @Test
    void enumsAreStoredByName() {
        ReviewEntity saved = reviewRepository.save(
                review(AALEN, SourceType.WEB_SCRAPE, ReviewStatus.APPROVED, 3, null, null, null));

        Map<String, Object> row = jdbcTemplate.queryForMap(
                "SELECT status, source_type, reviewer_type, raw_language FROM t_review WHERE id = ?", saved.getId());

        assertThat(row).containsEntry("status", "APPROVED")
                .containsEntry("source_type", "WEB_SCRAPE")
                .containsEntry("reviewer_type", "AI_PROCESSED")
                .containsEntry("raw_language", "EN");
        assertThat(reviewRepository.countSameContent(AALEN, saved.getContentFingerprint(), "WEB_SCRAPE"))
                .isEqualTo(1);
    }

    @Test
    void outOfRangeScoreIsRejectedByTheSchema() {
        ReviewEntity invalid = review(AALEN, SourceType.SURVEY, ReviewStatus.APPROVED, 6, 3, 3, 3);

        assertThatThrownBy(() -> reviewRepository.save(invalid))
                .rootCause()
                .hasMessageContaining("CHECK constraint failed");
    }

    @Test
    void sameFingerprintIsStoredOnceAndFirstResultWins() {
        JdbcClassificationStore store = new JdbcClassificationStore(classificationCacheRepository, new ObjectMapper());

        store.save("fp-aalen", Language.EN, classified(4, "Strong labs."));
        store.save("fp-aalen", Language.EN, classified(1, "Written second."));

        assertThat(store.size()).isEqualTo(1);
        ClassifierResult kept = store.find("fp-aalen").orElseThrow();
        assertThat(kept.getSummary()).isEqualTo("Strong labs.");
        assertThat(kept.getScores().getAcademics()).isEqualTo(4);
    }

    private ReviewEntity review(String uniName, SourceType source, ReviewStatus status,
                                Integer academics, Integer cost, Integer social, Integer accommodation) {
        int n = sequence.incrementAndGet();
        return ReviewEntity.builder()
                .uniName(uniName)
                .city("Aalen")
                .sourceType(source)
                .reviewerType(source == SourceType.USER_SUBMITTED ? ReviewerType.USER_SUBMITTED : ReviewerType.AI_PROCESSED)
                .status(status)
                .rawReviewText("review " + n)
                .rawLanguage(Language.EN)
                .contentFingerprint("fp-" + n)
                .academicsScore(academics)
                .costScore(cost)
                .socialScore(social)
                .accommodationScore(accommodation)
                .overallSentiment(Sentiment.NEUTRAL)
                .createdAt("2024-05-01 10:00:0" + n)
                .build();
    }

    private static ClassifierResult classified(int academics, String summary) {
        return ClassifierResult.builder()
                .scores(new AspectScores(academics, 3, 3, 3))
                .summary(summary)
                .sentiment(Sentiment.NEUTRAL)
                .build();
    }

    private static Path createDbFile() {
        try {
            Path file = Files.createTempFile("compass-repository-", ".db");
            file.toFile().deleteOnExit();
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
