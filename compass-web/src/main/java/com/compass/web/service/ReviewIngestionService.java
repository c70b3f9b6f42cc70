package com.compass.web.service;

import com.compass.ai.agent.AspectScorer;
import com.compass.ai.agent.ScoringOutcome;
import com.compass.common.dto.AspectScores;
import com.compass.common.dto.ClassifierResult;
import com.compass.common.dto.IngestionReport;
import com.compass.common.dto.RawReviewRow;
import com.compass.common.dto.ReviewSubmission;
import com.compass.common.dto.SubmissionReceipt;
import com.compass.common.exception.EmptyContentException;
import com.compass.common.exception.ValidationException;
import com.compass.common.model.Aspect;
import com.compass.common.model.ReviewerType;
import com.compass.common.model.SourceType;
import com.compass.common.util.Fingerprints;
import com.compass.common.util.IdGenerator;
import com.compass.common.util.Names;
import com.compass.common.util.Timestamps;
import com.compass.dispatcher.service.DispatcherService;
import com.compass.text.model.NormalizedText;
import com.compass.text.service.ReviewNormalizer;
import com.compass.web.config.PipelineProperties;
import com.compass.web.entity.ReviewEntity;
import com.compass.web.repository.ReviewRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 评论导入流水线：清洗 → 查缓存/AI 评分 → 入库。
 * <p>
 * 两个入口：
 * - 批量导入（问卷、爬虫）：AI 评分，直接审核通过，单行失败不影响整批
 * - 用户提交：自评分数为准，进入待审核
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewIngestionService {

    private final ReviewNormalizer normalizer;
    private final AspectScorer scorer;
    private final ReviewRepository reviewRepository;
    private final DispatcherService dispatcher;
    private final AggregateCache aggregateCache;
    private final PipelineProperties properties;

    /** 单行处理结果 */
    enum RowStatus {
        SUCCEEDED, SCORING_FAILED, CONTENT_REJECTED, INVALID, DUPLICATE, FAILED
    }

    @Getter
    @AllArgsConstructor
    static class RowResult {

        private final RowStatus status;
        private final Long id;

        static RowResult of(RowStatus status) {
            return new RowResult(status, null);
        }
    }

    // ==================== 批量导入 ====================

    /**
     * 批量导入。调度线程被中断时停止调度，未处理的行计为 skipped，已入库的保留。
     */
    public IngestionReport ingestBatch(List<RawReviewRow> rows) {
        long startTime = System.currentTimeMillis();
        String batchId = IdGenerator.withPrefix("batch");
        log.info("开始批量导入 {}, 共 {} 行", batchId, rows.size());

        Set<String> seenInBatch = ConcurrentHashMap.newKeySet();
        List<RowResult> results = dispatcher.dispatchAll(rows, row -> ingestRow(row, seenInBatch));

        IngestionReport report = IngestionReport.builder()
                .batchId(batchId)
                .total(rows.size())
                .build();
        List<Long> createdIds = new ArrayList<>();
        for (RowResult result : results) {
            if (result == null) {
                report.setSkipped(report.getSkipped() + 1);
                continue;
            }
            switch (result.getStatus()) {
                case SUCCEEDED:
                    report.setSucceeded(report.getSucceeded() + 1);
                    break;
                case SCORING_FAILED:
                    report.setScoringFailed(report.getScoringFailed() + 1);
                    break;
                case CONTENT_REJECTED:
                    report.setContentRejected(report.getContentRejected() + 1);
                    break;
                case INVALID:
                    report.setInvalid(report.getInvalid() + 1);
                    break;
                case DUPLICATE:
                    report.setDuplicate(report.getDuplicate() + 1);
                    break;
                default:
                    report.setFailed(report.getFailed() + 1);
            }
            if (result.getId() != null) {
                createdIds.add(result.getId());
            }
        }
        report.setCreatedIds(createdIds);
        report.setProcessingTimeMs(System.currentTimeMillis() - startTime);

        log.info("批量导入 {} 完成, 耗时 {}ms: 成功 {}, 评分失败 {}, 无正文 {}, 无效 {}, 重复 {}, 异常 {}, 跳过 {}",
                batchId, report.getProcessingTimeMs(), report.getSucceeded(), report.getScoringFailed(),
                report.getContentRejected(), report.getInvalid(), report.getDuplicate(),
                report.getFailed(), report.getSkipped());
        return report;
    }

    RowResult ingestRow(RawReviewRow row, Set<String> seenInBatch) {
        try {
            String uniName = Names.canonical(row.getUniName());
            String city = Names.canonical(row.getCity());
            if (uniName == null || city == null) {
                log.debug("跳过缺少院校或城市的行");
                return RowResult.of(RowStatus.INVALID);
            }
            SourceType sourceType = row.getSourceType() != null ? row.getSourceType() : SourceType.SURVEY;

            NormalizedText normalized;
            try {
                normalized = normalizer.normalize(row.getRawReviewText(), sourceType);
            } catch (EmptyContentException e) {
                log.debug("院校 {} 的一行无可用正文: {}", uniName, e.getMessage());
                return RowResult.of(RowStatus.CONTENT_REJECTED);
            }

            String fingerprint = Fingerprints.ofContent(normalized.getLanguage().tag(), normalized.getCleanText());
            if (properties.isSkipDuplicateBatchRows()) {
                String dedupeKey = uniName + '\u0000' + fingerprint + '\u0000' + sourceType.name();
                if (!seenInBatch.add(dedupeKey)
                        || reviewRepository.countSameContent(uniName, fingerprint, sourceType.name()) > 0) {
                    log.debug("院校 {} 的重复内容已跳过: {}", uniName, Fingerprints.shortForm(fingerprint));
                    return RowResult.of(RowStatus.DUPLICATE);
                }
            }

            ScoringOutcome outcome = scorer.score(normalized.getCleanText(), normalized.getLanguage());
            ClassifierResult classified = outcome.getResult();
            AspectScores scores = classified != null ? classified.getScores() : new AspectScores();

            ReviewEntity entity = ReviewEntity.builder()
                    .uniName(uniName)
                    .city(city)
                    .major(Names.canonical(row.getMajor()))
                    .sourceType(sourceType)
                    .reviewerType(ReviewerType.AI_PROCESSED)
                    .status(ReviewerType.AI_PROCESSED.initialStatus())
                    .rawReviewText(normalized.getCleanText())
                    .rawLanguage(normalized.getLanguage())
                    .contentFingerprint(fingerprint)
                    .academicsScore(scores.getAcademics())
                    .costScore(scores.getCost())
                    .socialScore(scores.getSocial())
                    .accommodationScore(scores.getAccommodation())
                    .overallSentiment(classified != null ? classified.getSentiment() : null)
                    .themeSummary(classified != null ? classified.getSummary() : null)
                    .createdAt(Timestamps.now())
                    .build();
            entity = reviewRepository.save(entity);
            aggregateCache.invalidate(uniName);

            return new RowResult(outcome.isSuccess() ? RowStatus.SUCCEEDED : RowStatus.SCORING_FAILED, entity.getId());

        } catch (RuntimeException e) {
            log.error("导入行处理异常", e);
            return RowResult.of(RowStatus.FAILED);
        }
    }

    // ==================== 用户提交 ====================

    /**
     * 用户提交评论：校验 → 清洗 → 入库待审核。
     * <p>
     * 用户自评分数原样保存；开启提交评分时只用 AI 补充摘要与情感，失败则留空。
     *
     * @throws ValidationException   必填字段缺失或分数越界（不会调用 AI）
     * @throws EmptyContentException 清洗后无可用正文
     */
    public SubmissionReceipt ingestSubmission(ReviewSubmission submission) {
        String uniName = Names.canonical(submission.getUniName());
        String city = Names.canonical(submission.getCity());
        validate(submission, uniName, city);

        NormalizedText normalized = normalizer.normalize(submission.getRawReviewText(), SourceType.USER_SUBMITTED);
        String fingerprint = Fingerprints.ofContent(normalized.getLanguage().tag(), normalized.getCleanText());

        ReviewEntity entity = ReviewEntity.builder()
                .uniName(uniName)
                .city(city)
                .major(Names.canonical(submission.getMajor()))
                .sourceType(SourceType.USER_SUBMITTED)
                .reviewerType(ReviewerType.USER_SUBMITTED)
                .status(ReviewerType.USER_SUBMITTED.initialStatus())
                .rawReviewText(normalized.getCleanText())
                .rawLanguage(normalized.getLanguage())
                .contentFingerprint(fingerprint)
                .academicsScore(submission.getAcademicsScore())
                .costScore(submission.getCostScore())
                .socialScore(submission.getSocialScore())
                .accommodationScore(submission.getAccommodationScore())
                .createdAt(Timestamps.now())
                .build();

        if (properties.isScoreSubmissions()) {
            ScoringOutcome outcome = scorer.score(normalized.getCleanText(), normalized.getLanguage());
            if (outcome.isSuccess()) {
                entity.setThemeSummary(outcome.getResult().getSummary());
                entity.setOverallSentiment(outcome.getResult().getSentiment());
            }
        }

        entity = reviewRepository.save(entity);
        log.info("收到用户提交 {}: 院校 {}, 正文 {} 字符, 待审核", entity.getId(), uniName,
                normalized.getCleanText().length());
        return new SubmissionReceipt(entity.getId(), entity.getStatus());
    }

    private void validate(ReviewSubmission submission, String uniName, String city) {
        List<String> errors = new ArrayList<>();
        if (uniName == null) {
            errors.add("uni_name 不能为空");
        }
        if (city == null) {
            errors.add("city 不能为空");
        }
        AspectScores scores = submission.toScores();
        for (Aspect aspect : Aspect.values()) {
            Integer score = scores.get(aspect);
            if (score != null && !Aspect.inRange(score)) {
                errors.add(aspect.key() + "_score 必须在 " + Aspect.MIN_SCORE + "-" + Aspect.MAX_SCORE + " 之间");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
