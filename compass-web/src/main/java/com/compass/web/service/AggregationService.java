package com.compass.web.service;

import com.compass.ai.agent.SummarySynthesizer;
import com.compass.ai.config.AiProperties;
import com.compass.common.dto.AspectMeans;
import com.compass.common.dto.ReviewView;
import com.compass.common.dto.UniversityAggregate;
import com.compass.common.dto.UniversitySummary;
import com.compass.common.exception.NotFoundException;
import com.compass.common.model.TrustTier;
import com.compass.common.util.Fingerprints;
import com.compass.common.util.Names;
import com.compass.web.config.PipelineProperties;
import com.compass.web.entity.ReviewEntity;
import com.compass.web.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 院校聚合：只读审核通过的评论，结果可随时由评论重建。
 * <p>
 * 顶层均值按量加权；另给出按可信度加权的均值和按可信度分层的明细。
 * 聚合结果与综述经 {@link AggregateCache} 缓存。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final ReviewRepository reviewRepository;
    private final AggregateCache aggregateCache;
    private final SummarySynthesizer summarySynthesizer;
    private final PipelineProperties pipelineProperties;
    private final AiProperties aiProperties;

    /**
     * 单个院校的完整聚合（含综述）。
     *
     * @throws NotFoundException 没有任何审核通过的评论
     */
    public UniversityAggregate aggregate(String uniName) {
        String name = Names.canonical(uniName);
        if (name == null) {
            throw new NotFoundException("院校名为空");
        }
        return aggregateCache.getAggregate(name, this::buildAggregate);
    }

    /**
     * 院校列表，每个有审核通过评论的院校一行，按名称排序。
     *
     * @param major 专业过滤（可选，大小写不敏感）
     */
    public List<UniversitySummary> listUniversities(String major) {
        String majorFilter = Names.canonical(major);

        Map<String, List<ReviewEntity>> byUniversity = new LinkedHashMap<>();
        for (ReviewEntity review : reviewRepository.findAllApproved()) {
            byUniversity.computeIfAbsent(review.getUniName(), k -> new ArrayList<>()).add(review);
        }

        List<UniversitySummary> rows = new ArrayList<>();
        for (Map.Entry<String, List<ReviewEntity>> entry : byUniversity.entrySet()) {
            List<ReviewEntity> reviews = entry.getValue();
            if (majorFilter != null && reviews.stream().noneMatch(r -> majorFilter.equalsIgnoreCase(r.getMajor()))) {
                continue;
            }
            AspectMeans means = AspectAverages.volumeWeighted(reviews);
            rows.add(UniversitySummary.builder()
                    .uniName(entry.getKey())
                    .city(latestCity(reviews))
                    .overallScore(means.getOverallScore())
                    .avgAcademics(means.getAvgAcademics())
                    .avgCost(means.getAvgCost())
                    .avgSocial(means.getAvgSocial())
                    .avgAccommodation(means.getAvgAccommodation())
                    .reviewCount(reviews.size())
                    .build());
        }
        rows.sort(Comparator.comparing(UniversitySummary::getUniName));
        return rows;
    }

    /**
     * 某院校审核通过的评论，最新在前；院校不存在时为空列表。
     */
    public List<ReviewView> approvedReviews(String uniName) {
        String name = Names.canonical(uniName);
        if (name == null) {
            return List.of();
        }
        return reviewRepository.findApprovedByUniName(name).stream()
                .map(ReviewViews::of)
                .toList();
    }

    /**
     * 某院校的综述（独立接口），没有可用综述时为空。
     */
    public Optional<String> summary(String uniName) {
        return Optional.ofNullable(aggregate(uniName).getThemeSummary());
    }

    private UniversityAggregate buildAggregate(String uniName) {
        List<ReviewEntity> approved = reviewRepository.findApprovedByUniName(uniName);
        if (approved.isEmpty()) {
            throw new NotFoundException("院校不存在或暂无审核通过的评论: " + uniName);
        }

        List<ReviewEntity> scored = approved.stream().filter(AspectAverages::hasAnyScore).toList();
        AspectMeans volume = AspectAverages.volumeWeighted(scored);
        PipelineProperties.TrustWeights weights = pipelineProperties.getTrustWeights();
        AspectMeans trustWeighted = AspectAverages.weighted(scored,
                review -> weights.weightOf(review.getSourceType().trustTier()));

        Map<String, AspectMeans> byTrust = new LinkedHashMap<>();
        for (TrustTier tier : TrustTier.values()) {
            List<ReviewEntity> tierReviews = scored.stream()
                    .filter(r -> r.getSourceType().trustTier() == tier)
                    .toList();
            byTrust.put(tier.wireName(), AspectAverages.volumeWeighted(tierReviews));
        }

        List<Long> contributingIds = scored.stream()
                .map(ReviewEntity::getId)
                .sorted()
                .toList();

        String summary = summarize(uniName, approved).orElse(null);

        log.debug("院校 {} 聚合完成: 审核通过 {} 条, 已评分 {} 条", uniName, approved.size(), scored.size());

        return UniversityAggregate.builder()
                .uniName(uniName)
                .city(latestCity(approved))
                .reviewCount(approved.size())
                .avgAcademics(volume.getAvgAcademics())
                .avgCost(volume.getAvgCost())
                .avgSocial(volume.getAvgSocial())
                .avgAccommodation(volume.getAvgAccommodation())
                .overallScore(volume.getOverallScore())
                .trustWeighted(trustWeighted)
                .byTrust(byTrust)
                .contributingIds(contributingIds)
                .themeSummary(summary)
                .build();
    }

    /**
     * 最近 N 条评论的摘要（没有摘要时用正文）交给 AI 合成综述。
     *
     * @param approvedNewestFirst 审核通过的评论，最新在前
     */
    private Optional<String> summarize(String uniName, List<ReviewEntity> approvedNewestFirst) {
        List<ReviewEntity> recent = approvedNewestFirst.stream()
                .limit(aiProperties.getSummary().getMaxReviews())
                .toList();
        if (recent.isEmpty()) {
            return Optional.empty();
        }

        List<String> snippets = recent.stream()
                .map(r -> r.getThemeSummary() != null && !r.getThemeSummary().isBlank()
                        ? r.getThemeSummary()
                        : r.getRawReviewText())
                .toList();
        List<Long> ids = recent.stream().map(ReviewEntity::getId).sorted().toList();

        return aggregateCache.getSummary(uniName, Fingerprints.ofIds(ids),
                () -> summarySynthesizer.synthesize(uniName, snippets));
    }

    private static String latestCity(List<ReviewEntity> reviews) {
        return reviews.stream()
                .max(Comparator.comparing(ReviewEntity::getId))
                .map(ReviewEntity::getCity)
                .orElse(null);
    }
}
