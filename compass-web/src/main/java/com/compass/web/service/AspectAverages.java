package com.compass.web.service;

import com.compass.common.dto.AspectMeans;
import com.compass.common.model.Aspect;
import com.compass.web.entity.ReviewEntity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * 方面均值计算。
 * <p>
 * 每个方面只统计有该项评分的评论，没有任何贡献时为 null；
 * 各项均值 HALF_UP 保留两位，总分为已有各项（已取整）均值的平均，同样保留两位。
 */
final class AspectAverages {

    private static final int SCALE = 2;

    private AspectAverages() {
    }

    /** 按量加权：每条评论权重相同 */
    static AspectMeans volumeWeighted(List<ReviewEntity> reviews) {
        return weighted(reviews, review -> 1.0);
    }

    static AspectMeans weighted(List<ReviewEntity> reviews, ToDoubleFunction<ReviewEntity> weightOf) {
        Map<Aspect, BigDecimal> weightedSums = new EnumMap<>(Aspect.class);
        Map<Aspect, BigDecimal> totalWeights = new EnumMap<>(Aspect.class);
        int scored = 0;

        for (ReviewEntity review : reviews) {
            if (!hasAnyScore(review)) {
                continue;
            }
            scored++;
            BigDecimal weight = BigDecimal.valueOf(weightOf.applyAsDouble(review));
            for (Aspect aspect : Aspect.values()) {
                Integer score = scoreOf(review, aspect);
                if (score == null) {
                    continue;
                }
                weightedSums.merge(aspect, weight.multiply(BigDecimal.valueOf(score)), BigDecimal::add);
                totalWeights.merge(aspect, weight, BigDecimal::add);
            }
        }

        Map<Aspect, BigDecimal> means = new EnumMap<>(Aspect.class);
        for (Aspect aspect : Aspect.values()) {
            BigDecimal total = totalWeights.get(aspect);
            if (total != null && total.signum() > 0) {
                means.put(aspect, weightedSums.get(aspect).divide(total, SCALE, RoundingMode.HALF_UP));
            }
        }

        return AspectMeans.builder()
                .avgAcademics(means.get(Aspect.ACADEMICS))
                .avgCost(means.get(Aspect.COST))
                .avgSocial(means.get(Aspect.SOCIAL))
                .avgAccommodation(means.get(Aspect.ACCOMMODATION))
                .overallScore(overall(new ArrayList<>(means.values())))
                .scoredCount(scored)
                .build();
    }

    static boolean hasAnyScore(ReviewEntity review) {
        for (Aspect aspect : Aspect.values()) {
            if (scoreOf(review, aspect) != null) {
                return true;
            }
        }
        return false;
    }

    static Integer scoreOf(ReviewEntity review, Aspect aspect) {
        switch (aspect) {
            case ACADEMICS:
                return review.getAcademicsScore();
            case COST:
                return review.getCostScore();
            case SOCIAL:
                return review.getSocialScore();
            default:
                return review.getAccommodationScore();
        }
    }

    private static BigDecimal overall(List<BigDecimal> presentMeans) {
        if (presentMeans.isEmpty()) {
            return null;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal mean : presentMeans) {
            sum = sum.add(mean);
        }
        return sum.divide(BigDecimal.valueOf(presentMeans.size()), SCALE, RoundingMode.HALF_UP);
    }
}
