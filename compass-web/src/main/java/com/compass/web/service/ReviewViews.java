package com.compass.web.service;

import com.compass.common.dto.ReviewView;
import com.compass.web.entity.ReviewEntity;

/**
 * 实体到展示对象的转换。
 */
final class ReviewViews {

    private ReviewViews() {
    }

    static ReviewView of(ReviewEntity entity) {
        return ReviewView.builder()
                .id(entity.getId())
                .uniName(entity.getUniName())
                .city(entity.getCity())
                .sourceType(entity.getSourceType())
                .reviewerType(entity.getReviewerType())
                .status(entity.getStatus())
                .rawLanguage(entity.getRawLanguage())
                .rawReviewText(entity.getRawReviewText())
                .academicsScore(entity.getAcademicsScore())
                .costScore(entity.getCostScore())
                .socialScore(entity.getSocialScore())
                .accommodationScore(entity.getAccommodationScore())
                .overallSentiment(entity.getOverallSentiment())
                .themeSummary(entity.getThemeSummary())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
