package com.compass.web.service;

import com.compass.common.dto.ReviewView;
import com.compass.common.exception.InvalidTransitionException;
import com.compass.common.exception.NotFoundException;
import com.compass.common.model.ReviewStatus;
import com.compass.common.util.Timestamps;
import com.compass.web.entity.ReviewEntity;
import com.compass.web.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 用户提交评论的审核状态机：PENDING → APPROVED / REJECTED，后两者为终态。
 * <p>
 * 重复执行同一操作是幂等的；终态之间的变更被拒绝。审核口令由调用方校验。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationService {

    private final ReviewRepository reviewRepository;
    private final AggregateCache aggregateCache;

    /** 待审核评论，先提交的在前 */
    public List<ReviewView> listPending() {
        return reviewRepository.findByStatusOldestFirst(ReviewStatus.PENDING.name()).stream()
                .map(ReviewViews::of)
                .toList();
    }

    @Transactional
    public ReviewView approve(Long reviewId) {
        return transition(reviewId, ReviewStatus.APPROVED);
    }

    @Transactional
    public ReviewView reject(Long reviewId) {
        return transition(reviewId, ReviewStatus.REJECTED);
    }

    private ReviewView transition(Long reviewId, ReviewStatus target) {
        ReviewEntity review = reviewRepository.findById(reviewId)
                .orElseThrow(() -> new NotFoundException("评论不存在: " + reviewId));
        ReviewStatus current = review.getStatus();

        if (current == target) {
            log.debug("评论 {} 已是 {}，忽略重复操作", reviewId, target);
            return ReviewViews.of(review);
        }
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(reviewId, current, target);
        }

        String now = Timestamps.now();
        int updated = reviewRepository.transitionStatus(reviewId, current.name(), target.name(), now);
        if (updated == 0) {
            // 读取之后被并发审核改过，以库中最新状态为准
            ReviewEntity latest = reviewRepository.findById(reviewId)
                    .orElseThrow(() -> new NotFoundException("评论不存在: " + reviewId));
            if (latest.getStatus() == target) {
                return ReviewViews.of(latest);
            }
            throw new InvalidTransitionException(reviewId, latest.getStatus(), target);
        }

        review.setStatus(target);
        review.setModeratedAt(now);
        if (target == ReviewStatus.APPROVED) {
            aggregateCache.invalidate(review.getUniName());
        }
        log.info("评论 {} 审核: {} -> {}", reviewId, current, target);
        return ReviewViews.of(review);
    }
}
