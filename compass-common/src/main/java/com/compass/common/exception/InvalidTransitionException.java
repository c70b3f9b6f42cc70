package com.compass.common.exception;

import com.compass.common.model.ReviewStatus;

/**
 * 审核状态机不允许的状态迁移（终态之间的冲突）。
 */
public class InvalidTransitionException extends CompassException {

    private final ReviewStatus from;
    private final ReviewStatus to;

    public InvalidTransitionException(Long reviewId, ReviewStatus from, ReviewStatus to) {
        super("INVALID_TRANSITION", "评论 " + reviewId + " 当前状态为 " + from.wireName()
                + "，无法变更为 " + to.wireName());
        this.from = from;
        this.to = to;
    }

    public ReviewStatus getFrom() {
        return from;
    }

    public ReviewStatus getTo() {
        return to;
    }
}
