package com.compass.common.exception;

/**
 * 暂时拿不到可用的 API Key。
 * <p>
 * 按原因区分：池空（等待超时）与限流可以稍后重试；调用线程被中断时应直接放弃。
 */
public class KeyPoolExhaustedException extends CompassException {

    public enum Reason {
        /** 等待超时仍没有可借出的 Key */
        POOL_EMPTY,
        /** 借到的 Key 都在限流窗口内用满了配额 */
        RATE_LIMITED,
        /** 等待借用时线程被中断 */
        INTERRUPTED
    }

    private final Reason reason;

    private KeyPoolExhaustedException(Reason reason, String message) {
        super(reason == Reason.RATE_LIMITED ? "KEY_RATE_LIMITED" : "KEY_EXHAUSTED", message);
        this.reason = reason;
    }

    public static KeyPoolExhaustedException poolEmpty(long waitedSeconds) {
        return new KeyPoolExhaustedException(Reason.POOL_EMPTY,
                "等待 " + waitedSeconds + " 秒后仍无可用 API Key，请稍后重试或添加更多 Key");
    }

    public static KeyPoolExhaustedException rateLimited(int attempts) {
        return new KeyPoolExhaustedException(Reason.RATE_LIMITED,
                "连续 " + attempts + " 个 Key 均已达速率限制，请稍后重试");
    }

    public static KeyPoolExhaustedException interrupted() {
        return new KeyPoolExhaustedException(Reason.INTERRUPTED, "等待借用 Key 时被中断");
    }

    public Reason getReason() {
        return reason;
    }

    /** 中断之外的原因都值得退避后再试 */
    public boolean isRetryable() {
        return reason != Reason.INTERRUPTED;
    }
}
