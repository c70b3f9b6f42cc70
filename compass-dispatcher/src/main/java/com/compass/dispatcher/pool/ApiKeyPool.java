package com.compass.dispatcher.pool;

import java.util.List;

/**
 * AI 服务 API Key 轮询池。
 * <p>
 * 提供两种实现：
 * - {@link InMemoryApiKeyPool}：内存实现，适合单机部署
 * - {@link RedisApiKeyPool}：Redis 实现，适合多实例部署
 */
public interface ApiKeyPool {

    /** 从池中借出一个可用 Key，超时仍无可用 Key 时抛出 KeyPoolExhaustedException */
    String borrowKey();

    /** 归还 Key 到池尾部 */
    void returnKey(String key);

    /** 标记 Key 为失败状态，冷却期满后才会被恢复 */
    void markFailed(String key);

    /** 向池中添加一个 Key，已在池中（含失败队列）的 Key 会被忽略 */
    boolean addKey(String key);

    /** 批量添加 Key，返回实际新增数量 */
    default int addKeys(List<String> keys) {
        int added = 0;
        for (String key : keys) {
            if (addKey(key)) {
                added++;
            }
        }
        return added;
    }

    /** 获取可用 Key 数量 */
    long availableCount();

    /** 获取失败 Key 数量 */
    long failedCount();

    /** 恢复冷却期已满的失败 Key 到可用池 */
    int recoverFailedKeys();
}
