package com.compass.dispatcher.service;

import com.compass.dispatcher.pool.ApiKeyPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 把冷却期满的失败 Key 放回可用池。
 * <p>
 * 每半个冷却期检查一次，失败 Key 最晚在 1.5 个冷却期后重新可用。
 * 可用池已空而冷却队列里还有 Key 时，批量导入和综述生成都会卡在借 Key 上，单独告警。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeyRecoveryScheduler {

    private final ApiKeyPool keyPool;

    @Scheduled(fixedDelayString = "#{${compass.dispatcher.key-cooldown-seconds:60} * 500}")
    public void recoverCooledDownKeys() {
        long coolingDown = keyPool.failedCount();
        if (coolingDown == 0) {
            return;
        }

        int recovered = keyPool.recoverFailedKeys();
        long available = keyPool.availableCount();
        if (recovered > 0) {
            log.info("恢复 {} 个 AI Key, 仍在冷却 {}, 当前可用 {}", recovered, coolingDown - recovered, available);
        } else if (available == 0) {
            log.warn("没有可用的 AI Key, {} 个仍在冷却, AI 调用将等待", coolingDown);
        } else {
            log.debug("{} 个 AI Key 仍在冷却, 当前可用 {}", coolingDown, available);
        }
    }
}
