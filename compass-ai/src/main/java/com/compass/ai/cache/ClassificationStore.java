package com.compass.ai.cache;

import com.compass.common.dto.ClassifierResult;
import com.compass.common.model.Language;

import java.util.Optional;

/**
 * 分类结果存储，按内容指纹寻址。
 * <p>
 * 条目只写一次、从不更新；当前不做淘汰，存储随不同文本数量线性增长。
 * 需要淘汰时在实现类中按 createdAt 清理即可，缓存语义不受影响（被淘汰的文本会重新分类一次）。
 * <ul>
 *   <li>{@link InMemoryClassificationStore}：进程内，默认</li>
 *   <li>JDBC 实现：落库，跨重启命中（web 模块）</li>
 * </ul>
 */
public interface ClassificationStore {

    Optional<ClassifierResult> find(String fingerprint);

    /**
     * 保存分类结果。同一指纹已存在时保留先写入的结果。
     */
    void save(String fingerprint, Language language, ClassifierResult result);

    long size();
}
