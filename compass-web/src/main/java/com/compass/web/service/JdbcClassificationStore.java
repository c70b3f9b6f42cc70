package com.compass.web.service;

import com.compass.ai.cache.ClassificationStore;
import com.compass.common.dto.ClassifierResult;
import com.compass.common.model.Language;
import com.compass.common.util.Fingerprints;
import com.compass.common.util.Timestamps;
import com.compass.web.entity.ClassificationCacheEntity;
import com.compass.web.repository.ClassificationCacheRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 落库的分类缓存，重启后重跑同一批数据仍然命中。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "compass.cache.storage-type", havingValue = "jdbc")
public class JdbcClassificationStore implements ClassificationStore {

    private final ClassificationCacheRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<ClassifierResult> find(String fingerprint) {
        return repository.findByFingerprint(fingerprint).map(this::fromJson);
    }

    @Override
    public void save(String fingerprint, Language language, ClassifierResult result) {
        int inserted = repository.insertIfAbsent(fingerprint, language.tag(), toJson(result), Timestamps.now());
        if (inserted == 0) {
            // 另一实例先写入了同一指纹
            log.debug("分类缓存已存在: {}", Fingerprints.shortForm(fingerprint));
        }
    }

    @Override
    public long size() {
        return repository.count();
    }

    private ClassifierResult fromJson(ClassificationCacheEntity entity) {
        try {
            return objectMapper.readValue(entity.getResultJson(), ClassifierResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("分类缓存内容损坏: " + Fingerprints.shortForm(entity.getFingerprint()), e);
        }
    }

    private String toJson(ClassifierResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("分类结果序列化失败", e);
        }
    }
}
