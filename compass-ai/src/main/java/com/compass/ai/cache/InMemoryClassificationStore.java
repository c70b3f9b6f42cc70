package com.compass.ai.cache;

import com.compass.common.dto.ClassifierResult;
import com.compass.common.model.Language;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内分类缓存存储。
 */
public class InMemoryClassificationStore implements ClassificationStore {

    private final Map<String, ClassifierResult> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<ClassifierResult> find(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    @Override
    public void save(String fingerprint, Language language, ClassifierResult result) {
        entries.putIfAbsent(fingerprint, result);
    }

    @Override
    public long size() {
        return entries.size();
    }
}
