package com.compass.web.repository;

import com.compass.web.entity.ClassificationCacheEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.Optional;

public interface ClassificationCacheRepository extends CrudRepository<ClassificationCacheEntity, Long> {

    @Query("SELECT * FROM t_classification_cache WHERE fingerprint = :fingerprint")
    Optional<ClassificationCacheEntity> findByFingerprint(String fingerprint);

    /**
     * 指纹已存在时不写入，保留先写入的结果。
     *
     * @return 实际插入的行数，0 表示已存在
     */
    @Modifying
    @Query("INSERT OR IGNORE INTO t_classification_cache (fingerprint, language, result_json, created_at) "
            + "VALUES (:fingerprint, :language, :resultJson, :createdAt)")
    int insertIfAbsent(String fingerprint, String language, String resultJson, String createdAt);
}
