package com.compass.web.repository;

import com.compass.web.entity.AiCallLogEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface AiCallLogRepository extends CrudRepository<AiCallLogEntity, Long> {

    /** 最近的失败调用 */
    @Query("SELECT * FROM t_ai_call_log WHERE success = 0 ORDER BY id DESC LIMIT 20")
    List<AiCallLogEntity> findRecentFailures();

    /** 实际发出的调用（不含缓存命中） */
    @Query("SELECT COUNT(*) FROM t_ai_call_log WHERE cache_hit = 0")
    long countRemoteCalls();

    @Query("SELECT COUNT(*) FROM t_ai_call_log WHERE cache_hit = 0 AND success = 0")
    long countFailedCalls();
}
