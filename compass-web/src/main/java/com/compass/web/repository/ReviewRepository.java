package com.compass.web.repository;

import com.compass.web.entity.ReviewEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

/**
 * 枚举参数一律以枚举名（String）传入。
 */
public interface ReviewRepository extends CrudRepository<ReviewEntity, Long> {

    /** 某状态的全部评论，先入先出 */
    @Query("SELECT * FROM t_review WHERE status = :status ORDER BY created_at ASC, id ASC")
    List<ReviewEntity> findByStatusOldestFirst(String status);

    /** 某院校审核通过的评论，最新在前 */
    @Query("SELECT * FROM t_review WHERE uni_name = :uniName AND status = 'APPROVED' "
            + "ORDER BY created_at DESC, id DESC")
    List<ReviewEntity> findApprovedByUniName(String uniName);

    @Query("SELECT * FROM t_review WHERE status = 'APPROVED' ORDER BY uni_name ASC, id ASC")
    List<ReviewEntity> findAllApproved();

    @Query("SELECT COUNT(*) FROM t_review WHERE uni_name = :uniName "
            + "AND content_fingerprint = :fingerprint AND source_type = :sourceType")
    long countSameContent(String uniName, String fingerprint, String sourceType);

    @Query("SELECT COUNT(*) FROM t_review WHERE status = :status")
    long countByStatus(String status);

    /**
     * 带前置状态校验的状态迁移，返回受影响行数；并发审核时只有一方成功。
     */
    @Modifying
    @Query("UPDATE t_review SET status = :to, moderated_at = :moderatedAt WHERE id = :id AND status = :from")
    int transitionStatus(Long id, String from, String to, String moderatedAt);
}
