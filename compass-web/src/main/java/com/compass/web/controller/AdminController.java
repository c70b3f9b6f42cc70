package com.compass.web.controller;

import com.compass.common.dto.AdminStats;
import com.compass.common.dto.IngestionReport;
import com.compass.common.dto.RawReviewRow;
import com.compass.common.dto.ReviewView;
import com.compass.web.service.AdminGuard;
import com.compass.web.service.ModerationService;
import com.compass.web.service.ReviewIngestionService;
import com.compass.web.service.StatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 管理端接口：审核、批量导入、运行统计。
 * <p>
 * 所有请求须带 {@code X-Admin-Token}，校验失败时不产生任何状态变化。
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    static final String TOKEN_HEADER = "X-Admin-Token";

    private final AdminGuard adminGuard;
    private final ModerationService moderationService;
    private final ReviewIngestionService ingestionService;
    private final StatsService statsService;

    @GetMapping("/pending")
    public List<ReviewView> pending(@RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        adminGuard.verify(token);
        return moderationService.listPending();
    }

    @PostMapping("/reviews/{id}/approve")
    public ReviewView approve(@RequestHeader(value = TOKEN_HEADER, required = false) String token,
                              @PathVariable("id") Long id) {
        adminGuard.verify(token);
        return moderationService.approve(id);
    }

    @PostMapping("/reviews/{id}/reject")
    public ReviewView reject(@RequestHeader(value = TOKEN_HEADER, required = false) String token,
                             @PathVariable("id") Long id) {
        adminGuard.verify(token);
        return moderationService.reject(id);
    }

    /**
     * 批量导入（问卷、爬虫结果），逐行处理，单行失败计入报告。
     */
    @PostMapping("/ingest")
    public IngestionReport ingest(@RequestHeader(value = TOKEN_HEADER, required = false) String token,
                                  @RequestBody List<RawReviewRow> rows) {
        adminGuard.verify(token);
        log.info("管理端批量导入, {} 行", rows.size());
        return ingestionService.ingestBatch(rows);
    }

    @GetMapping("/stats")
    public AdminStats stats(@RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        adminGuard.verify(token);
        return statsService.snapshot();
    }
}
