package com.compass.web.controller;

import com.compass.common.dto.ReviewSubmission;
import com.compass.common.dto.SubmissionReceipt;
import com.compass.web.service.ReviewIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 用户提交评论，进入待审核队列。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SubmissionController {

    private final ReviewIngestionService ingestionService;

    @PostMapping("/api/submit_review")
    @ResponseStatus(HttpStatus.CREATED)
    public SubmissionReceipt submit(@RequestBody ReviewSubmission submission) {
        log.info("收到评论提交, 院校: {}", submission.getUniName());
        return ingestionService.ingestSubmission(submission);
    }
}
