package com.compass.common.dto;

import com.compass.common.model.ReviewStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户提交后的回执。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionReceipt {

    private Long id;
    private ReviewStatus status;
}
