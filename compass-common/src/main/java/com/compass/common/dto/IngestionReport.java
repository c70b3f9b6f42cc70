package com.compass.common.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量导入汇总报告，单行失败只计数不中断。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IngestionReport {

    private String batchId;

    private int total;

    /** 评分成功并入库 */
    private int succeeded;

    /** AI 评分失败，已入库但评分为空 */
    private int scoringFailed;

    /** 清洗后无正文，未入库 */
    private int contentRejected;

    /** 缺少院校/城市等必填字段，未入库 */
    private int invalid;

    /** 与已有记录重复，跳过 */
    private int duplicate;

    /** 存储等意外错误，未入库 */
    private int failed;

    /** 批次被取消，未调度 */
    private int skipped;

    @Builder.Default
    private List<Long> createdIds = new ArrayList<>();

    private long processingTimeMs;
}
