package com.compass.web.config;

import com.compass.common.model.TrustTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 导入流水线与聚合配置项。
 */
@Data
@ConfigurationProperties(prefix = "compass.pipeline")
public class PipelineProperties {

    /** 用户提交是否调用 AI 补充摘要与情感（不会覆盖用户自评分数） */
    private boolean scoreSubmissions = true;

    /** 批量导入时跳过 (院校, 内容指纹, 来源) 已存在的行 */
    private boolean skipDuplicateBatchRows = true;

    /** 可信度加权的权重 */
    private TrustWeights trustWeights = new TrustWeights();

    @Data
    public static class TrustWeights {
        private double high = 2.0;
        private double low = 1.0;

        public double weightOf(TrustTier tier) {
            return tier == TrustTier.HIGH ? high : low;
        }
    }
}
