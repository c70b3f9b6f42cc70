package com.compass.common.dto;

import com.compass.common.model.Aspect;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.stream.Stream;

/**
 * 四项方面评分，每项为 [1,5] 的整数或缺失（null）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AspectScores {

    private Integer academics;
    private Integer cost;
    private Integer social;
    private Integer accommodation;

    public Integer get(Aspect aspect) {
        return switch (aspect) {
            case ACADEMICS -> academics;
            case COST -> cost;
            case SOCIAL -> social;
            case ACCOMMODATION -> accommodation;
        };
    }

    /** 至少有一项评分 */
    public boolean hasAny() {
        return presentValues().findAny().isPresent();
    }

    /**
     * 已有评分的平均值，全部缺失时返回 null。
     */
    public Double mean() {
        OptionalDouble avg = presentValues().mapToInt(Integer::intValue).average();
        return avg.isPresent() ? avg.getAsDouble() : null;
    }

    private Stream<Integer> presentValues() {
        return Stream.of(academics, cost, social, accommodation).filter(Objects::nonNull);
    }
}
