package com.compass.web.controller;

import com.compass.common.dto.ReviewView;
import com.compass.common.dto.SummaryView;
import com.compass.common.dto.UniversityAggregate;
import com.compass.common.dto.UniversitySummary;
import com.compass.web.service.AggregationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 看板查询接口，只读。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class UniversityController {

    private final AggregationService aggregationService;

    @GetMapping("/unis")
    public List<UniversitySummary> listUniversities(@RequestParam(value = "major", required = false) String major) {
        return aggregationService.listUniversities(major);
    }

    /**
     * 院校完整聚合，未知院校返回 404。
     */
    @GetMapping("/university/{name}")
    public UniversityAggregate university(@PathVariable("name") String name) {
        return aggregationService.aggregate(name);
    }

    @GetMapping("/reviews/{name}")
    public List<ReviewView> reviews(@PathVariable("name") String name) {
        return aggregationService.approvedReviews(name);
    }

    @GetMapping("/summary/{name}")
    public SummaryView summary(@PathVariable("name") String name) {
        UniversityAggregate aggregate = aggregationService.aggregate(name);
        return new SummaryView(aggregate.getUniName(), aggregate.getThemeSummary());
    }
}
