package com.compass.ai.agent;

import com.compass.common.dto.AspectScores;
import com.compass.common.dto.ClassifierResult;
import com.compass.common.exception.AiResponseFormatException;
import com.compass.common.model.Aspect;
import com.compass.common.model.Sentiment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析并校验 AI 分类返回。
 * <p>
 * 任一字段缺失、类型不对或越界，整个返回视为无效，不做部分填充，也不做截断修正。
 * 只认提示词里约定的字段名：{@code academics}、{@code cost}、{@code social}、{@code accommodation}、
 * {@code summary}、{@code overall_sentiment}。
 */
@Component
public class ClassifierResponseParser {

    /** ```json ... ``` 代码块 */
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ClassifierResult parse(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new AiResponseFormatException("AI 返回为空");
        }

        JsonNode root = readJson(extractJson(reply));
        if (!root.isObject()) {
            throw new AiResponseFormatException("AI 返回不是 JSON 对象");
        }

        Map<Aspect, Integer> scores = new EnumMap<>(Aspect.class);
        for (Aspect aspect : Aspect.values()) {
            scores.put(aspect, readScore(root, aspect));
        }
        AspectScores aspectScores = AspectScores.builder()
                .academics(scores.get(Aspect.ACADEMICS))
                .cost(scores.get(Aspect.COST))
                .social(scores.get(Aspect.SOCIAL))
                .accommodation(scores.get(Aspect.ACCOMMODATION))
                .build();

        String summary = readSummary(root);
        Sentiment sentiment = readSentiment(root, aspectScores);

        return ClassifierResult.builder()
                .scores(aspectScores)
                .summary(summary)
                .sentiment(sentiment)
                .build();
    }

    private String extractJson(String reply) {
        Matcher fence = CODE_FENCE.matcher(reply);
        if (fence.find()) {
            return fence.group(1);
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return reply.substring(start, end + 1);
        }
        return reply.trim();
    }

    private JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AiResponseFormatException("AI 返回不是合法 JSON: " + e.getOriginalMessage(), e);
        }
    }

    private Integer readScore(JsonNode root, Aspect aspect) {
        JsonNode node = field(root, aspect.key());
        if (node == null) {
            throw new AiResponseFormatException("缺少评分字段: " + aspect.key());
        }

        int value;
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            value = node.intValue();
        } else if (node.isFloatingPointNumber() && node.doubleValue() == Math.rint(node.doubleValue())) {
            value = (int) node.doubleValue();
        } else if (node.isTextual() && INTEGER_TEXT.matcher(node.textValue().trim()).matches()) {
            try {
                value = Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new AiResponseFormatException("评分不是整数: " + aspect.key() + "=" + node, e);
            }
        } else {
            throw new AiResponseFormatException("评分不是整数: " + aspect.key() + "=" + node);
        }

        if (!Aspect.inRange(value)) {
            throw new AiResponseFormatException("评分越界: " + aspect.key() + "=" + value);
        }
        return value;
    }

    private String readSummary(JsonNode root) {
        JsonNode node = field(root, "summary");
        if (node == null || !node.isTextual() || node.textValue().isBlank()) {
            throw new AiResponseFormatException("缺少摘要字段 summary");
        }
        return node.textValue().trim();
    }

    private Sentiment readSentiment(JsonNode root, AspectScores scores) {
        JsonNode node = field(root, "overall_sentiment");
        if (node == null) {
            return Sentiment.fromMeanScore(scores.mean());
        }
        Sentiment sentiment = node.isTextual() ? Sentiment.parse(node.textValue()) : null;
        if (sentiment == null) {
            throw new AiResponseFormatException("无法识别的情感标签: " + node);
        }
        return sentiment;
    }

    /** JSON null 与缺失同等对待 */
    private static JsonNode field(JsonNode root, String name) {
        JsonNode node = root.get(name);
        return node == null || node.isNull() ? null : node;
    }
}
