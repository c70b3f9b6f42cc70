package com.compass.ai.prompt;

import com.compass.common.model.Language;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Prompt 模板集合。
 * <p>
 * 所有提示词从 classpath 下的 {@code prompts/*.md} 文件加载，
 * 修改提示词只需编辑对应 .md 文件并重启，无需改代码。
 *
 * <pre>
 * resources/prompts/
 * ├── review-classification.md : 单条评论四维评分 + 摘要（JSON 输出）
 * └── university-summary.md    : 院校综述（纯文本输出）
 * </pre>
 */
@Slf4j
@Component
public class PromptTemplates {

    private static final String PROMPT_DIR = "prompts/";

    private String reviewClassificationTemplate;
    private String universitySummaryTemplate;

    @PostConstruct
    void loadPrompts() {
        reviewClassificationTemplate = loadPrompt("review-classification.md");
        universitySummaryTemplate = loadPrompt("university-summary.md");

        log.info("已加载 2 个 Prompt 模板 (来自 classpath:prompts/*.md)");
    }

    /**
     * 单条评论分类 Prompt。
     *
     * @param cleanText 已清洗、脱敏的评论正文
     * @param language  启发式识别的语言
     */
    public String renderClassification(String cleanText, Language language) {
        return reviewClassificationTemplate
                .replace("{language_hint}", language.tag())
                .replace("{text}", cleanText);
    }

    /**
     * 院校综述 Prompt，每条评论摘要占一行。
     */
    public String renderUniversitySummary(String uniName, List<String> snippets) {
        StringBuilder reviews = new StringBuilder();
        for (String snippet : snippets) {
            reviews.append("- ").append(snippet.replace('\n', ' ')).append('\n');
        }
        return universitySummaryTemplate
                .replace("{uni_name}", uniName)
                .replace("{reviews}", reviews.toString());
    }

    private String loadPrompt(String filename) {
        try {
            ClassPathResource resource = new ClassPathResource(PROMPT_DIR + filename);
            String content = resource.getContentAsString(StandardCharsets.UTF_8);
            log.debug("加载 Prompt: {} ({} 字符)", filename, content.length());
            return content;
        } catch (IOException e) {
            log.error("加载 Prompt 失败: {}", filename, e);
            throw new IllegalStateException("无法加载 Prompt 文件: " + PROMPT_DIR + filename, e);
        }
    }
}
