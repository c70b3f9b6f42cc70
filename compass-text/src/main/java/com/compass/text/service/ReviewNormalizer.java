package com.compass.text.service;

import com.compass.common.exception.EmptyContentException;
import com.compass.common.model.Language;
import com.compass.common.model.SourceType;
import com.compass.text.model.NormalizedText;
import com.compass.text.model.ScrubResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * 评论清洗：HTML 转文本、Unicode 规范化、个人信息擦除、语言识别。
 * <p>
 * 纯函数，无副作用。清洗后没有可用正文时抛出 {@link EmptyContentException}，该条评论不会入库。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewNormalizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}\\p{Cf}&&[^\\n\\t\\u200C\\u200D]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PiiScrubber piiScrubber;
    private final LanguageDetector languageDetector;

    public NormalizedText normalize(String rawText, SourceType sourceHint) {
        if (rawText == null || rawText.isBlank()) {
            throw new EmptyContentException("评论内容为空");
        }

        // 1. 显式标记的姓名必须在 HTML 转换前擦除，否则标签丢失后姓名会裸露
        ScrubResult named = piiScrubber.scrubTaggedNames(rawText);
        if (named.isResidual()) {
            throw dropped("存在未闭合的姓名标记");
        }
        String text = named.getText();

        // 2. 爬虫片段只保留可见文本
        if (sourceHint == SourceType.WEB_SCRAPE) {
            text = Jsoup.parse(text).text();
        }

        // 3. 规范化：NFKC、去控制字符、折叠空白
        text = Normalizer.normalize(text, Normalizer.Form.NFKC);
        text = CONTROL_CHARS.matcher(text).replaceAll("");

        // 4. 擦除其余个人信息
        ScrubResult scrubbed = piiScrubber.scrub(text);
        if (scrubbed.isResidual()) {
            throw dropped("擦除后仍有残留的个人信息");
        }
        text = WHITESPACE.matcher(scrubbed.getText()).replaceAll(" ").trim();

        if (text.isEmpty()) {
            throw new EmptyContentException("清洗后评论内容为空");
        }

        Language language = languageDetector.detect(text);
        return new NormalizedText(text, language);
    }

    private EmptyContentException dropped(String reason) {
        log.warn("评论正文无法保证匿名，已丢弃: {}", reason);
        return new EmptyContentException("评论正文无法保证匿名，已丢弃: " + reason);
    }
}
