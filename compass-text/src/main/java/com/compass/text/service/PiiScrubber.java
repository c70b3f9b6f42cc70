package com.compass.text.service;

import com.compass.text.config.TextProperties;
import com.compass.text.model.ScrubResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 个人信息擦除：邮箱、链接、社交账号、电话、学号类数字串、显式标记的姓名。
 * <p>
 * 规则集固定，命中片段替换为中性占位符；擦除完成后复检一遍，
 * 仍有命中或存在未闭合的姓名标记时，结果标记为 residual，由调用方丢弃整个字段。
 */
@Slf4j
@Component
public class PiiScrubber {

    static final String EMAIL_TOKEN = "[redacted-email]";
    static final String URL_TOKEN = "[redacted-url]";
    static final String HANDLE_TOKEN = "[redacted-handle]";
    static final String PHONE_TOKEN = "[redacted-phone]";
    static final String ID_TOKEN = "[redacted-id]";
    static final String NAME_TOKEN = "[redacted-name]";

    private static final Pattern TAGGED_NAME = Pattern.compile(
            "(?is)\\[name\\].*?\\[/name\\]|<name>.*?</name>");

    private static final Pattern UNCLOSED_NAME_TAG = Pattern.compile(
            "(?i)\\[/?name\\]|</?name>");

    private static final Pattern EMAIL = Pattern.compile(
            "[\\p{L}\\p{Nd}._%+-]+@[\\p{L}\\p{Nd}.-]+\\.[\\p{L}]{2,}");

    private static final Pattern URL = Pattern.compile(
            "(?i)\\b(?:https?://|www\\.)[^\\s]+");

    private static final Pattern HANDLE = Pattern.compile(
            "(?<![\\p{L}\\p{Nd}_@])@[A-Za-z0-9_.]{2,30}");

    /** 可带 + 号、空格、括号、点、横线分隔的数字串 */
    private static final Pattern PHONE_CANDIDATE = Pattern.compile(
            "(?<![\\p{L}\\p{Nd}])\\+?\\p{Nd}[\\p{Nd}\\s().-]{4,}\\p{Nd}(?![\\p{L}\\p{Nd}])");

    private final Pattern idPattern;
    private final int minPhoneDigits;

    public PiiScrubber(TextProperties properties) {
        this.minPhoneDigits = properties.getMinPhoneDigits();
        this.idPattern = Pattern.compile(
                "(?<![\\p{L}\\p{Nd}])\\p{Nd}{" + properties.getMinIdDigits() + ",}(?![\\p{L}\\p{Nd}])");
    }

    /**
     * 擦除显式标记的姓名。HTML 转纯文本会丢掉标签，因此要在转换之前调用。
     */
    public ScrubResult scrubTaggedNames(String text) {
        int[] count = {0};
        String result = replaceAll(TAGGED_NAME, text, m -> {
            count[0]++;
            return NAME_TOKEN;
        });
        boolean residual = UNCLOSED_NAME_TAG.matcher(result).find();
        return new ScrubResult(result, count[0], residual);
    }

    /**
     * 擦除全部规则命中的片段并复检。
     */
    public ScrubResult scrub(String text) {
        ScrubResult named = scrubTaggedNames(text);
        String result = named.getText();
        int[] count = {named.getReplacements()};

        result = replaceAll(EMAIL, result, m -> {
            count[0]++;
            return EMAIL_TOKEN;
        });
        result = replaceAll(URL, result, m -> {
            count[0]++;
            return URL_TOKEN;
        });
        result = replaceAll(HANDLE, result, m -> {
            count[0]++;
            return HANDLE_TOKEN;
        });
        result = replaceAll(PHONE_CANDIDATE, result, m -> {
            if (countDigits(m.group()) < minPhoneDigits) {
                return m.group();
            }
            count[0]++;
            return PHONE_TOKEN;
        });
        result = replaceAll(idPattern, result, m -> {
            count[0]++;
            return ID_TOKEN;
        });

        boolean residual = named.isResidual() || containsIdentifier(result);
        if (count[0] > 0) {
            log.debug("擦除个人信息 {} 处, 残留: {}", count[0], residual);
        }
        return new ScrubResult(result, count[0], residual);
    }

    /**
     * 复检：文本中是否仍含可识别的个人信息。
     */
    public boolean containsIdentifier(String text) {
        for (Pattern p : List.of(EMAIL, URL, HANDLE, idPattern, UNCLOSED_NAME_TAG)) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        Matcher phone = PHONE_CANDIDATE.matcher(text);
        while (phone.find()) {
            if (countDigits(phone.group()) >= minPhoneDigits) {
                return true;
            }
        }
        return false;
    }

    private static int countDigits(String s) {
        int digits = 0;
        for (int i = 0; i < s.length(); i++) {
            if (Character.isDigit(s.charAt(i))) {
                digits++;
            }
        }
        return digits;
    }

    private static String replaceAll(Pattern pattern, String input,
                                     java.util.function.Function<Matcher, String> replacer) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacer.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
