package com.compass.text.service;

import com.compass.common.model.Language;
import com.compass.text.config.TextProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 基于码位区间的粗粒度语言识别，只用于给分类服务提供语言提示。
 * <p>
 * 已知局限：混合语言、转写阿拉伯语（Arabizi）、其他拉丁语系语言都会被归为 en 或 unknown。
 * 需要更准确时可以替换为真正的语言模型，接口不变。
 */
@Component
@RequiredArgsConstructor
public class LanguageDetector {

    private final TextProperties properties;

    public Language detect(String text) {
        if (text == null || text.isBlank()) {
            return Language.UNKNOWN;
        }

        int letters = 0;
        int arabic = 0;
        int latin = 0;

        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (!Character.isLetter(cp)) {
                continue;
            }
            letters++;
            if (isArabic(cp)) {
                arabic++;
            } else if (Character.UnicodeScript.of(cp) == Character.UnicodeScript.LATIN) {
                latin++;
            }
        }

        if (letters == 0) {
            return Language.UNKNOWN;
        }
        if ((double) arabic / letters > properties.getArabicThreshold()) {
            return Language.AR;
        }
        if ((double) latin / letters >= properties.getLatinThreshold()) {
            return Language.EN;
        }
        return Language.UNKNOWN;
    }

    static boolean isArabic(int cp) {
        return (cp >= 0x0600 && cp <= 0x06FF)
                || (cp >= 0x0750 && cp <= 0x077F)
                || (cp >= 0x08A0 && cp <= 0x08FF)
                || (cp >= 0xFB50 && cp <= 0xFDFF)
                || (cp >= 0xFE70 && cp <= 0xFEFF);
    }
}
