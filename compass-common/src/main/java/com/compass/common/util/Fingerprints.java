package com.compass.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;

/**
 * 内容指纹：SHA-256 十六进制串。
 */
public final class Fingerprints {

    private static final char SEPARATOR = '\u0000';

    private Fingerprints() {
    }

    /**
     * 评论内容指纹 = hash(语言标签, 清洗后正文)。文本变化即指纹变化。
     */
    public static String ofContent(String languageTag, String cleanText) {
        return sha256(languageTag + SEPARATOR + cleanText);
    }

    /**
     * 一组 ID 的指纹，调用方需保证顺序稳定。
     */
    public static String ofIds(Collection<Long> ids) {
        StringBuilder sb = new StringBuilder();
        for (Long id : ids) {
            sb.append(id).append(',');
        }
        return sha256(sb.toString());
    }

    public static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-256", e);
        }
    }

    /** 日志中只打印前 12 位 */
    public static String shortForm(String fingerprint) {
        if (fingerprint == null) return "null";
        return fingerprint.length() <= 12 ? fingerprint : fingerprint.substring(0, 12);
    }
}
