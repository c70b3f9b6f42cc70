package com.compass.common.util;

/**
 * API Key 脱敏，日志里只出现前 8 位。
 */
public final class KeyMasks {

    private KeyMasks() {
    }

    public static String mask(String key) {
        if (key == null || key.length() <= 8) return "***";
        return key.substring(0, 8) + "***";
    }

    /** 限流计数等存储场景使用的 Key 标识，不落明文 */
    public static String slotOf(String key) {
        return Fingerprints.sha256(key).substring(0, 16);
    }
}
