package com.compass.common.util;

/**
 * 院校名、城市名的规范化：去首尾空白并把连续空白折叠为一个空格。
 * 匹配只做精确比较，不做模糊匹配。
 */
public final class Names {

    private Names() {
    }

    public static String canonical(String name) {
        if (name == null) {
            return null;
        }
        String collapsed = name.trim().replaceAll("\\s+", " ");
        return collapsed.isEmpty() ? null : collapsed;
    }
}
