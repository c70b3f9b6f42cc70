package com.compass.common.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * SQLite TEXT 时间戳（yyyy-MM-dd HH:mm:ss），字典序即时间序。
 */
public final class Timestamps {

    public static final DateTimeFormatter SQLITE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Timestamps() {
    }

    public static String now() {
        return LocalDateTime.now().format(SQLITE_FMT);
    }
}
