package com.compass.web.service;

import com.compass.common.exception.UnauthorizedException;
import com.compass.web.config.AdminProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 管理口令校验。口令未配置时拒绝一切管理操作；比较为定长时间。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminGuard {

    private final AdminProperties properties;

    public void verify(String providedToken) {
        String expected = properties.getToken();
        if (expected == null || expected.isBlank()) {
            log.warn("未配置 compass.admin.token，拒绝管理操作");
            throw new UnauthorizedException("管理接口未启用");
        }
        if (providedToken == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), providedToken.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedException("管理口令无效");
        }
    }
}
