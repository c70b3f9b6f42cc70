package com.compass.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 管理端配置。未配置口令时所有管理接口一律拒绝。
 */
@Data
@ConfigurationProperties(prefix = "compass.admin")
public class AdminProperties {

    /** 共享管理口令，通过请求头 X-Admin-Token 传入 */
    private String token = "";
}
