package com.compass.text.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 文本清洗与语言识别相关配置。
 */
@Data
@ConfigurationProperties(prefix = "compass.text")
public class TextProperties {

    /** 阿拉伯字母占全部字母的比例超过该值时判定为 ar */
    private double arabicThreshold = 0.3;

    /** 拉丁字母占比达到该值时判定为 en */
    private double latinThreshold = 0.5;

    /** 数字个数达到该值的数字串视为电话号码 */
    private int minPhoneDigits = 9;

    /** 连续数字达到该长度视为学号/证件号等标识 */
    private int minIdDigits = 6;
}
