package com.compass.common.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;

/**
 * 只接受 JSON 整数字面量的 Integer 反序列化器。
 * <p>
 * Jackson 默认会把 {@code 5.9} 截断成 {@code 5}、把 {@code "5"} 转成 {@code 5}，
 * 评分字段不允许这种隐式转换，小数和字符串一律按格式错误处理。
 */
public class StrictIntegerDeserializer extends StdScalarDeserializer<Integer> {

    public StrictIntegerDeserializer() {
        super(Integer.class);
    }

    @Override
    public Integer deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.hasToken(JsonToken.VALUE_NUMBER_INT)) {
            return p.getIntValue();
        }
        return (Integer) ctxt.handleUnexpectedToken(Integer.class, p);
    }
}
