package com.nim.gateway.stream;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;

/**
 * 标准 JSON 校验
 * <p>
 * fastjson2 解析宽松（接受单引号等非标准写法），改写前先用 Jackson 的默认严格模式校验，
 * 不合法的 data 记录原样透传
 */
final class StrictJson {

    private static final JsonFactory FACTORY = JsonFactory.builder().build();

    private StrictJson() {
    }

    /**
     * 是否为单个标准 JSON 对象（不允许尾随内容）
     */
    static boolean isObject(String text) {
        try (JsonParser parser = FACTORY.createParser(text)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return false;
            }
            parser.skipChildren();
            return parser.nextToken() == null;
        } catch (IOException e) {
            return false;
        }
    }
}
