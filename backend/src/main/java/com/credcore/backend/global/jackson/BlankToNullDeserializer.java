package com.credcore.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * 선택 입력 문자열 역직렬화기
 *
 * - 앞뒤 공백을 제거하고, 남는 게 없으면 null 이다. ("" 과 미입력은 같은 의미)
 * - 숫자로 온 값(예: phone: 821012345678)은 문자열로 받는다.
 * - 객체/배열은 HttpMessageNotReadableException → VALIDATION_ERROR 경로로 간다.
 */
public class BlankToNullDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken t = p.currentToken();
        if (t == JsonToken.START_OBJECT || t == JsonToken.START_ARRAY) {
            return (String) ctxt.handleUnexpectedToken(String.class, p);
        }
        String raw = p.getValueAsString();
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.strip();
    }
}
