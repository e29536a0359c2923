package com.poststudio.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poststudio.types.enums.ResponseCode;
import com.poststudio.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON 编解码工具。
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Component
public class JsonCodec {

    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP_REF =
            new TypeReference<LinkedHashMap<String, String>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取 JSON 为 String Map，空值返回空 Map。
     */
    public Map<String, String> readStringMap(String json) {
        Map<String, String> value = readValue(json, STRING_MAP_REF);
        return value == null ? new LinkedHashMap<>() : value;
    }

    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to parse json", ex);
        }
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to write json", ex);
        }
    }
}
