package com.poststudio.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 生成内容类型枚举
 *
 * @author poststudio
 * @since 2026-03-02
 */
public enum GenerationKindEnum {

    TEXT("text"),

    IMAGE("image");

    private final String code;

    GenerationKindEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
