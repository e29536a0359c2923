package com.poststudio.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 文案修改来源枚举
 *
 * @author poststudio
 * @since 2026-03-02
 */
public enum EditSourceEnum {

    /**
     * Web 管理台人工修改
     */
    HUMAN_DASHBOARD("human-dashboard"),

    /**
     * 聊天机器人人工修改
     */
    HUMAN_CHAT("human-chat"),

    /**
     * AI 重新生成
     */
    AI_REGENERATION("ai-regeneration"),

    /**
     * 系统写入（首次生成）
     */
    SYSTEM("system");

    private final String code;

    EditSourceEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isHuman() {
        return this == HUMAN_DASHBOARD || this == HUMAN_CHAT;
    }

    public static EditSourceEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (EditSourceEnum source : EditSourceEnum.values()) {
            if (source.code.equalsIgnoreCase(code.trim())) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown edit source code: " + code);
    }
}
