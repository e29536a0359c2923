package com.poststudio.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 草稿状态机事件枚举
 *
 * @author poststudio
 * @since 2026-03-02
 */
public enum DraftEventEnum {

    APPROVE("approve"),

    REJECT("reject"),

    PUBLISH("publish"),

    /**
     * 人工修改文案
     */
    EDIT_TEXT("edit-text"),

    /**
     * AI / 系统生成文案，文案不变时不记录历史
     */
    REGENERATE_TEXT("regenerate-text"),

    REGENERATE_IMAGE("regenerate-image"),

    SCHEDULE_PUBLISH("schedule-publish"),

    CANCEL_SCHEDULE("cancel-schedule");

    private final String code;

    DraftEventEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 文案修改来源对应的状态机事件：人工修改走 edit-text，机器生成走 regenerate-text。
     */
    public static DraftEventEnum forTextSource(EditSourceEnum source) {
        if (source == null) {
            throw new IllegalArgumentException("Edit source cannot be null");
        }
        return source.isHuman() ? EDIT_TEXT : REGENERATE_TEXT;
    }

    public static DraftEventEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (DraftEventEnum event : DraftEventEnum.values()) {
            if (event.code.equalsIgnoreCase(code.trim())) {
                return event;
            }
        }
        throw new IllegalArgumentException("Unknown draft event code: " + code);
    }
}
