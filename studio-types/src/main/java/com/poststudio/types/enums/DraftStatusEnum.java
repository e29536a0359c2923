package com.poststudio.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 草稿状态枚举
 *
 * @author poststudio
 * @since 2026-03-02
 */
public enum DraftStatusEnum {

    /**
     * 草稿 - 等待人工审核，可编辑、可重新生成
     */
    DRAFT("draft"),

    /**
     * 已通过 - 审核通过，等待发布，仍可人工修改文案
     */
    APPROVED("approved"),

    /**
     * 已拒绝 - 终态
     */
    REJECTED("rejected"),

    /**
     * 已发布 - 终态
     */
    PUBLISHED("published");

    private final String code;

    DraftStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == REJECTED || this == PUBLISHED;
    }

    public static DraftStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (DraftStatusEnum status : DraftStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown draft status code: " + code);
    }
}
