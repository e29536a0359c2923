package com.poststudio.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息。
 * </p>
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 草稿不存在 */
    DRAFT_NOT_FOUND("0004", "草稿不存在"),

    /** 当前状态不允许该操作 */
    INVALID_TRANSITION("0005", "当前状态不允许该操作"),

    /** 文案或图片生成失败 */
    GENERATION_FAILED("0006", "内容生成失败"),

    /** 并发修改冲突 */
    CONCURRENT_MODIFICATION("0007", "草稿正在被修改，请稍后重试");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
