package com.poststudio.api.dto;

import lombok.Data;

/**
 * 创建并生成草稿请求。
 */
@Data
public class DraftCreateRequestDTO {

    /** 推广主题，例如产品名称 */
    private String subject;

    /** 文案语气：friendly / professional / enthusiastic，为空时使用默认配置 */
    private String tone;

    /** 是否使用 emoji，为空时使用默认配置 */
    private Boolean includeEmoji;

    /** 文案最大长度，为空时使用默认配置 */
    private Integer maxLength;
}
