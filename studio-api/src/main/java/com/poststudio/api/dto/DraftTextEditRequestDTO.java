package com.poststudio.api.dto;

import lombok.Data;

/**
 * 人工修改文案请求。
 */
@Data
public class DraftTextEditRequestDTO {

    private String text;

    /** human-dashboard / human-chat，默认 human-dashboard */
    private String source;
}
