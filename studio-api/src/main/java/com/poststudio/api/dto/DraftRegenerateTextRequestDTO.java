package com.poststudio.api.dto;

import lombok.Data;

/**
 * AI 重新生成文案请求。
 */
@Data
public class DraftRegenerateTextRequestDTO {

    /** 可选的修改指令，例如“更短一些” */
    private String instruction;
}
