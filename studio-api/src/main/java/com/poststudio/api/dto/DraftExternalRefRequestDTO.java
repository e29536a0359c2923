package com.poststudio.api.dto;

import lombok.Data;

/**
 * 绑定前端消息引用请求（例如聊天消息 ID）。
 */
@Data
public class DraftExternalRefRequestDTO {

    private String channel;

    private String ref;
}
