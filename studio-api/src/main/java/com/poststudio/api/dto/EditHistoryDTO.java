package com.poststudio.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 文案修改历史 DTO。
 */
@Data
public class EditHistoryDTO {

    private Long historyId;
    private Long draftId;
    private String previousText;
    private String newText;
    private String source;
    private LocalDateTime createdAt;
}
