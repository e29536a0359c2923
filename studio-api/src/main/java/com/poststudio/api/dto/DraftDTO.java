package com.poststudio.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 草稿视图 DTO。
 */
@Data
public class DraftDTO {

    private Long draftId;
    private String subject;
    private String text;
    private String imageRef;
    private String status;
    private Map<String, String> externalRefs;
    private LocalDateTime scheduledPublishAt;
    private LocalDateTime publishedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
