package com.poststudio.infrastructure.dao.po;

import com.poststudio.types.enums.DraftStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 草稿 PO，对应表 drafts。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftPO {

    private Long id;
    private String subject;
    private String text;
    private String imageRef;
    private DraftStatusEnum status;

    /**
     * 渠道消息引用 (JSONB)
     */
    private String externalRefs;

    private LocalDateTime scheduledPublishAt;
    private LocalDateTime publishedAt;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
