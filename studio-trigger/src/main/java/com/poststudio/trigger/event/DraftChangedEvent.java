package com.poststudio.trigger.event;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 草稿已提交变更事件，externalRefs 用于前端渠道定位需要刷新的消息。
 */
@Getter
public class DraftChangedEvent {

    private final Long draftId;

    /**
     * 触发变更的操作，如 created / approve / edit-text
     */
    private final String action;

    private final String status;

    private final Map<String, String> externalRefs;

    private final LocalDateTime occurredAt;

    public DraftChangedEvent(Long draftId,
                             String action,
                             String status,
                             Map<String, String> externalRefs,
                             LocalDateTime occurredAt) {
        this.draftId = draftId;
        this.action = action;
        this.status = status;
        this.externalRefs = externalRefs == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(externalRefs));
        this.occurredAt = occurredAt;
    }
}
