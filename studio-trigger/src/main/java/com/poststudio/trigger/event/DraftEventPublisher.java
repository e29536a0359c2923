package com.poststudio.trigger.event;

import com.poststudio.domain.draft.model.entity.DraftEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 草稿变更通知发布器：在存储提交之后调用，监听方失败只记录日志。
 */
@Slf4j
@Component
public class DraftEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public DraftEventPublisher(ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    public void publishChanged(DraftEntity draft, String action) {
        if (draft == null || draft.getId() == null) {
            return;
        }
        DraftChangedEvent event = new DraftChangedEvent(
                draft.getId(),
                action,
                draft.getStatus() == null ? null : draft.getStatus().getCode(),
                draft.getExternalRefs(),
                LocalDateTime.now(clock));
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException ex) {
            log.warn("Draft change notification failed. draftId={}, action={}, error={}",
                    draft.getId(), action, ex.getMessage(), ex);
        }
    }
}
