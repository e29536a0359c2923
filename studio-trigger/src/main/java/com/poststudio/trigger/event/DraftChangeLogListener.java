package com.poststudio.trigger.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 草稿变更审计日志。
 */
@Slf4j
@Component
public class DraftChangeLogListener {

    @EventListener
    public void onDraftChanged(DraftChangedEvent event) {
        log.info("DRAFT_CHANGED draftId={}, action={}, status={}, channels={}",
                event.getDraftId(),
                event.getAction(),
                event.getStatus(),
                event.getExternalRefs().keySet());
    }
}
