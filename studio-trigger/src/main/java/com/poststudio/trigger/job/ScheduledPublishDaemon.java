package com.poststudio.trigger.job;

import com.poststudio.api.dto.DraftDTO;
import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.domain.draft.service.DraftStoreService;
import com.poststudio.trigger.application.command.DraftLifecycleCommandService;
import com.poststudio.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 定时发布守护进程：发布已到计划时间的 approved 草稿。
 */
@Slf4j
@Component
public class ScheduledPublishDaemon {

    private final DraftStoreService draftStoreService;
    private final DraftLifecycleCommandService draftLifecycleCommandService;
    private final Clock clock;
    private final int batchSize;
    private final Counter publishedCounter;
    private final Counter skippedCounter;

    public ScheduledPublishDaemon(DraftStoreService draftStoreService,
                                  DraftLifecycleCommandService draftLifecycleCommandService,
                                  Clock clock,
                                  @Value("${publish-schedule.batch-size:50}") int batchSize) {
        this.draftStoreService = draftStoreService;
        this.draftLifecycleCommandService = draftLifecycleCommandService;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
        this.batchSize = batchSize > 0 ? batchSize : 50;
        this.publishedCounter = Counter.builder("studio.publish.scheduled.total").register(Metrics.globalRegistry);
        this.skippedCounter = Counter.builder("studio.publish.scheduled.skipped.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${publish-schedule.poll-interval-ms:60000}", scheduler = "daemonScheduler")
    public void publishDueDrafts() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<DraftEntity> dueDrafts = draftStoreService.findDueForPublish(now, batchSize);
        if (dueDrafts == null || dueDrafts.isEmpty()) {
            return;
        }
        int published = 0;
        for (DraftEntity draft : dueDrafts) {
            if (draft == null || draft.getId() == null) {
                continue;
            }
            try {
                DraftDTO result = draftLifecycleCommandService.publishIfDue(draft.getId(), now);
                if (result == null) {
                    skippedCounter.increment();
                    continue;
                }
                publishedCounter.increment();
                published++;
            } catch (AppException ex) {
                // 扫描之后草稿可能已被拒绝、取消计划或手动发布
                skippedCounter.increment();
                log.warn("Scheduled publish skipped. draftId={}, code={}, reason={}",
                        draft.getId(), ex.getCode(), ex.getInfo());
            }
        }
        log.info("Scheduled publish round finished. due={}, published={}", dueDrafts.size(), published);
    }
}
