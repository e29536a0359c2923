package com.poststudio.infrastructure.draft;

import com.poststudio.domain.draft.adapter.repository.IDraftRepository;
import com.poststudio.domain.draft.adapter.repository.IEditHistoryRepository;
import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.domain.draft.model.entity.EditHistoryEntity;
import com.poststudio.domain.draft.model.valobj.DraftStatusStat;
import com.poststudio.domain.draft.service.DraftLockRegistry;
import com.poststudio.domain.draft.service.DraftStoreService;
import com.poststudio.domain.draft.service.DraftTransitionDomainService;
import com.poststudio.types.enums.DraftEventEnum;
import com.poststudio.types.enums.DraftStatusEnum;
import com.poststudio.types.enums.EditSourceEnum;
import com.poststudio.types.enums.ResponseCode;
import com.poststudio.types.exception.AppException;
import com.poststudio.types.exception.DraftNotFoundException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 草稿存储实现：草稿锁内开启事务，读取最新状态、校验迁移、写回草稿与历史。
 *
 * <p>锁包住整个事务（含提交），同一草稿的已提交状态严格串行；
 * UPDATE 另带 version 条件，多实例部署时冲突以 CONCURRENT_MODIFICATION 失败。</p>
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Slf4j
@Service
public class DraftStoreServiceImpl implements DraftStoreService {

    private static final String METRIC_TRANSITION = "studio.draft.transition.total";

    private final IDraftRepository draftRepository;
    private final IEditHistoryRepository editHistoryRepository;
    private final DraftTransitionDomainService transitionDomainService;
    private final DraftLockRegistry draftLockRegistry;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    public DraftStoreServiceImpl(IDraftRepository draftRepository,
                                 IEditHistoryRepository editHistoryRepository,
                                 DraftTransitionDomainService transitionDomainService,
                                 DraftLockRegistry draftLockRegistry,
                                 TransactionOperations transactionOperations,
                                 Clock clock) {
        this.draftRepository = draftRepository;
        this.editHistoryRepository = editHistoryRepository;
        this.transitionDomainService = transitionDomainService;
        this.draftLockRegistry = draftLockRegistry;
        this.transactionOperations = transactionOperations;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    @Override
    public DraftEntity createDraft(String subject) {
        String normalized = StringUtils.trimToNull(subject);
        if (normalized == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "subject不能为空");
        }
        DraftEntity created = transactionOperations.execute(status ->
                draftRepository.save(DraftEntity.create(normalized, now())));
        log.info("Draft created. draftId={}, subject={}", created == null ? null : created.getId(), normalized);
        return created;
    }

    @Override
    public DraftEntity getDraft(Long draftId) {
        requireDraftId(draftId);
        DraftEntity draft = draftRepository.findById(draftId);
        if (draft == null) {
            throw new DraftNotFoundException(draftId);
        }
        return draft;
    }

    @Override
    public List<DraftEntity> listDrafts(DraftStatusEnum statusFilter) {
        return statusFilter == null ? draftRepository.findAll() : draftRepository.findByStatus(statusFilter);
    }

    @Override
    public DraftEntity applyTextEdit(Long draftId, String newText, EditSourceEnum source) {
        if (source == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "source不能为空");
        }
        if (newText == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "text不能为空");
        }
        DraftEventEnum event = DraftEventEnum.forTextSource(source);
        return mutate(draftId, event, draft -> {
            if (event == DraftEventEnum.REGENERATE_TEXT && draft.isTextUnchanged(newText)) {
                log.info("Draft text unchanged. skip history. draftId={}, source={}", draftId, source.getCode());
                return false;
            }
            EditHistoryEntity entry = draft.replaceText(newText, source, now());
            editHistoryRepository.save(entry);
            log.info("Draft text replaced. draftId={}, event={}, source={}, status={}",
                    draftId, event.getCode(), source.getCode(), draft.getStatus().getCode());
            return true;
        });
    }

    @Override
    public DraftEntity applyImageUpdate(Long draftId, String newImageRef) {
        if (StringUtils.isBlank(newImageRef)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "imageRef不能为空");
        }
        return mutate(draftId, DraftEventEnum.REGENERATE_IMAGE, draft -> {
            if (draft.isImageUnchanged(newImageRef)) {
                return false;
            }
            draft.replaceImage(newImageRef, now());
            log.info("Draft image replaced. draftId={}, imageRef={}", draftId, newImageRef);
            return true;
        });
    }

    @Override
    public DraftEntity transitionStatus(Long draftId, DraftEventEnum event) {
        if (!transitionDomainService.isStatusEvent(event)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "不支持的状态事件: " + event);
        }
        return mutate(draftId, event, draft -> {
            DraftStatusEnum from = draft.getStatus();
            DraftStatusEnum target = transitionDomainService.resolveTargetStatus(from, event);
            draft.applyStatus(event, target, now());
            log.info("Draft transitioned. draftId={}, event={}, from={}, to={}",
                    draftId, event.getCode(), from.getCode(), target.getCode());
            return true;
        });
    }

    @Override
    public List<EditHistoryEntity> getHistory(Long draftId) {
        getDraft(draftId);
        List<EditHistoryEntity> history = editHistoryRepository.findByDraftId(draftId);
        return history == null ? Collections.emptyList() : history;
    }

    @Override
    public DraftEntity schedulePublish(Long draftId, LocalDateTime publishAt) {
        if (publishAt == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "publishAt不能为空");
        }
        return mutate(draftId, DraftEventEnum.SCHEDULE_PUBLISH, draft -> {
            if (Objects.equals(draft.getScheduledPublishAt(), publishAt)) {
                return false;
            }
            draft.schedulePublish(publishAt, now());
            log.info("Draft publish scheduled. draftId={}, publishAt={}", draftId, publishAt);
            return true;
        });
    }

    @Override
    public DraftEntity cancelSchedule(Long draftId) {
        return mutate(draftId, DraftEventEnum.CANCEL_SCHEDULE, draft -> {
            if (draft.getScheduledPublishAt() == null) {
                return false;
            }
            draft.cancelSchedule(now());
            log.info("Draft publish schedule cancelled. draftId={}", draftId);
            return true;
        });
    }

    @Override
    public DraftEntity publishIfDue(Long draftId, LocalDateTime now) {
        if (now == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "now不能为空");
        }
        return mutate(draftId, DraftEventEnum.PUBLISH, draft -> {
            if (!draft.isDueForPublish(now)) {
                return false;
            }
            LocalDateTime scheduledAt = draft.getScheduledPublishAt();
            draft.applyStatus(DraftEventEnum.PUBLISH, DraftStatusEnum.PUBLISHED, now());
            log.info("Draft published on schedule. draftId={}, scheduledAt={}", draftId, scheduledAt);
            return true;
        });
    }

    @Override
    public DraftEntity bindExternalRef(Long draftId, String channel, String ref) {
        String normalizedChannel = StringUtils.trimToNull(channel);
        if (normalizedChannel == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "channel不能为空");
        }
        String normalizedRef = StringUtils.trimToNull(ref);
        return mutate(draftId, null, draft -> {
            Map<String, String> refs = draft.getExternalRefs();
            String current = refs == null ? null : refs.get(normalizedChannel);
            if (Objects.equals(current, normalizedRef)) {
                return false;
            }
            draft.bindExternalRef(normalizedChannel, normalizedRef, now());
            log.info("Draft external ref bound. draftId={}, channel={}, ref={}", draftId, normalizedChannel, normalizedRef);
            return true;
        });
    }

    @Override
    public List<DraftEntity> findDueForPublish(LocalDateTime now, int limit) {
        if (now == null || limit <= 0) {
            return Collections.emptyList();
        }
        return draftRepository.findDueForPublish(now, limit);
    }

    @Override
    public DraftEntity findLatest() {
        return draftRepository.findLatest();
    }

    @Override
    public List<DraftStatusStat> summarizeByStatus() {
        return draftRepository.summarizeByStatus();
    }

    /**
     * 锁内事务：读取最新草稿，event 非空时先校验迁移；mutation 返回 false 表示无变化，不写库。
     */
    private DraftEntity mutate(Long draftId, DraftEventEnum event, Predicate<DraftEntity> mutation) {
        requireDraftId(draftId);
        return draftLockRegistry.executeLocked(draftId, () -> transactionOperations.execute(status -> {
            DraftEntity draft = getDraft(draftId);
            if (event != null) {
                transitionDomainService.requireTransition(draft, event);
            }
            if (!mutation.test(draft)) {
                return draft;
            }
            DraftEntity saved = draftRepository.update(draft);
            if (event != null) {
                recordTransition(event);
            }
            return saved;
        }));
    }

    private void recordTransition(DraftEventEnum event) {
        Counter.builder(METRIC_TRANSITION)
                .tag("event", event.getCode())
                .register(Metrics.globalRegistry)
                .increment();
    }

    private void requireDraftId(Long draftId) {
        if (draftId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "draftId不能为空");
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
