package com.poststudio.trigger.application.command;

import com.poststudio.api.dto.DraftCreateRequestDTO;
import com.poststudio.api.dto.DraftDTO;
import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.domain.draft.service.DraftStoreService;
import com.poststudio.domain.draft.service.DraftTransitionDomainService;
import com.poststudio.domain.generation.model.valobj.TextGenerationOptions;
import com.poststudio.domain.generation.service.GenerationOrchestratorService;
import com.poststudio.trigger.application.common.DraftViewAssembler;
import com.poststudio.trigger.event.DraftEventPublisher;
import com.poststudio.types.enums.DraftEventEnum;
import com.poststudio.types.enums.DraftStatusEnum;
import com.poststudio.types.enums.EditSourceEnum;
import com.poststudio.types.enums.GenerationKindEnum;
import com.poststudio.types.enums.ResponseCode;
import com.poststudio.types.exception.AppException;
import com.poststudio.types.exception.GenerationException;
import com.poststudio.types.exception.InvalidTransitionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * 草稿生命周期写用例：前端（看板 / 聊天机器人）的所有写操作入口。
 *
 * <p>生成调用在锁外执行，结果通过 DraftStoreService 在草稿锁内落库；
 * 每次提交后发布 DraftChangedEvent。</p>
 */
@Slf4j
@Service
public class DraftLifecycleCommandService {

    private final DraftStoreService draftStoreService;
    private final DraftTransitionDomainService transitionDomainService;
    private final GenerationOrchestratorService generationOrchestratorService;
    private final DraftViewAssembler draftViewAssembler;
    private final DraftEventPublisher draftEventPublisher;
    private final ExecutorService generationTaskExecutor;

    public DraftLifecycleCommandService(DraftStoreService draftStoreService,
                                        DraftTransitionDomainService transitionDomainService,
                                        GenerationOrchestratorService generationOrchestratorService,
                                        DraftViewAssembler draftViewAssembler,
                                        DraftEventPublisher draftEventPublisher,
                                        @Qualifier("generationTaskExecutor") ExecutorService generationTaskExecutor) {
        this.draftStoreService = draftStoreService;
        this.transitionDomainService = transitionDomainService;
        this.generationOrchestratorService = generationOrchestratorService;
        this.draftViewAssembler = draftViewAssembler;
        this.draftEventPublisher = draftEventPublisher;
        this.generationTaskExecutor = generationTaskExecutor;
    }

    /**
     * 新建草稿并生成文案与图片：文案在当前线程生成，图片并发生成，各自完成后立即落库。
     * 任一失败时保留已创建的草稿并抛出 GenerationException（文案失败优先）。
     */
    public DraftDTO createAndGenerate(DraftCreateRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getSubject())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "subject不能为空");
        }
        String subject = request.getSubject().trim();
        TextGenerationOptions textOptions = generationOrchestratorService.getDefaultTextOptions()
                .withOverrides(request.getTone(), request.getIncludeEmoji(), request.getMaxLength());

        DraftEntity created = draftStoreService.createDraft(subject);
        Long draftId = created.getId();
        draftEventPublisher.publishChanged(created, "created");

        Future<DraftEntity> imageFuture = null;
        RuntimeException imageError = null;
        try {
            imageFuture = generationTaskExecutor.submit(() -> {
                String imageRef = generationOrchestratorService.generateImage(subject, null);
                return draftStoreService.applyImageUpdate(draftId, imageRef);
            });
        } catch (RejectedExecutionException ex) {
            log.warn("Initial image task rejected. draftId={}, reason={}", draftId, ex.getMessage());
            imageError = new GenerationException(GenerationKindEnum.IMAGE, 0, "image生成任务提交被拒绝", ex)
                    .withDraftId(draftId);
        }

        GenerationException textError = null;
        try {
            String text = generationOrchestratorService.generateText(subject, textOptions);
            DraftEntity withText = draftStoreService.applyTextEdit(draftId, text, EditSourceEnum.SYSTEM);
            draftEventPublisher.publishChanged(withText, DraftEventEnum.REGENERATE_TEXT.getCode());
        } catch (GenerationException ex) {
            textError = ex.withDraftId(draftId);
            log.warn("Initial text generation failed. draftId={}, attempts={}, reason={}",
                    draftId, ex.getAttempts(), ex.getInfo());
        } catch (RuntimeException ex) {
            textError = new GenerationException(GenerationKindEnum.TEXT, 0, "text保存失败: " + ex.getMessage(), ex)
                    .withDraftId(draftId);
            log.warn("Initial text could not be saved. draftId={}, reason={}", draftId, ex.getMessage());
        } finally {
            if (imageFuture != null) {
                imageError = awaitImage(draftId, imageFuture);
            }
        }

        if (textError != null) {
            if (imageError != null) {
                textError.addSuppressed(imageError);
            }
            throw textError;
        }
        if (imageError != null) {
            throw imageError;
        }
        DraftEntity result = draftStoreService.getDraft(draftId);
        log.info("Draft generated. draftId={}, subject={}, textLength={}, imageRef={}",
                draftId, subject, result.getText() == null ? 0 : result.getText().length(), result.getImageRef());
        return draftViewAssembler.toDraftDTO(result);
    }

    public DraftDTO approve(Long draftId) {
        return transition(draftId, DraftEventEnum.APPROVE);
    }

    public DraftDTO reject(Long draftId) {
        return transition(draftId, DraftEventEnum.REJECT);
    }

    public DraftDTO publish(Long draftId) {
        return transition(draftId, DraftEventEnum.PUBLISH);
    }

    /**
     * 人工修改文案，source 为空时按看板处理。
     */
    public DraftDTO editText(Long draftId, String newText, String source) {
        if (StringUtils.isBlank(newText)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "text不能为空");
        }
        EditSourceEnum editSource = StringUtils.isBlank(source)
                ? EditSourceEnum.HUMAN_DASHBOARD
                : EditSourceEnum.fromCode(source);
        DraftEntity updated = draftStoreService.applyTextEdit(draftId, newText, editSource);
        draftEventPublisher.publishChanged(updated, DraftEventEnum.forTextSource(editSource).getCode());
        return draftViewAssembler.toDraftDTO(updated);
    }

    /**
     * 按指令改写文案，生成失败时草稿保持原样。
     */
    public DraftDTO regenerateText(Long draftId, String instruction) {
        requireAllowed(draftId, DraftEventEnum.REGENERATE_TEXT);
        String text = generationOrchestratorService.regenerateText(draftId, instruction);
        DraftEntity updated = draftStoreService.applyTextEdit(draftId, text, EditSourceEnum.AI_REGENERATION);
        draftEventPublisher.publishChanged(updated, DraftEventEnum.REGENERATE_TEXT.getCode());
        return draftViewAssembler.toDraftDTO(updated);
    }

    public DraftDTO regenerateImage(Long draftId) {
        requireAllowed(draftId, DraftEventEnum.REGENERATE_IMAGE);
        String imageRef = generationOrchestratorService.regenerateImage(draftId);
        DraftEntity updated = draftStoreService.applyImageUpdate(draftId, imageRef);
        draftEventPublisher.publishChanged(updated, DraftEventEnum.REGENERATE_IMAGE.getCode());
        return draftViewAssembler.toDraftDTO(updated);
    }

    public DraftDTO schedulePublish(Long draftId, LocalDateTime publishAt) {
        DraftEntity updated = draftStoreService.schedulePublish(draftId, publishAt);
        draftEventPublisher.publishChanged(updated, DraftEventEnum.SCHEDULE_PUBLISH.getCode());
        return draftViewAssembler.toDraftDTO(updated);
    }

    public DraftDTO cancelSchedule(Long draftId) {
        DraftEntity updated = draftStoreService.cancelSchedule(draftId);
        draftEventPublisher.publishChanged(updated, DraftEventEnum.CANCEL_SCHEDULE.getCode());
        return draftViewAssembler.toDraftDTO(updated);
    }

    /**
     * 定时发布：计划已取消或未到期时返回 null。
     */
    public DraftDTO publishIfDue(Long draftId, LocalDateTime now) {
        DraftEntity updated = draftStoreService.publishIfDue(draftId, now);
        if (updated.getStatus() != DraftStatusEnum.PUBLISHED) {
            return null;
        }
        draftEventPublisher.publishChanged(updated, DraftEventEnum.PUBLISH.getCode());
        return draftViewAssembler.toDraftDTO(updated);
    }

    public DraftDTO bindExternalRef(Long draftId, String channel, String ref) {
        DraftEntity updated = draftStoreService.bindExternalRef(draftId, channel, ref);
        return draftViewAssembler.toDraftDTO(updated);
    }

    private DraftDTO transition(Long draftId, DraftEventEnum event) {
        DraftEntity updated = draftStoreService.transitionStatus(draftId, event);
        draftEventPublisher.publishChanged(updated, event.getCode());
        return draftViewAssembler.toDraftDTO(updated);
    }

    /**
     * 生成前预检当前状态，避免对不可修改的草稿发起外部调用；落库时存储仍会再次校验。
     */
    private void requireAllowed(Long draftId, DraftEventEnum event) {
        DraftEntity draft = draftStoreService.getDraft(draftId);
        if (!transitionDomainService.isAllowed(draft.getStatus(), event)) {
            throw new InvalidTransitionException(draftId, draft.getStatus(), event);
        }
    }

    private RuntimeException awaitImage(Long draftId, Future<DraftEntity> imageFuture) {
        try {
            DraftEntity withImage = imageFuture.get();
            draftEventPublisher.publishChanged(withImage, DraftEventEnum.REGENERATE_IMAGE.getCode());
            return null;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            log.warn("Initial image generation failed. draftId={}, reason={}",
                    draftId, cause == null ? ex.getMessage() : cause.getMessage());
            if (cause instanceof GenerationException generationException) {
                return generationException.withDraftId(draftId);
            }
            return new GenerationException(GenerationKindEnum.IMAGE, 0,
                    "image生成失败: " + (cause == null ? ex.getMessage() : cause.getMessage()), cause)
                    .withDraftId(draftId);
        } catch (InterruptedException ex) {
            imageFuture.cancel(true);
            Thread.currentThread().interrupt();
            return new GenerationException(GenerationKindEnum.IMAGE, 0, "image生成等待被中断", ex)
                    .withDraftId(draftId);
        }
    }
}
