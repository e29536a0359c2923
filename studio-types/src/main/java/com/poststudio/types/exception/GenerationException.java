package com.poststudio.types.exception;

import com.poststudio.types.enums.GenerationKindEnum;
import com.poststudio.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 文案 / 图片生成失败：重试耗尽或服务方返回不可重试错误。
 * <p>
 * draftId 在创建草稿后生成失败时携带，便于前端引导人工重试。
 * </p>
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Getter
public class GenerationException extends AppException {

    private static final long serialVersionUID = -1553942106657842318L;

    private final GenerationKindEnum kind;

    private final int attempts;

    private Long draftId;

    public GenerationException(GenerationKindEnum kind, int attempts, String message, Throwable cause) {
        super(ResponseCode.GENERATION_FAILED, message, cause);
        this.kind = kind;
        this.attempts = attempts;
    }

    /**
     * 绑定失败所属草稿，返回自身便于链式抛出。
     */
    public GenerationException withDraftId(Long draftId) {
        this.draftId = draftId;
        return this;
    }
}
