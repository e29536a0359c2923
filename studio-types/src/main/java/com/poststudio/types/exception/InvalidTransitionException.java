package com.poststudio.types.exception;

import com.poststudio.types.enums.DraftEventEnum;
import com.poststudio.types.enums.DraftStatusEnum;
import com.poststudio.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 草稿状态机不允许的 (状态, 事件) 组合。
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Getter
public class InvalidTransitionException extends AppException {

    private static final long serialVersionUID = 6029315894027361410L;

    private final Long draftId;
    private final DraftStatusEnum fromStatus;
    private final DraftEventEnum event;

    public InvalidTransitionException(Long draftId, DraftStatusEnum fromStatus, DraftEventEnum event) {
        super(ResponseCode.INVALID_TRANSITION, String.format("草稿 %s 当前状态 %s 不支持操作 %s",
                draftId,
                fromStatus == null ? "-" : fromStatus.getCode(),
                event == null ? "-" : event.getCode()));
        this.draftId = draftId;
        this.fromStatus = fromStatus;
        this.event = event;
    }
}
