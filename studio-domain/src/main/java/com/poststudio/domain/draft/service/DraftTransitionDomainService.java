package com.poststudio.domain.draft.service;

import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.types.enums.DraftEventEnum;
import com.poststudio.types.enums.DraftStatusEnum;
import com.poststudio.types.exception.InvalidTransitionException;
import org.springframework.stereotype.Service;

/**
 * Draft 状态机领域服务：判定 (当前状态, 事件) 是否合法并给出目标状态。
 */
@Service
public class DraftTransitionDomainService {

    /**
     * 返回目标状态；不允许的组合返回 null。
     */
    public DraftStatusEnum resolveTargetStatus(DraftStatusEnum currentStatus, DraftEventEnum event) {
        if (currentStatus == null || event == null || currentStatus.isTerminal()) {
            return null;
        }
        return switch (currentStatus) {
            case DRAFT -> switch (event) {
                case APPROVE -> DraftStatusEnum.APPROVED;
                case REJECT -> DraftStatusEnum.REJECTED;
                case EDIT_TEXT, REGENERATE_TEXT, REGENERATE_IMAGE -> DraftStatusEnum.DRAFT;
                default -> null;
            };
            case APPROVED -> switch (event) {
                case EDIT_TEXT, SCHEDULE_PUBLISH, CANCEL_SCHEDULE -> DraftStatusEnum.APPROVED;
                case PUBLISH -> DraftStatusEnum.PUBLISHED;
                case REJECT -> DraftStatusEnum.REJECTED;
                default -> null;
            };
            case REJECTED, PUBLISHED -> null;
        };
    }

    public boolean isAllowed(DraftStatusEnum currentStatus, DraftEventEnum event) {
        return resolveTargetStatus(currentStatus, event) != null;
    }

    /**
     * 校验迁移，不合法时抛出 InvalidTransitionException，草稿保持不变。
     */
    public DraftStatusEnum requireTransition(DraftEntity draft, DraftEventEnum event) {
        DraftStatusEnum target = resolveTargetStatus(draft.getStatus(), event);
        if (target == null) {
            throw new InvalidTransitionException(draft.getId(), draft.getStatus(), event);
        }
        return target;
    }

    /**
     * 只改变状态的事件 (approve / reject / publish)
     */
    public boolean isStatusEvent(DraftEventEnum event) {
        return event == DraftEventEnum.APPROVE
                || event == DraftEventEnum.REJECT
                || event == DraftEventEnum.PUBLISH;
    }
}
