package com.poststudio.types.exception;

import com.poststudio.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 草稿不存在。
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Getter
public class DraftNotFoundException extends AppException {

    private static final long serialVersionUID = -4127785230915420761L;

    private final Long draftId;

    public DraftNotFoundException(Long draftId) {
        super(ResponseCode.DRAFT_NOT_FOUND, "草稿不存在: " + draftId);
        this.draftId = draftId;
    }
}
