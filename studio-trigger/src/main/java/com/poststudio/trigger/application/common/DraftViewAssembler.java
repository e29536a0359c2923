package com.poststudio.trigger.application.common;

import com.poststudio.api.dto.DraftDTO;
import com.poststudio.api.dto.EditHistoryDTO;
import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.domain.draft.model.entity.EditHistoryEntity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Draft 视图组装器：统一 DraftDTO / EditHistoryDTO 映射。
 */
@Component
public class DraftViewAssembler {

    public DraftDTO toDraftDTO(DraftEntity draft) {
        if (draft == null) {
            return null;
        }
        DraftDTO dto = new DraftDTO();
        dto.setDraftId(draft.getId());
        dto.setSubject(draft.getSubject());
        dto.setText(draft.getText());
        dto.setImageRef(draft.getImageRef());
        dto.setStatus(draft.getStatus() == null ? null : draft.getStatus().getCode());
        dto.setExternalRefs(draft.getExternalRefs() == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(draft.getExternalRefs()));
        dto.setScheduledPublishAt(draft.getScheduledPublishAt());
        dto.setPublishedAt(draft.getPublishedAt());
        dto.setCreatedAt(draft.getCreatedAt());
        dto.setUpdatedAt(draft.getUpdatedAt());
        return dto;
    }

    public EditHistoryDTO toEditHistoryDTO(EditHistoryEntity entry) {
        if (entry == null) {
            return null;
        }
        EditHistoryDTO dto = new EditHistoryDTO();
        dto.setHistoryId(entry.getId());
        dto.setDraftId(entry.getDraftId());
        dto.setPreviousText(entry.getPreviousText());
        dto.setNewText(entry.getNewText());
        dto.setSource(entry.getSource() == null ? null : entry.getSource().getCode());
        dto.setCreatedAt(entry.getCreatedAt());
        return dto;
    }
}
