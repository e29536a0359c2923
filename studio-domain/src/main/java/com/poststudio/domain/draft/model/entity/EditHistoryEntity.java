package com.poststudio.domain.draft.model.entity;

import com.poststudio.types.enums.EditSourceEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 文案修改历史实体，只追加，不更新不删除。
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Data
public class EditHistoryEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 草稿 ID
     */
    private Long draftId;

    /**
     * 修改前文案（全文快照）
     */
    private String previousText;

    /**
     * 修改后文案（全文快照）
     */
    private String newText;

    /**
     * 修改来源
     */
    private EditSourceEnum source;

    /**
     * 写入时间
     */
    private LocalDateTime createdAt;

    public static EditHistoryEntity record(Long draftId,
                                           String previousText,
                                           String newText,
                                           EditSourceEnum source,
                                           LocalDateTime createdAt) {
        EditHistoryEntity entry = new EditHistoryEntity();
        entry.setDraftId(draftId);
        entry.setPreviousText(previousText);
        entry.setNewText(newText);
        entry.setSource(source);
        entry.setCreatedAt(createdAt);
        return entry;
    }

    public void validate() {
        if (draftId == null) {
            throw new IllegalStateException("Draft ID cannot be null");
        }
        if (source == null) {
            throw new IllegalStateException("Edit source cannot be null");
        }
    }

    public EditHistoryEntity copy() {
        EditHistoryEntity copied = record(draftId, previousText, newText, source, createdAt);
        copied.setId(id);
        return copied;
    }
}
