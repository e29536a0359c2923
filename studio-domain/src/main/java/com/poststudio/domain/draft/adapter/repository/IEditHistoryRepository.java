package com.poststudio.domain.draft.adapter.repository;

import com.poststudio.domain.draft.model.entity.EditHistoryEntity;

import java.util.List;

/**
 * 文案修改历史仓储接口，只提供追加与查询。
 *
 * @author poststudio
 * @since 2026-03-02
 */
public interface IEditHistoryRepository {

    /**
     * 追加历史记录，回填主键
     */
    EditHistoryEntity save(EditHistoryEntity entity);

    /**
     * 按草稿查询，按写入顺序升序
     */
    List<EditHistoryEntity> findByDraftId(Long draftId);
}
