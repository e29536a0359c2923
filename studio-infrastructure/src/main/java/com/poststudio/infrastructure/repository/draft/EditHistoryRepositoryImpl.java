package com.poststudio.infrastructure.repository.draft;

import com.poststudio.domain.draft.adapter.repository.IEditHistoryRepository;
import com.poststudio.domain.draft.model.entity.EditHistoryEntity;
import com.poststudio.infrastructure.dao.EditHistoryDao;
import com.poststudio.infrastructure.dao.po.EditHistoryPO;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 文案修改历史仓储实现。
 */
@Repository
public class EditHistoryRepositoryImpl implements IEditHistoryRepository {

    private final EditHistoryDao editHistoryDao;

    public EditHistoryRepositoryImpl(EditHistoryDao editHistoryDao) {
        this.editHistoryDao = editHistoryDao;
    }

    @Override
    public EditHistoryEntity save(EditHistoryEntity entity) {
        entity.validate();
        EditHistoryPO po = toPO(entity);
        editHistoryDao.insert(po);
        return toEntity(po);
    }

    @Override
    public List<EditHistoryEntity> findByDraftId(Long draftId) {
        return editHistoryDao.selectByDraftId(draftId).stream().map(this::toEntity).collect(Collectors.toList());
    }

    private EditHistoryEntity toEntity(EditHistoryPO po) {
        EditHistoryEntity entity = EditHistoryEntity.record(
                po.getDraftId(), po.getPreviousText(), po.getNewText(), po.getSource(), po.getCreatedAt());
        entity.setId(po.getId());
        return entity;
    }

    private EditHistoryPO toPO(EditHistoryEntity entity) {
        return EditHistoryPO.builder()
                .id(entity.getId())
                .draftId(entity.getDraftId())
                .previousText(entity.getPreviousText())
                .newText(entity.getNewText())
                .source(entity.getSource())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
