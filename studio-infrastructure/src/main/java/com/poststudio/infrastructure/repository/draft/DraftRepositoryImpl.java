package com.poststudio.infrastructure.repository.draft;

import com.poststudio.domain.draft.adapter.repository.IDraftRepository;
import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.domain.draft.model.valobj.DraftStatusStat;
import com.poststudio.infrastructure.dao.DraftDao;
import com.poststudio.infrastructure.dao.po.DraftPO;
import com.poststudio.infrastructure.dao.po.DraftStatusStatPO;
import com.poststudio.infrastructure.util.JsonCodec;
import com.poststudio.types.enums.DraftStatusEnum;
import com.poststudio.types.enums.ResponseCode;
import com.poststudio.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 草稿仓储实现类。
 * <p>
 * 负责草稿的持久化操作，包括：
 * <ul>
 *   <li>草稿的增改查（带乐观锁）</li>
 *   <li>按状态、计划发布时间查询</li>
 *   <li>JSONB 字段 externalRefs 的序列化/反序列化</li>
 * </ul>
 * </p>
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class DraftRepositoryImpl implements IDraftRepository {

    private final DraftDao draftDao;
    private final JsonCodec jsonCodec;

    public DraftRepositoryImpl(DraftDao draftDao, JsonCodec jsonCodec) {
        this.draftDao = draftDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public DraftEntity save(DraftEntity entity) {
        entity.validate();
        DraftPO po = toPO(entity);
        draftDao.insert(po);
        return toEntity(po);
    }

    @Override
    public DraftEntity update(DraftEntity entity) {
        entity.validate();
        Integer oldVersion = entity.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for Draft update: " + entity.getId());
        }
        DraftPO po = toPO(entity);
        int affected = draftDao.updateWithVersion(po);
        if (affected == 0) {
            log.warn("Draft optimistic lock failed. draftId={}, version={}", entity.getId(), oldVersion);
            throw new AppException(ResponseCode.CONCURRENT_MODIFICATION,
                    "Optimistic lock failed for Draft: " + entity.getId());
        }
        Integer newVersion = oldVersion + 1;
        entity.setVersion(newVersion);
        po.setVersion(newVersion);
        return toEntity(po);
    }

    @Override
    public DraftEntity findById(Long id) {
        DraftPO po = draftDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<DraftEntity> findAll() {
        return draftDao.selectAll().stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public List<DraftEntity> findByStatus(DraftStatusEnum status) {
        return draftDao.selectByStatus(status).stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public DraftEntity findLatest() {
        DraftPO po = draftDao.selectLatest();
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<DraftEntity> findDueForPublish(LocalDateTime now, int limit) {
        return draftDao.selectDueForPublish(now, limit).stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public List<DraftStatusStat> summarizeByStatus() {
        return draftDao.selectStatusStats().stream().map(this::toStat).collect(Collectors.toList());
    }

    private DraftStatusStat toStat(DraftStatusStatPO po) {
        return new DraftStatusStat(po.getStatus(), po.getTotal() == null ? 0L : po.getTotal());
    }

    private DraftEntity toEntity(DraftPO po) {
        DraftEntity entity = new DraftEntity();
        entity.setId(po.getId());
        entity.setSubject(po.getSubject());
        entity.setText(po.getText());
        entity.setImageRef(po.getImageRef());
        entity.setStatus(po.getStatus());
        entity.setExternalRefs(jsonCodec.readStringMap(po.getExternalRefs()));
        entity.setScheduledPublishAt(po.getScheduledPublishAt());
        entity.setPublishedAt(po.getPublishedAt());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private DraftPO toPO(DraftEntity entity) {
        DraftPO po = DraftPO.builder()
                .id(entity.getId())
                .subject(entity.getSubject())
                .text(entity.getText())
                .imageRef(entity.getImageRef())
                .status(entity.getStatus())
                .scheduledPublishAt(entity.getScheduledPublishAt())
                .publishedAt(entity.getPublishedAt())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
        po.setExternalRefs(jsonCodec.writeValue(entity.getExternalRefs()));
        return po;
    }
}
