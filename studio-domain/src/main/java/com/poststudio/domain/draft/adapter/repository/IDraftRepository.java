package com.poststudio.domain.draft.adapter.repository;

import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.domain.draft.model.valobj.DraftStatusStat;
import com.poststudio.types.enums.DraftStatusEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 草稿仓储接口
 *
 * @author poststudio
 * @since 2026-03-02
 */
public interface IDraftRepository {

    /**
     * 保存草稿，回填主键
     */
    DraftEntity save(DraftEntity entity);

    /**
     * 更新草稿 (带乐观锁)，版本冲突时抛出 AppException
     */
    DraftEntity update(DraftEntity entity);

    /**
     * 根据 ID 查询
     */
    DraftEntity findById(Long id);

    /**
     * 查询全部，按创建时间倒序
     */
    List<DraftEntity> findAll();

    /**
     * 按状态查询，按创建时间倒序
     */
    List<DraftEntity> findByStatus(DraftStatusEnum status);

    /**
     * 最近创建的草稿
     */
    DraftEntity findLatest();

    /**
     * 已到计划发布时间的 approved 草稿，按计划时间升序
     */
    List<DraftEntity> findDueForPublish(LocalDateTime now, int limit);

    /**
     * 按状态聚合数量
     */
    List<DraftStatusStat> summarizeByStatus();
}
