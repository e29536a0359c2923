package com.poststudio.domain.draft.service;

import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.domain.draft.model.entity.EditHistoryEntity;
import com.poststudio.domain.draft.model.valobj.DraftStatusStat;
import com.poststudio.types.enums.DraftEventEnum;
import com.poststudio.types.enums.DraftStatusEnum;
import com.poststudio.types.enums.EditSourceEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 草稿存储端口：草稿状态与修改历史的唯一写入入口。
 *
 * <p>每个写操作在草稿锁内、单个事务中完成，返回提交后的快照；
 * 不合法的迁移抛出 InvalidTransitionException 且不产生任何修改。</p>
 *
 * @author poststudio
 * @since 2026-03-02
 */
public interface DraftStoreService {

    /**
     * 新建草稿，状态 draft，文案与图片为空
     */
    DraftEntity createDraft(String subject);

    /**
     * 查询草稿，不存在时抛出 DraftNotFoundException
     */
    DraftEntity getDraft(Long draftId);

    /**
     * 按状态过滤（null 表示全部），创建时间倒序
     */
    List<DraftEntity> listDrafts(DraftStatusEnum statusFilter);

    /**
     * 替换文案并追加历史。人工来源总是记录；AI/系统来源仅在文案变化时记录。
     */
    DraftEntity applyTextEdit(Long draftId, String newText, EditSourceEnum source);

    /**
     * 替换图片引用，不记录历史
     */
    DraftEntity applyImageUpdate(Long draftId, String newImageRef);

    /**
     * approve / reject / publish
     */
    DraftEntity transitionStatus(Long draftId, DraftEventEnum event);

    /**
     * 修改历史，按写入顺序升序
     */
    List<EditHistoryEntity> getHistory(Long draftId);

    DraftEntity schedulePublish(Long draftId, LocalDateTime publishAt);

    DraftEntity cancelSchedule(Long draftId);

    /**
     * 锁内复核计划时间后发布；计划已取消或未到期时原样返回。
     */
    DraftEntity publishIfDue(Long draftId, LocalDateTime now);

    /**
     * 绑定渠道消息引用，任何状态都允许
     */
    DraftEntity bindExternalRef(Long draftId, String channel, String ref);

    List<DraftEntity> findDueForPublish(LocalDateTime now, int limit);

    /**
     * 最近创建的草稿，没有时返回 null
     */
    DraftEntity findLatest();

    List<DraftStatusStat> summarizeByStatus();
}
