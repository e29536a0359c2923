package com.poststudio.domain.draft.model.entity;

import com.poststudio.types.enums.DraftEventEnum;
import com.poststudio.types.enums.DraftStatusEnum;
import com.poststudio.types.enums.EditSourceEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 草稿领域实体
 *
 * <p>所有修改方法只由草稿存储在持有草稿锁时调用；状态合法性由
 * {@link com.poststudio.domain.draft.service.DraftTransitionDomainService} 事先判定。</p>
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Data
public class DraftEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 推广主题（如产品名称）
     */
    private String subject;

    /**
     * 当前文案，首次生成成功前为空
     */
    private String text;

    /**
     * 当前图片引用（路径或 URL），首次生成成功前为空
     */
    private String imageRef;

    /**
     * 状态
     */
    private DraftStatusEnum status;

    /**
     * 各渠道当前展示该草稿的消息引用 (channel -> ref)
     */
    private Map<String, String> externalRefs;

    /**
     * 计划发布时间
     */
    private LocalDateTime scheduledPublishAt;

    /**
     * 发布时间
     */
    private LocalDateTime publishedAt;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 新建草稿：状态 draft，文案与图片为空。
     */
    public static DraftEntity create(String subject, LocalDateTime now) {
        DraftEntity entity = new DraftEntity();
        entity.setSubject(subject);
        entity.setStatus(DraftStatusEnum.DRAFT);
        entity.setExternalRefs(new LinkedHashMap<>());
        entity.setVersion(0);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    /**
     * 验证草稿是否有效
     */
    public void validate() {
        if (subject == null || subject.trim().isEmpty()) {
            throw new IllegalStateException("Draft subject cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalStateException("Draft timestamps cannot be null");
        }
        if (updatedAt.isBefore(createdAt)) {
            throw new IllegalStateException("updatedAt cannot be earlier than createdAt");
        }
    }

    /**
     * 状态迁移 (approve / reject / publish)
     */
    public void applyStatus(DraftEventEnum event, DraftStatusEnum targetStatus, LocalDateTime now) {
        this.status = targetStatus;
        if (event == DraftEventEnum.PUBLISH) {
            this.publishedAt = now;
        }
        if (targetStatus.isTerminal()) {
            this.scheduledPublishAt = null;
        }
        touch(now);
    }

    /**
     * 替换文案并生成对应的历史记录，previousText 取替换前的文案。
     */
    public EditHistoryEntity replaceText(String newText, EditSourceEnum source, LocalDateTime now) {
        EditHistoryEntity entry = EditHistoryEntity.record(this.id, this.text, newText, source, now);
        this.text = newText;
        touch(now);
        return entry;
    }

    /**
     * 替换图片引用，图片变更不记录历史
     */
    public void replaceImage(String newImageRef, LocalDateTime now) {
        this.imageRef = newImageRef;
        touch(now);
    }

    /**
     * 设置计划发布时间
     */
    public void schedulePublish(LocalDateTime publishAt, LocalDateTime now) {
        this.scheduledPublishAt = publishAt;
        touch(now);
    }

    /**
     * 取消计划发布
     */
    public void cancelSchedule(LocalDateTime now) {
        this.scheduledPublishAt = null;
        touch(now);
    }

    /**
     * 绑定渠道消息引用，同一渠道只保留最新一条；ref 为空表示解绑。
     */
    public void bindExternalRef(String channel, String ref, LocalDateTime now) {
        Map<String, String> next = this.externalRefs == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(this.externalRefs);
        if (ref == null || ref.isBlank()) {
            next.remove(channel);
        } else {
            next.put(channel, ref);
        }
        this.externalRefs = next;
        touch(now);
    }

    public boolean isTextUnchanged(String candidate) {
        return Objects.equals(this.text, candidate);
    }

    public boolean isImageUnchanged(String candidate) {
        return Objects.equals(this.imageRef, candidate);
    }

    public boolean hasContent() {
        return this.text != null || this.imageRef != null;
    }

    /**
     * 检查是否已到计划发布时间
     */
    public boolean isDueForPublish(LocalDateTime now) {
        return this.status == DraftStatusEnum.APPROVED
                && this.scheduledPublishAt != null
                && !this.scheduledPublishAt.isAfter(now);
    }

    /**
     * 增加版本号 (用于乐观锁)
     */
    public void incrementVersion() {
        this.version = this.version == null ? 1 : this.version + 1;
    }

    /**
     * 深拷贝，供仓储与调用方隔离快照
     */
    public DraftEntity copy() {
        DraftEntity copied = new DraftEntity();
        copied.setId(this.id);
        copied.setSubject(this.subject);
        copied.setText(this.text);
        copied.setImageRef(this.imageRef);
        copied.setStatus(this.status);
        copied.setExternalRefs(this.externalRefs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(this.externalRefs));
        copied.setScheduledPublishAt(this.scheduledPublishAt);
        copied.setPublishedAt(this.publishedAt);
        copied.setVersion(this.version);
        copied.setCreatedAt(this.createdAt);
        copied.setUpdatedAt(this.updatedAt);
        return copied;
    }

    /**
     * updatedAt 严格递增，时钟回拨或同一微秒内多次修改时顺延 1 微秒。
     */
    private void touch(LocalDateTime now) {
        LocalDateTime candidate = now.truncatedTo(ChronoUnit.MICROS);
        if (this.updatedAt != null && !candidate.isAfter(this.updatedAt)) {
            candidate = this.updatedAt.plus(1, ChronoUnit.MICROS);
        }
        this.updatedAt = candidate;
    }
}
