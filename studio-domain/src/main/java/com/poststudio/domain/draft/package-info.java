/**
 * Draft 领域 - 营销草稿生命周期
 *
 * <p>职责：草稿创建、审核状态流转、文案修改审计、定时发布</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.poststudio.domain.draft.model.entity.DraftEntity}</li>
 * </ul>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>Draft - 草稿（主表 drafts）</li>
 *   <li>EditHistory - 文案修改历史（只追加，edit_history）</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>DraftTransitionDomainService - 状态机迁移表</li>
 *   <li>DraftStoreService - 草稿存储端口，唯一的状态写入入口</li>
 *   <li>DraftLockRegistry - 按草稿 ID 的互斥锁</li>
 * </ul>
 *
 * @author poststudio
 * @since 2026-03-02
 */
package com.poststudio.domain.draft;
