package com.poststudio.infrastructure.dao;

import com.poststudio.infrastructure.dao.po.DraftPO;
import com.poststudio.infrastructure.dao.po.DraftStatusStatPO;
import com.poststudio.types.enums.DraftStatusEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 草稿 DAO
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Mapper
public interface DraftDao {

    /**
     * 插入草稿，回填 id
     */
    int insert(DraftPO po);

    /**
     * 根据 ID 更新 (带乐观锁)
     */
    int updateWithVersion(DraftPO po);

    DraftPO selectById(@Param("id") Long id);

    /**
     * 全部草稿，创建时间倒序
     */
    List<DraftPO> selectAll();

    List<DraftPO> selectByStatus(@Param("status") DraftStatusEnum status);

    DraftPO selectLatest();

    /**
     * 到期待发布草稿 (用于定时发布)
     */
    List<DraftPO> selectDueForPublish(@Param("now") LocalDateTime now,
                                      @Param("limit") Integer limit);

    List<DraftStatusStatPO> selectStatusStats();
}
