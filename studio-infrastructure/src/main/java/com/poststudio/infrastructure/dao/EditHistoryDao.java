package com.poststudio.infrastructure.dao;

import com.poststudio.infrastructure.dao.po.EditHistoryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 文案修改历史 DAO，只追加。
 */
@Mapper
public interface EditHistoryDao {

    int insert(EditHistoryPO po);

    List<EditHistoryPO> selectByDraftId(@Param("draftId") Long draftId);
}
