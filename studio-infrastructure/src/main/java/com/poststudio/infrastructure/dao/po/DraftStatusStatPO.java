package com.poststudio.infrastructure.dao.po;

import com.poststudio.types.enums.DraftStatusEnum;
import lombok.Data;

/**
 * 草稿状态聚合统计 PO。
 */
@Data
public class DraftStatusStatPO {

    private DraftStatusEnum status;
    private Long total;
}
