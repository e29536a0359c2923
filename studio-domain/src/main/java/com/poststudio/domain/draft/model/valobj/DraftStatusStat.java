package com.poststudio.domain.draft.model.valobj;

import com.poststudio.types.enums.DraftStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 按状态聚合的草稿数量。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DraftStatusStat {

    private DraftStatusEnum status;

    private Long total;
}
