package com.poststudio.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 草稿状态统计。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DraftStatusSummaryDTO {

    private String status;
    private Long count;
}
