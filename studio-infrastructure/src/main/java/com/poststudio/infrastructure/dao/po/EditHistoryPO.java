package com.poststudio.infrastructure.dao.po;

import com.poststudio.types.enums.EditSourceEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 文案修改历史 PO，对应表 edit_history。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditHistoryPO {

    private Long id;
    private Long draftId;
    private String previousText;
    private String newText;
    private EditSourceEnum source;
    private LocalDateTime createdAt;
}
