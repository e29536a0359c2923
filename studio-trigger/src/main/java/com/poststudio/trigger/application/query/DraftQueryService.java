package com.poststudio.trigger.application.query;

import com.poststudio.api.dto.DraftDTO;
import com.poststudio.api.dto.DraftStatusSummaryDTO;
import com.poststudio.api.dto.EditHistoryDTO;
import com.poststudio.domain.draft.model.valobj.DraftStatusStat;
import com.poststudio.domain.draft.service.DraftStoreService;
import com.poststudio.trigger.application.common.DraftViewAssembler;
import com.poststudio.types.enums.DraftStatusEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 草稿查询用例。
 */
@Service
public class DraftQueryService {

    private final DraftStoreService draftStoreService;
    private final DraftViewAssembler draftViewAssembler;

    public DraftQueryService(DraftStoreService draftStoreService,
                             DraftViewAssembler draftViewAssembler) {
        this.draftStoreService = draftStoreService;
        this.draftViewAssembler = draftViewAssembler;
    }

    public DraftDTO getDraft(Long draftId) {
        return draftViewAssembler.toDraftDTO(draftStoreService.getDraft(draftId));
    }

    /**
     * status 为空返回全部，未知状态抛出 IllegalArgumentException。
     */
    public List<DraftDTO> listDrafts(String status) {
        DraftStatusEnum filter = StringUtils.isBlank(status) ? null : DraftStatusEnum.fromCode(status);
        return draftStoreService.listDrafts(filter).stream()
                .map(draftViewAssembler::toDraftDTO)
                .collect(Collectors.toList());
    }

    public List<EditHistoryDTO> getHistory(Long draftId) {
        return draftStoreService.getHistory(draftId).stream()
                .map(draftViewAssembler::toEditHistoryDTO)
                .collect(Collectors.toList());
    }

    /**
     * 最近创建的草稿，没有时返回 null
     */
    public DraftDTO latestDraft() {
        return draftViewAssembler.toDraftDTO(draftStoreService.findLatest());
    }

    /**
     * 各状态草稿数量，没有草稿的状态计 0
     */
    public List<DraftStatusSummaryDTO> statusSummary() {
        Map<DraftStatusEnum, Long> counts = new EnumMap<>(DraftStatusEnum.class);
        List<DraftStatusStat> stats = draftStoreService.summarizeByStatus();
        if (stats != null) {
            for (DraftStatusStat stat : stats) {
                if (stat == null || stat.getStatus() == null) {
                    continue;
                }
                counts.merge(stat.getStatus(), stat.getTotal() == null ? 0L : stat.getTotal(), Long::sum);
            }
        }
        List<DraftStatusSummaryDTO> result = new ArrayList<>();
        for (DraftStatusEnum status : DraftStatusEnum.values()) {
            result.add(new DraftStatusSummaryDTO(status.getCode(), counts.getOrDefault(status, 0L)));
        }
        return result;
    }
}
