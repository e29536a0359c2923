package com.poststudio.test;

import com.poststudio.api.dto.DraftStatusSummaryDTO;
import com.poststudio.api.dto.EditHistoryDTO;
import com.poststudio.infrastructure.draft.DraftStoreServiceImpl;
import com.poststudio.test.support.DraftStoreFixture;
import com.poststudio.trigger.application.common.DraftViewAssembler;
import com.poststudio.trigger.application.query.DraftQueryService;
import com.poststudio.types.enums.DraftEventEnum;
import com.poststudio.types.enums.EditSourceEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

public class DraftQueryServiceTest {

    private DraftStoreServiceImpl store;
    private DraftQueryService queryService;

    @BeforeEach
    public void setUp() {
        store = new DraftStoreFixture().store();
        queryService = new DraftQueryService(store, new DraftViewAssembler());
    }

    @Test
    public void shouldSummarizeEveryStatus() {
        store.createDraft("Rose Vinegar");
        Long id = store.createDraft("Honey").getId();
        store.transitionStatus(id, DraftEventEnum.APPROVE);

        List<DraftStatusSummaryDTO> summary = queryService.statusSummary();

        Assertions.assertEquals(List.of("draft", "approved", "rejected", "published"),
                summary.stream().map(DraftStatusSummaryDTO::getStatus).collect(Collectors.toList()));
        Assertions.assertEquals(List.of(1L, 1L, 0L, 0L),
                summary.stream().map(DraftStatusSummaryDTO::getCount).collect(Collectors.toList()));
    }

    @Test
    public void shouldRejectUnknownStatusFilter() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> queryService.listDrafts("archived"));
    }

    @Test
    public void shouldReturnNullLatestWhenEmpty() {
        Assertions.assertNull(queryService.latestDraft());
    }

    @Test
    public void shouldMapHistorySourceCodes() {
        Long id = store.createDraft("Rose Vinegar").getId();
        store.applyTextEdit(id, "A", EditSourceEnum.SYSTEM);
        store.applyTextEdit(id, "B", EditSourceEnum.HUMAN_CHAT);

        Assertions.assertEquals(List.of("system", "human-chat"),
                queryService.getHistory(id).stream().map(EditHistoryDTO::getSource).collect(Collectors.toList()));
        Assertions.assertEquals("B", queryService.getDraft(id).getText());
        Assertions.assertEquals(1, queryService.listDrafts(" ").size());
    }
}
