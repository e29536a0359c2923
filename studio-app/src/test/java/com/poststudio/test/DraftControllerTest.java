package com.poststudio.test;

import com.poststudio.api.dto.DraftCreateRequestDTO;
import com.poststudio.api.dto.DraftDTO;
import com.poststudio.api.dto.DraftStatusSummaryDTO;
import com.poststudio.trigger.application.command.DraftLifecycleCommandService;
import com.poststudio.trigger.application.query.DraftQueryService;
import com.poststudio.trigger.http.DraftController;
import com.poststudio.trigger.http.GlobalApiExceptionHandler;
import com.poststudio.types.enums.DraftEventEnum;
import com.poststudio.types.enums.DraftStatusEnum;
import com.poststudio.types.enums.GenerationKindEnum;
import com.poststudio.types.exception.GenerationException;
import com.poststudio.types.exception.InvalidTransitionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class DraftControllerTest {

    private DraftLifecycleCommandService commandService;
    private DraftQueryService queryService;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        commandService = mock(DraftLifecycleCommandService.class);
        queryService = mock(DraftQueryService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new DraftController(commandService, queryService))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldCreateDraft() throws Exception {
        when(commandService.createAndGenerate(any())).thenReturn(draft(1L, "draft", "A"));

        mockMvc.perform(post("/api/drafts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subject\":\"Rose Vinegar\",\"tone\":\"playful\",\"maxLength\":200}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.draftId").value(1))
                .andExpect(jsonPath("$.data.status").value("draft"));

        ArgumentCaptor<DraftCreateRequestDTO> captor = ArgumentCaptor.forClass(DraftCreateRequestDTO.class);
        verify(commandService).createAndGenerate(captor.capture());
        Assertions.assertEquals("playful", captor.getValue().getTone());
        Assertions.assertEquals(200, captor.getValue().getMaxLength());
    }

    @Test
    public void shouldReturnGenerationFailureWithDraftId() throws Exception {
        when(commandService.createAndGenerate(any()))
                .thenThrow(new GenerationException(GenerationKindEnum.TEXT, 3, "text生成失败", null).withDraftId(5L));

        mockMvc.perform(post("/api/drafts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subject\":\"Rose Vinegar\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0006"))
                .andExpect(jsonPath("$.data.kind").value("text"))
                .andExpect(jsonPath("$.data.draftId").value(5));
    }

    @Test
    public void shouldListByStatus() throws Exception {
        when(queryService.listDrafts("approved")).thenReturn(List.of(draft(2L, "approved", "B")));

        mockMvc.perform(get("/api/drafts").param("status", "approved"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].draftId").value(2))
                .andExpect(jsonPath("$.data[0].status").value("approved"));
    }

    @Test
    public void shouldReturnStatusSummary() throws Exception {
        when(queryService.statusSummary()).thenReturn(List.of(
                new DraftStatusSummaryDTO("draft", 2L),
                new DraftStatusSummaryDTO("approved", 0L)));

        mockMvc.perform(get("/api/drafts/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].status").value("draft"))
                .andExpect(jsonPath("$.data[0].count").value(2));
    }

    @Test
    public void shouldMapInvalidTransitionOnApprove() throws Exception {
        when(commandService.approve(3L))
                .thenThrow(new InvalidTransitionException(3L, DraftStatusEnum.APPROVED, DraftEventEnum.APPROVE));

        mockMvc.perform(post("/api/drafts/3/approve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0005"));
    }

    @Test
    public void shouldEditTextWithSource() throws Exception {
        when(commandService.editText(4L, "C", "human-chat")).thenReturn(draft(4L, "draft", "C"));

        mockMvc.perform(put("/api/drafts/4/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"C\",\"source\":\"human-chat\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.text").value("C"));
    }

    @Test
    public void shouldRegenerateTextWithoutBody() throws Exception {
        when(commandService.regenerateText(eq(4L), isNull())).thenReturn(draft(4L, "draft", "D"));

        mockMvc.perform(post("/api/drafts/4/regenerate-text"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.text").value("D"));
    }

    @Test
    public void shouldScheduleAndCancel() throws Exception {
        LocalDateTime publishAt = LocalDateTime.of(2026, 3, 3, 10, 0);
        when(commandService.schedulePublish(6L, publishAt)).thenReturn(draft(6L, "approved", "A"));
        when(commandService.cancelSchedule(6L)).thenReturn(draft(6L, "approved", "A"));

        mockMvc.perform(put("/api/drafts/6/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"publishAt\":\"2026-03-03T10:00:00\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"));
        mockMvc.perform(delete("/api/drafts/6/schedule"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"));

        verify(commandService).schedulePublish(6L, publishAt);
        verify(commandService).cancelSchedule(6L);
    }

    @Test
    public void shouldBindExternalRef() throws Exception {
        DraftDTO bound = draft(7L, "draft", "A");
        bound.setExternalRefs(Map.of("telegram", "chat:1/msg:42"));
        when(commandService.bindExternalRef(7L, "telegram", "chat:1/msg:42")).thenReturn(bound);

        mockMvc.perform(put("/api/drafts/7/external-refs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\":\"telegram\",\"ref\":\"chat:1/msg:42\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.externalRefs.telegram").value("chat:1/msg:42"));
    }

    @Test
    public void shouldRejectNonNumericId() throws Exception {
        mockMvc.perform(get("/api/drafts/abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0002"));
    }

    private DraftDTO draft(Long id, String status, String text) {
        DraftDTO dto = new DraftDTO();
        dto.setDraftId(id);
        dto.setSubject("Rose Vinegar");
        dto.setStatus(status);
        dto.setText(text);
        return dto;
    }
}
