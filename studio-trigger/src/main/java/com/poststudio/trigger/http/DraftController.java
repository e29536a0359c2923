package com.poststudio.trigger.http;

import com.poststudio.api.dto.DraftCreateRequestDTO;
import com.poststudio.api.dto.DraftDTO;
import com.poststudio.api.dto.DraftExternalRefRequestDTO;
import com.poststudio.api.dto.DraftRegenerateTextRequestDTO;
import com.poststudio.api.dto.DraftScheduleRequestDTO;
import com.poststudio.api.dto.DraftStatusSummaryDTO;
import com.poststudio.api.dto.DraftTextEditRequestDTO;
import com.poststudio.api.dto.EditHistoryDTO;
import com.poststudio.api.response.Response;
import com.poststudio.trigger.application.command.DraftLifecycleCommandService;
import com.poststudio.trigger.application.query.DraftQueryService;
import com.poststudio.types.enums.ResponseCode;
import com.poststudio.types.exception.AppException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 草稿看板 API。
 */
@RestController
@RequestMapping("/api/drafts")
public class DraftController {

    private final DraftLifecycleCommandService draftLifecycleCommandService;
    private final DraftQueryService draftQueryService;

    public DraftController(DraftLifecycleCommandService draftLifecycleCommandService,
                           DraftQueryService draftQueryService) {
        this.draftLifecycleCommandService = draftLifecycleCommandService;
        this.draftQueryService = draftQueryService;
    }

    @PostMapping
    public Response<DraftDTO> create(@RequestBody DraftCreateRequestDTO request) {
        return success(draftLifecycleCommandService.createAndGenerate(request));
    }

    @GetMapping
    public Response<List<DraftDTO>> list(@RequestParam(value = "status", required = false) String status) {
        return success(draftQueryService.listDrafts(status));
    }

    @GetMapping("/latest")
    public Response<DraftDTO> latest() {
        return success(draftQueryService.latestDraft());
    }

    @GetMapping("/summary")
    public Response<List<DraftStatusSummaryDTO>> summary() {
        return success(draftQueryService.statusSummary());
    }

    @GetMapping("/{id}")
    public Response<DraftDTO> get(@PathVariable("id") Long draftId) {
        return success(draftQueryService.getDraft(draftId));
    }

    @GetMapping("/{id}/history")
    public Response<List<EditHistoryDTO>> history(@PathVariable("id") Long draftId) {
        return success(draftQueryService.getHistory(draftId));
    }

    @PostMapping("/{id}/approve")
    public Response<DraftDTO> approve(@PathVariable("id") Long draftId) {
        return success(draftLifecycleCommandService.approve(draftId));
    }

    @PostMapping("/{id}/reject")
    public Response<DraftDTO> reject(@PathVariable("id") Long draftId) {
        return success(draftLifecycleCommandService.reject(draftId));
    }

    @PostMapping("/{id}/publish")
    public Response<DraftDTO> publish(@PathVariable("id") Long draftId) {
        return success(draftLifecycleCommandService.publish(draftId));
    }

    @PutMapping("/{id}/text")
    public Response<DraftDTO> editText(@PathVariable("id") Long draftId,
                                       @RequestBody DraftTextEditRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        return success(draftLifecycleCommandService.editText(draftId, request.getText(), request.getSource()));
    }

    @PostMapping("/{id}/regenerate-text")
    public Response<DraftDTO> regenerateText(@PathVariable("id") Long draftId,
                                             @RequestBody(required = false) DraftRegenerateTextRequestDTO request) {
        String instruction = request == null ? null : request.getInstruction();
        return success(draftLifecycleCommandService.regenerateText(draftId, instruction));
    }

    @PostMapping("/{id}/regenerate-image")
    public Response<DraftDTO> regenerateImage(@PathVariable("id") Long draftId) {
        return success(draftLifecycleCommandService.regenerateImage(draftId));
    }

    @PutMapping("/{id}/schedule")
    public Response<DraftDTO> schedule(@PathVariable("id") Long draftId,
                                       @RequestBody DraftScheduleRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        return success(draftLifecycleCommandService.schedulePublish(draftId, request.getPublishAt()));
    }

    @DeleteMapping("/{id}/schedule")
    public Response<DraftDTO> cancelSchedule(@PathVariable("id") Long draftId) {
        return success(draftLifecycleCommandService.cancelSchedule(draftId));
    }

    @PutMapping("/{id}/external-refs")
    public Response<DraftDTO> bindExternalRef(@PathVariable("id") Long draftId,
                                              @RequestBody DraftExternalRefRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        return success(draftLifecycleCommandService.bindExternalRef(draftId, request.getChannel(), request.getRef()));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
