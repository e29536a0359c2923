package com.poststudio.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 定时发布请求。
 */
@Data
public class DraftScheduleRequestDTO {

    private LocalDateTime publishAt;
}
