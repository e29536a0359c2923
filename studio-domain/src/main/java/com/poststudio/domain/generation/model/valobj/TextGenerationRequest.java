package com.poststudio.domain.generation.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 文案生成请求。seedText 非空时表示基于现有文案改写。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextGenerationRequest {

    private String subject;

    private TextGenerationOptions options;

    /**
     * 当前文案，改写时作为底稿
     */
    private String seedText;

    /**
     * 改写指令，如 "make it shorter"
     */
    private String instruction;

    public static TextGenerationRequest fresh(String subject, TextGenerationOptions options) {
        return TextGenerationRequest.builder()
                .subject(subject)
                .options(options)
                .build();
    }

    public static TextGenerationRequest revision(String subject,
                                                 String seedText,
                                                 String instruction,
                                                 TextGenerationOptions options) {
        return TextGenerationRequest.builder()
                .subject(subject)
                .options(options)
                .seedText(seedText)
                .instruction(instruction)
                .build();
    }

    public boolean isRevision() {
        return seedText != null && !seedText.isBlank();
    }
}
