package com.poststudio.domain.generation.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 文案生成参数。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TextGenerationOptions {

    /**
     * 语气，如 "friendly"
     */
    private String tone;

    /**
     * 是否使用 emoji
     */
    private boolean includeEmoji;

    /**
     * 最大字符数
     */
    private int maxLength;

    /**
     * 输出语言
     */
    private String language;

    public static TextGenerationOptions defaults() {
        return TextGenerationOptions.builder()
                .tone("friendly")
                .includeEmoji(true)
                .maxLength(300)
                .language("Georgian")
                .build();
    }

    /**
     * 用非空的覆盖值生成新的参数
     */
    public TextGenerationOptions withOverrides(String tone, Boolean includeEmoji, Integer maxLength) {
        TextGenerationOptionsBuilder builder = toBuilder();
        if (tone != null && !tone.isBlank()) {
            builder.tone(tone.trim());
        }
        if (includeEmoji != null) {
            builder.includeEmoji(includeEmoji);
        }
        if (maxLength != null && maxLength > 0) {
            builder.maxLength(maxLength);
        }
        return builder.build();
    }
}
