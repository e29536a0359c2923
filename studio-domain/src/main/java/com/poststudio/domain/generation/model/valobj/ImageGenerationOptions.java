package com.poststudio.domain.generation.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 图片生成参数。promptTemplate 中的 {subject} 会被替换为推广主题。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ImageGenerationOptions {

    private String promptTemplate;

    private String negativePrompt;

    private int width;

    private int height;

    public static ImageGenerationOptions defaults() {
        return ImageGenerationOptions.builder()
                .promptTemplate("Professional product photography of {subject}, studio lighting, "
                        + "clean background, high quality, commercial photo")
                .negativePrompt("text, watermark, logo, blurry, low quality")
                .width(1024)
                .height(1024)
                .build();
    }

    public String renderPrompt(String subject) {
        String template = promptTemplate == null || promptTemplate.isBlank() ? "{subject}" : promptTemplate;
        return template.replace("{subject}", subject == null ? "" : subject);
    }
}
