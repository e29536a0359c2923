package com.poststudio.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 生成配置，前缀 studio.generation。
 */
@Data
@ConfigurationProperties(prefix = "studio.generation", ignoreInvalidFields = true)
public class GenerationProperties {

    /** 单次外部调用超时（毫秒） */
    private long timeoutMs = 30_000L;

    private Retry retry = new Retry();

    private Text text = new Text();

    private Image image = new Image();

    @Data
    public static class Retry {

        /** 最大尝试次数（含首次） */
        private int maxAttempts = 3;

        /** 每次失败后的等待时间，用尽后沿用最后一个值 */
        private List<Long> backoffMs = new ArrayList<>(Arrays.asList(500L, 1000L));
    }

    @Data
    public static class Text {

        private String tone = "friendly";

        private boolean includeEmoji = true;

        private int maxLength = 300;

        private String language = "Georgian";
    }

    @Data
    public static class Image {

        /** {subject} 会被替换为推广主题 */
        private String promptTemplate = "Professional product photography of organic {subject}, glass jar on a rustic "
                + "wooden table, natural sunlight, warm tones, high resolution, commercial quality, no text, no labels";

        private String negativePrompt = "low quality, blurry, distorted, text overlay, watermark, logo, brand name, "
                + "cartoon, illustration";

        private int width = 1024;

        private int height = 1024;

        /** base64 图片落盘目录 */
        private String assetDir = "generated_images";

        /** b64_json 或 url */
        private String responseFormat = "b64_json";
    }
}
