package com.poststudio.config;

import com.poststudio.domain.generation.model.valobj.GenerationRetryPolicy;
import com.poststudio.domain.generation.model.valobj.ImageGenerationOptions;
import com.poststudio.domain.generation.model.valobj.TextGenerationOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 生成编排所需的策略与默认参数。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {

    @Bean
    public GenerationRetryPolicy generationRetryPolicy(GenerationProperties properties) {
        GenerationRetryPolicy policy = new GenerationRetryPolicy(
                Math.max(properties.getRetry().getMaxAttempts(), 1),
                properties.getRetry().getBackoffMs(),
                properties.getTimeoutMs(),
                GenerationRetryPolicy.DEFAULT_RETRYABLE);
        log.info("Generation retry policy loaded. maxAttempts={}, backoffMs={}, timeoutMs={}",
                policy.getMaxAttempts(), policy.getBackoffScheduleMs(), policy.getCallTimeoutMs());
        return policy;
    }

    @Bean
    public TextGenerationOptions defaultTextGenerationOptions(GenerationProperties properties) {
        GenerationProperties.Text text = properties.getText();
        return TextGenerationOptions.builder()
                .tone(text.getTone())
                .includeEmoji(text.isIncludeEmoji())
                .maxLength(text.getMaxLength())
                .language(text.getLanguage())
                .build();
    }

    @Bean
    public ImageGenerationOptions defaultImageGenerationOptions(GenerationProperties properties) {
        GenerationProperties.Image image = properties.getImage();
        return ImageGenerationOptions.builder()
                .promptTemplate(image.getPromptTemplate())
                .negativePrompt(image.getNegativePrompt())
                .width(image.getWidth())
                .height(image.getHeight())
                .build();
    }
}
