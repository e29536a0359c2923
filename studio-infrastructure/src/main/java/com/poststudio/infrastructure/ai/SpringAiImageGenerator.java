package com.poststudio.infrastructure.ai;

import com.poststudio.domain.generation.adapter.gateway.IImageGenerator;
import com.poststudio.domain.generation.adapter.gateway.TransientGenerationException;
import com.poststudio.domain.generation.model.valobj.ImageGenerationOptions;
import com.poststudio.types.enums.ResponseCode;
import com.poststudio.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.image.Image;
import org.springframework.ai.image.ImageGeneration;
import org.springframework.ai.image.ImageModel;
import org.springframework.ai.image.ImageOptionsBuilder;
import org.springframework.ai.image.ImagePrompt;
import org.springframework.ai.image.ImageResponse;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;
import java.util.UUID;

/**
 * 基于 Spring AI ImageModel 的图片生成实现。
 * 服务返回 URL 时直接作为引用；返回 base64 时落盘到 asset 目录，以文件路径作为引用。
 */
@Slf4j
@Component
public class SpringAiImageGenerator implements IImageGenerator {

    private final ImageModel imageModel;
    private final Path assetDir;
    private final String responseFormat;

    public SpringAiImageGenerator(ImageModel imageModel,
                                  @Value("${studio.generation.image.asset-dir:generated_images}") String assetDir,
                                  @Value("${studio.generation.image.response-format:b64_json}") String responseFormat) {
        this.imageModel = imageModel;
        this.assetDir = Paths.get(assetDir);
        this.responseFormat = responseFormat;
    }

    @Override
    public String generate(String subject, ImageGenerationOptions options) {
        ImageGenerationOptions effective = options == null ? ImageGenerationOptions.defaults() : options;
        String prompt = buildPrompt(subject, effective);
        ImageOptionsBuilder optionsBuilder = ImageOptionsBuilder.builder()
                .N(1)
                .responseFormat(responseFormat);
        if (effective.getWidth() > 0 && effective.getHeight() > 0) {
            optionsBuilder.width(effective.getWidth()).height(effective.getHeight());
        }
        ImageResponse response;
        try {
            response = imageModel.call(new ImagePrompt(prompt, optionsBuilder.build()));
        } catch (TransientAiException | ResourceAccessException ex) {
            throw new TransientGenerationException("图片生成服务暂时不可用: " + ex.getMessage(), ex);
        }
        ImageGeneration generation = response == null ? null : response.getResult();
        Image image = generation == null ? null : generation.getOutput();
        if (image == null) {
            return null;
        }
        if (StringUtils.isNotBlank(image.getUrl())) {
            return image.getUrl();
        }
        if (StringUtils.isNotBlank(image.getB64Json())) {
            return writeAsset(subject, image.getB64Json());
        }
        return null;
    }

    static String buildPrompt(String subject, ImageGenerationOptions options) {
        String prompt = options.renderPrompt(subject);
        if (StringUtils.isNotBlank(options.getNegativePrompt())) {
            prompt = prompt + ". Avoid: " + options.getNegativePrompt().trim();
        }
        return prompt;
    }

    private String writeAsset(String subject, String b64Json) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(b64Json);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.GENERATION_FAILED, "图片数据不是合法的 base64", ex);
        }
        String slug = StringUtils.defaultIfBlank(subject, "image").trim().replaceAll("[^\\p{L}\\p{N}]+", "_");
        Path target = assetDir.resolve("product_" + slug + "_" + UUID.randomUUID() + ".png");
        try {
            Files.createDirectories(assetDir);
            Files.write(target, bytes);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "图片保存失败: " + target, ex);
        }
        log.info("Generated image saved. subject={}, path={}, bytes={}", subject, target, bytes.length);
        return target.toAbsolutePath().toString();
    }
}
