package com.poststudio.domain.generation.adapter.gateway;

import com.poststudio.domain.generation.model.valobj.ImageGenerationOptions;

/**
 * 图片生成服务端口，返回图片引用（文件路径或 URL），原样存入草稿。
 */
public interface IImageGenerator {

    String generate(String subject, ImageGenerationOptions options);
}
