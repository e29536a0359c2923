package com.poststudio.domain.generation.adapter.gateway;

import com.poststudio.domain.generation.model.valobj.TextGenerationRequest;

/**
 * 文案生成服务端口。暂时性错误抛出 TransientGenerationException，其它异常视为永久失败。
 */
public interface ITextGenerator {

    String generate(TextGenerationRequest request);
}
