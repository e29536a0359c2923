package com.poststudio.infrastructure.ai;

import com.poststudio.domain.generation.adapter.gateway.ITextGenerator;
import com.poststudio.domain.generation.adapter.gateway.TransientGenerationException;
import com.poststudio.domain.generation.model.valobj.TextGenerationOptions;
import com.poststudio.domain.generation.model.valobj.TextGenerationRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

/**
 * 基于 Spring AI ChatClient 的文案生成实现。
 * 限流、5xx 与网络错误转换为 TransientGenerationException，其余异常原样抛出。
 */
@Slf4j
@Component
public class SpringAiTextGenerator implements ITextGenerator {

    private final ChatClient chatClient;

    @Autowired
    public SpringAiTextGenerator(ChatModel chatModel) {
        this(ChatClient.builder(chatModel).build());
    }

    public SpringAiTextGenerator(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String generate(TextGenerationRequest request) {
        TextGenerationOptions options = request.getOptions() == null
                ? TextGenerationOptions.defaults()
                : request.getOptions();
        String systemPrompt = TextPromptFactory.buildSystemPrompt(options);
        String userPrompt = TextPromptFactory.buildUserPrompt(request);
        log.debug("Text generation request. subject={}, revision={}", request.getSubject(), request.isRevision());
        String content;
        try {
            ChatClient.CallResponseSpec response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .call();
            content = response == null ? null : response.content();
        } catch (TransientAiException | ResourceAccessException ex) {
            throw new TransientGenerationException("文案生成服务暂时不可用: " + ex.getMessage(), ex);
        }
        return StringUtils.trimToNull(content);
    }
}
