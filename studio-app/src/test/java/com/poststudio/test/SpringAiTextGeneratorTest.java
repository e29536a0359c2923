package com.poststudio.test;

import com.poststudio.domain.generation.adapter.gateway.TransientGenerationException;
import com.poststudio.domain.generation.model.valobj.TextGenerationOptions;
import com.poststudio.domain.generation.model.valobj.TextGenerationRequest;
import com.poststudio.infrastructure.ai.SpringAiTextGenerator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SpringAiTextGeneratorTest {

    private ChatClient chatClient;
    private SpringAiTextGenerator generator;

    @BeforeEach
    public void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        generator = new SpringAiTextGenerator(chatClient);
    }

    @Test
    public void shouldReturnTrimmedContent() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenReturn("  Fresh rose vinegar 🌹  ");

        String text = generator.generate(TextGenerationRequest.fresh("Rose Vinegar", TextGenerationOptions.defaults()));

        Assertions.assertEquals("Fresh rose vinegar 🌹", text);
    }

    @Test
    public void shouldReturnNullForBlankContent() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(" ");

        Assertions.assertNull(generator.generate(TextGenerationRequest.fresh("Rose Vinegar", null)));
    }

    @Test
    public void shouldTranslateTransientAiFailure() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call())
                .thenThrow(new TransientAiException("429 Too Many Requests"));

        Assertions.assertThrows(TransientGenerationException.class,
                () -> generator.generate(TextGenerationRequest.fresh("Rose Vinegar", null)));
    }

    @Test
    public void shouldPassThroughPermanentAiFailure() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call())
                .thenThrow(new NonTransientAiException("401 Unauthorized"));

        Assertions.assertThrows(NonTransientAiException.class,
                () -> generator.generate(TextGenerationRequest.fresh("Rose Vinegar", null)));
    }
}
