package com.poststudio.test.domain;

import com.poststudio.config.ThreadPoolConfig;
import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.domain.draft.service.DraftStoreService;
import com.poststudio.domain.generation.adapter.gateway.IImageGenerator;
import com.poststudio.domain.generation.adapter.gateway.ITextGenerator;
import com.poststudio.domain.generation.adapter.gateway.TransientGenerationException;
import com.poststudio.domain.generation.model.valobj.GenerationRetryPolicy;
import com.poststudio.domain.generation.model.valobj.ImageGenerationOptions;
import com.poststudio.domain.generation.model.valobj.TextGenerationOptions;
import com.poststudio.domain.generation.model.valobj.TextGenerationRequest;
import com.poststudio.domain.generation.service.GenerationOrchestratorService;
import com.poststudio.types.enums.GenerationKindEnum;
import com.poststudio.types.exception.GenerationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class GenerationOrchestratorServiceTest {

    private ITextGenerator textGenerator;
    private IImageGenerator imageGenerator;
    private DraftStoreService draftStoreService;
    private ExecutorService callExecutor;
    private GenerationOrchestratorService service;

    @BeforeEach
    public void setUp() {
        textGenerator = mock(ITextGenerator.class);
        imageGenerator = mock(IImageGenerator.class);
        draftStoreService = mock(DraftStoreService.class);
        callExecutor = Executors.newCachedThreadPool();
        service = new GenerationOrchestratorService(
                textGenerator,
                imageGenerator,
                draftStoreService,
                new GenerationRetryPolicy(3, List.of(0L), 100L, null),
                callExecutor,
                TextGenerationOptions.defaults(),
                ImageGenerationOptions.defaults());
    }

    @AfterEach
    public void tearDown() {
        callExecutor.shutdownNow();
    }

    @Test
    public void shouldFailWithAttemptsAfterRepeatedTimeouts() throws Exception {
        when(textGenerator.generate(any())).thenAnswer(invocation -> {
            Thread.sleep(2000L);
            return "late";
        });

        GenerationException ex = Assertions.assertThrows(GenerationException.class,
                () -> service.generateText("Rose Vinegar", null));

        Assertions.assertEquals(GenerationKindEnum.TEXT, ex.getKind());
        Assertions.assertEquals(3, ex.getAttempts());
        Assertions.assertTrue(ex.getCause() instanceof TimeoutException);
        verify(textGenerator, times(3)).generate(any());
    }

    @Test
    public void shouldSucceedAfterTransientFailure() {
        when(imageGenerator.generate(anyString(), any()))
                .thenThrow(new TransientGenerationException("503"))
                .thenReturn("/assets/product_rose.png");

        String imageRef = service.generateImage("Rose Vinegar", null);

        Assertions.assertEquals("/assets/product_rose.png", imageRef);
        verify(imageGenerator, times(2)).generate(anyString(), any());
    }

    @Test
    public void shouldNotRetryPermanentFailure() {
        when(textGenerator.generate(any())).thenThrow(new IllegalStateException("invalid api key"));

        GenerationException ex = Assertions.assertThrows(GenerationException.class,
                () -> service.generateText("Rose Vinegar", null));

        Assertions.assertEquals(1, ex.getAttempts());
        Assertions.assertEquals("0006", ex.getCode());
        verify(textGenerator, times(1)).generate(any());
    }

    @Test
    public void shouldTreatBlankOutputAsFailure() {
        when(textGenerator.generate(any())).thenReturn("   ");

        GenerationException ex = Assertions.assertThrows(GenerationException.class,
                () -> service.generateText("Rose Vinegar", null));

        Assertions.assertEquals(GenerationKindEnum.TEXT, ex.getKind());
        Assertions.assertNull(ex.getCause());
        verify(textGenerator, times(1)).generate(any());
    }

    @Test
    public void shouldPassDefaultOptionsForFreshText() {
        when(textGenerator.generate(any())).thenReturn("Fresh rose vinegar!");

        service.generateText("Rose Vinegar", null);

        ArgumentCaptor<TextGenerationRequest> captor = ArgumentCaptor.forClass(TextGenerationRequest.class);
        verify(textGenerator).generate(captor.capture());
        Assertions.assertFalse(captor.getValue().isRevision());
        Assertions.assertEquals("Georgian", captor.getValue().getOptions().getLanguage());
        Assertions.assertEquals(300, captor.getValue().getOptions().getMaxLength());
    }

    @Test
    public void shouldReviseCurrentTextWithInstruction() {
        DraftEntity draft = DraftEntity.create("Rose Vinegar", LocalDateTime.of(2026, 3, 2, 9, 0));
        draft.setId(11L);
        draft.setText("Long original post");
        when(draftStoreService.getDraft(11L)).thenReturn(draft);
        when(textGenerator.generate(any())).thenReturn("Short post");

        String text = service.regenerateText(11L, "  make it shorter ");

        Assertions.assertEquals("Short post", text);
        ArgumentCaptor<TextGenerationRequest> captor = ArgumentCaptor.forClass(TextGenerationRequest.class);
        verify(textGenerator).generate(captor.capture());
        Assertions.assertTrue(captor.getValue().isRevision());
        Assertions.assertEquals("Long original post", captor.getValue().getSeedText());
        Assertions.assertEquals("make it shorter", captor.getValue().getInstruction());
    }

    @Test
    public void shouldAttachDraftIdWhenRegenerationFails() {
        DraftEntity draft = DraftEntity.create("Rose Vinegar", LocalDateTime.of(2026, 3, 2, 9, 0));
        draft.setId(12L);
        when(draftStoreService.getDraft(12L)).thenReturn(draft);
        when(imageGenerator.generate(anyString(), any())).thenThrow(new IllegalStateException("content policy"));

        GenerationException ex = Assertions.assertThrows(GenerationException.class,
                () -> service.regenerateImage(12L));

        Assertions.assertEquals(12L, ex.getDraftId());
        Assertions.assertEquals(GenerationKindEnum.IMAGE, ex.getKind());
    }

    @Test
    public void shouldNotRunCallOnCallerThreadWhenCallPoolIsFull() throws Exception {
        ThreadPoolExecutor fullPool = new ThreadPoolConfig().generationCallExecutor(1, 1, 60L, 0, "AbortPolicy");
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busy = new CountDownLatch(1);
        fullPool.execute(() -> {
            busy.countDown();
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        Assertions.assertTrue(busy.await(5, TimeUnit.SECONDS));
        when(textGenerator.generate(any())).thenAnswer(invocation -> {
            Thread.sleep(2000L);
            return "late";
        });
        GenerationOrchestratorService saturated = new GenerationOrchestratorService(
                textGenerator,
                imageGenerator,
                draftStoreService,
                new GenerationRetryPolicy(3, List.of(0L), 100L, null),
                fullPool,
                TextGenerationOptions.defaults(),
                ImageGenerationOptions.defaults());

        try {
            long start = System.currentTimeMillis();
            GenerationException ex = Assertions.assertThrows(GenerationException.class,
                    () -> saturated.generateText("Rose Vinegar", null));
            long costMs = System.currentTimeMillis() - start;

            Assertions.assertEquals(GenerationKindEnum.TEXT, ex.getKind());
            Assertions.assertEquals(3, ex.getAttempts());
            Assertions.assertTrue(ex.getCause() instanceof TransientGenerationException);
            Assertions.assertTrue(costMs < 1500L, "call ran on the caller thread: " + costMs + "ms");
            verify(textGenerator, never()).generate(any());
        } finally {
            release.countDown();
            fullPool.shutdownNow();
        }
    }
}
