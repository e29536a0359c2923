package com.poststudio.domain.generation.service;

import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.domain.draft.service.DraftStoreService;
import com.poststudio.domain.generation.adapter.gateway.IImageGenerator;
import com.poststudio.domain.generation.adapter.gateway.ITextGenerator;
import com.poststudio.domain.generation.adapter.gateway.TransientGenerationException;
import com.poststudio.domain.generation.model.valobj.GenerationRetryPolicy;
import com.poststudio.domain.generation.model.valobj.ImageGenerationOptions;
import com.poststudio.domain.generation.model.valobj.TextGenerationOptions;
import com.poststudio.domain.generation.model.valobj.TextGenerationRequest;
import com.poststudio.types.enums.GenerationKindEnum;
import com.poststudio.types.exception.GenerationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 生成编排领域服务：调用文案/图片生成端口，负责超时、重试与结果校验。
 *
 * <p>只读取草稿（改写时取底稿），从不写入草稿存储。</p>
 */
@Slf4j
@Service
public class GenerationOrchestratorService {

    private static final String METRIC_ATTEMPT = "studio.generation.attempt.total";

    private final ITextGenerator textGenerator;
    private final IImageGenerator imageGenerator;
    private final DraftStoreService draftStoreService;
    private final GenerationRetryPolicy retryPolicy;
    private final ExecutorService generationCallExecutor;
    private final TextGenerationOptions defaultTextOptions;
    private final ImageGenerationOptions defaultImageOptions;

    public GenerationOrchestratorService(ITextGenerator textGenerator,
                                         IImageGenerator imageGenerator,
                                         DraftStoreService draftStoreService,
                                         GenerationRetryPolicy retryPolicy,
                                         @Qualifier("generationCallExecutor") ExecutorService generationCallExecutor,
                                         TextGenerationOptions defaultTextOptions,
                                         ImageGenerationOptions defaultImageOptions) {
        this.textGenerator = textGenerator;
        this.imageGenerator = imageGenerator;
        this.draftStoreService = draftStoreService;
        this.retryPolicy = retryPolicy;
        this.generationCallExecutor = generationCallExecutor;
        this.defaultTextOptions = defaultTextOptions == null ? TextGenerationOptions.defaults() : defaultTextOptions;
        this.defaultImageOptions = defaultImageOptions == null ? ImageGenerationOptions.defaults() : defaultImageOptions;
    }

    public String generateText(String subject, TextGenerationOptions options) {
        TextGenerationOptions effective = options == null ? defaultTextOptions : options;
        TextGenerationRequest request = TextGenerationRequest.fresh(subject, effective);
        return executeWithRetry(GenerationKindEnum.TEXT, subject, () -> textGenerator.generate(request));
    }

    public String generateImage(String subject, ImageGenerationOptions options) {
        ImageGenerationOptions effective = options == null ? defaultImageOptions : options;
        return executeWithRetry(GenerationKindEnum.IMAGE, subject, () -> imageGenerator.generate(subject, effective));
    }

    /**
     * 基于草稿当前文案改写；草稿还没有文案时按主题重新生成。
     */
    public String regenerateText(Long draftId, String instruction) {
        DraftEntity draft = draftStoreService.getDraft(draftId);
        TextGenerationRequest request = TextGenerationRequest.revision(
                draft.getSubject(), draft.getText(), StringUtils.trimToNull(instruction), defaultTextOptions);
        try {
            return executeWithRetry(GenerationKindEnum.TEXT, draft.getSubject(), () -> textGenerator.generate(request));
        } catch (GenerationException ex) {
            throw ex.withDraftId(draftId);
        }
    }

    public String regenerateImage(Long draftId) {
        DraftEntity draft = draftStoreService.getDraft(draftId);
        try {
            return generateImage(draft.getSubject(), defaultImageOptions);
        } catch (GenerationException ex) {
            throw ex.withDraftId(draftId);
        }
    }

    public TextGenerationOptions getDefaultTextOptions() {
        return defaultTextOptions;
    }

    public ImageGenerationOptions getDefaultImageOptions() {
        return defaultImageOptions;
    }

    private String executeWithRetry(GenerationKindEnum kind, String subject, Callable<String> call) {
        int maxAttempts = retryPolicy.getMaxAttempts();
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String result;
            try {
                result = callWithTimeout(call);
            } catch (Exception ex) {
                lastError = ex;
                boolean retryable = retryPolicy.isRetryable(ex);
                recordAttempt(kind, retryable ? "transient_failure" : "permanent_failure");
                log.warn("Generation attempt failed. kind={}, subject={}, attempt={}/{}, retryable={}, reason={}",
                        kind.getCode(), subject, attempt, maxAttempts, retryable, describe(ex));
                if (!retryable) {
                    throw new GenerationException(kind, attempt,
                            kind.getCode() + "生成失败: " + describe(ex), ex);
                }
                sleepBackoff(kind, attempt, maxAttempts, ex);
                continue;
            }
            if (StringUtils.isBlank(result)) {
                recordAttempt(kind, "blank");
                log.warn("Generation returned blank output. kind={}, subject={}, attempt={}/{}",
                        kind.getCode(), subject, attempt, maxAttempts);
                throw new GenerationException(kind, attempt, kind.getCode() + "生成服务返回空内容", null);
            }
            recordAttempt(kind, "success");
            if (attempt > 1) {
                log.info("Generation succeeded after retry. kind={}, subject={}, attempt={}", kind.getCode(), subject, attempt);
            }
            return result;
        }
        throw new GenerationException(kind, maxAttempts,
                kind.getCode() + "生成失败且已重试" + maxAttempts + "次: " + describe(lastError), lastError);
    }

    /**
     * 调用线程池满时不在当前线程执行调用，按暂时性失败进入重试。
     */
    private String callWithTimeout(Callable<String> call) throws Exception {
        long timeoutMs = retryPolicy.getCallTimeoutMs();
        if (timeoutMs <= 0L || generationCallExecutor == null) {
            return call.call();
        }
        Future<String> future;
        try {
            future = generationCallExecutor.submit(call);
        } catch (RejectedExecutionException ex) {
            throw new TransientGenerationException("生成调用线程池已满", ex);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw ex;
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw new RuntimeException(cause);
        }
    }

    private void sleepBackoff(GenerationKindEnum kind, int attempt, int maxAttempts, Exception lastError) {
        if (attempt >= maxAttempts) {
            return;
        }
        long backoffMs = retryPolicy.backoffMsAfter(attempt);
        if (backoffMs <= 0L) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new GenerationException(kind, attempt, kind.getCode() + "生成重试等待被中断", lastError);
        }
    }

    private void recordAttempt(GenerationKindEnum kind, String outcome) {
        Counter.builder(METRIC_ATTEMPT)
                .tag("kind", kind.getCode())
                .tag("outcome", outcome)
                .register(Metrics.globalRegistry)
                .increment();
    }

    private String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        if (throwable instanceof TimeoutException) {
            return "调用超时(" + retryPolicy.getCallTimeoutMs() + "ms)";
        }
        return StringUtils.defaultIfBlank(throwable.getMessage(), throwable.getClass().getSimpleName());
    }
}
