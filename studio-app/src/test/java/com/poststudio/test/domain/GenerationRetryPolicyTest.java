package com.poststudio.test.domain;

import com.poststudio.domain.generation.adapter.gateway.TransientGenerationException;
import com.poststudio.domain.generation.model.valobj.GenerationRetryPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeoutException;

public class GenerationRetryPolicyTest {

    @Test
    public void shouldUseDocumentedDefaults() {
        GenerationRetryPolicy policy = GenerationRetryPolicy.defaults();

        Assertions.assertEquals(3, policy.getMaxAttempts());
        Assertions.assertEquals(List.of(500L, 1000L), policy.getBackoffScheduleMs());
        Assertions.assertEquals(30_000L, policy.getCallTimeoutMs());
    }

    @Test
    public void shouldReuseLastBackoffWhenScheduleExhausted() {
        GenerationRetryPolicy policy = new GenerationRetryPolicy(5, List.of(100L, 200L), 1000L, null);

        Assertions.assertEquals(100L, policy.backoffMsAfter(1));
        Assertions.assertEquals(200L, policy.backoffMsAfter(2));
        Assertions.assertEquals(200L, policy.backoffMsAfter(4));
        Assertions.assertEquals(0L, policy.backoffMsAfter(0));
    }

    @Test
    public void shouldClassifyTimeoutAndTransientAsRetryable() {
        GenerationRetryPolicy policy = GenerationRetryPolicy.defaults();

        Assertions.assertTrue(policy.isRetryable(new TimeoutException("slow")));
        Assertions.assertTrue(policy.isRetryable(new TransientGenerationException("503", null)));
        Assertions.assertTrue(policy.isRetryable(
                new RuntimeException("wrapped", new TransientGenerationException("rate limited", null))));
        Assertions.assertFalse(policy.isRetryable(new IllegalStateException("bad request")));
        Assertions.assertFalse(policy.isRetryable(null));
    }

    @Test
    public void shouldRejectNonPositiveMaxAttempts() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new GenerationRetryPolicy(0, List.of(), 1000L, null));
    }
}
