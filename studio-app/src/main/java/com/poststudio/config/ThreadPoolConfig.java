package com.poststudio.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * 生成相关的两个线程池相互隔离：
 * <ul>
 *   <li>generationTaskExecutor：承载新建草稿时并发执行的图片生成任务</li>
 *   <li>generationCallExecutor：承载单次外部调用，调用方据此做超时控制</li>
 * </ul>
 * 图片任务内部还会向 generationCallExecutor 提交调用，两者共用一个池会相互等待。
 * </p>
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "generationTaskExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "generationTaskExecutor")
    public ThreadPoolExecutor generationTaskExecutor(ThreadPoolConfigProperties properties) {
        return new ThreadPoolExecutor(
                Math.max(properties.getCorePoolSize(), 1),
                Math.max(properties.getMaxPoolSize(), Math.max(properties.getCorePoolSize(), 1)),
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                namedThreadFactory("generation-task-"),
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    /**
     * 外部调用线程池：默认 queue-capacity=0，超时后被取消的调用不会堆积在队列里拖慢后续请求。
     * 拒绝策略不能用 CallerRunsPolicy，否则调用在请求线程上执行，超时控制失效。
     */
    @Bean(name = "generationCallExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "generationCallExecutor")
    public ThreadPoolExecutor generationCallExecutor(
            @Value("${studio.generation.call-executor.core-size:8}") int coreSize,
            @Value("${studio.generation.call-executor.max-size:32}") int maxSize,
            @Value("${studio.generation.call-executor.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${studio.generation.call-executor.queue-capacity:0}") int queueCapacity,
            @Value("${studio.generation.call-executor.rejection-policy:AbortPolicy}") String rejectionPolicy) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                Math.max(keepAliveSeconds, 0L),
                TimeUnit.SECONDS,
                queue,
                namedThreadFactory("generation-call-"),
                buildRejectedExecutionHandler(rejectionPolicy));
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    private ThreadFactory namedThreadFactory(String threadNamePrefix) {
        AtomicInteger threadIndex = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
