package com.poststudio.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 生成线程池配置属性，前缀 thread.pool.executor.config。
 *
 * @author poststudio
 * @since 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认4 */
    private Integer corePoolSize = 4;

    /** 最大线程数，默认16 */
    private Integer maxPoolSize = 16;

    /** 空闲线程最大存活时间（秒），默认60 */
    private Long keepAliveTime = 60L;

    /** 阻塞队列最大容量，默认200 */
    private Integer blockQueueSize = 200;

    /**
     * 拒绝策略，默认AbortPolicy。
     * <ul>
     *   <li>AbortPolicy：丢弃任务并抛出RejectedExecutionException异常</li>
     *   <li>DiscardPolicy：直接丢弃任务，不抛出异常</li>
     *   <li>DiscardOldestPolicy：将最早进入队列的任务删除，之后再尝试加入队列</li>
     *   <li>CallerRunsPolicy：如果任务添加线程池失败，主线程自己执行该任务</li>
     * </ul>
     */
    private String policy = "AbortPolicy";

}
