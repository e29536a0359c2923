package com.poststudio.domain.generation.adapter.gateway;

/**
 * 生成服务的暂时性错误（限流、5xx、网络中断），可重试。
 */
public class TransientGenerationException extends RuntimeException {

    public TransientGenerationException(String message) {
        super(message);
    }

    public TransientGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
