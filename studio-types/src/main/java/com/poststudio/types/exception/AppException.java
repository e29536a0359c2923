package com.poststudio.types.exception;

import com.poststudio.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 所有业务异常的基类，携带响应码与描述信息，由 HTTP 层统一转换为 {@code Response}。
 * 草稿不存在、非法状态迁移、生成失败等均为其子类。
 * </p>
 *
 * @author poststudio
 * @since 2026-03-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 2861650423577103112L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    /**
     * 以响应码和自定义描述创建异常。
     *
     * @param responseCode 响应码
     * @param message 描述信息，为空时使用响应码默认描述
     */
    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message == null ? responseCode.getInfo() : message);
    }

    public AppException(ResponseCode responseCode, String message, Throwable cause) {
        this(responseCode.getCode(), message == null ? responseCode.getInfo() : message, cause);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
