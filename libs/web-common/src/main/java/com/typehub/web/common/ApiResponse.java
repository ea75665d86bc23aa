package com.typehub.web.common;

import java.io.Serializable;

/**
 * 统一 REST 响应包装。
 * <p>
 * code 与 HTTP 状态码保持一致：200 成功；400 参数错误；404 资源不存在；
 * 409 比赛状态冲突（非法状态迁移、非房主操作等）；500 服务端异常。
 *
 * @param code    状态码
 * @param message 提示信息（面向用户，可直接展示）
 * @param data    业务数据，失败时为 null
 * @param <T>     数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int SERVER_ERROR = 500;

    /** 成功（无数据） */
    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(OK, "success", null);
    }

    /** 成功（带数据） */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(OK, "success", data);
    }

    /** 成功（自定义提示 + 数据） */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(OK, message, data);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(BAD_REQUEST, message, null);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(NOT_FOUND, message, null);
    }

    /** 业务状态冲突，例如比赛已开始后再次加入 */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(CONFLICT, message, null);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(SERVER_ERROR, message, null);
    }

    /** 是否成功（code == 200） */
    public boolean isSuccess() {
        return code == OK;
    }
}
