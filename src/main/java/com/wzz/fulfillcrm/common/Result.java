package com.wzz.fulfillcrm.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 接口统一返回结果
 * <p>
 * 形如 {@code {"success": true, "data": ..., "message": ...}}，失败时带 {@code error}。
 *
 * @param <T> 数据内容的泛型
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Result<T> implements Serializable {

    /**
     * 是否成功
     */
    private boolean success;

    /**
     * 数据内容
     */
    private T data;

    /**
     * 错误信息
     */
    private String error;

    /**
     * 提示信息
     */
    private String message;

    private Result(boolean success, T data, String error, String message) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.message = message;
    }

    // --- 静态工厂方法，方便使用 ---

    public static <T> Result<T> success() {
        return new Result<>(true, null, null, null);
    }

    public static <T> Result<T> success(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> success(String message, T data) {
        return new Result<>(true, data, null, message);
    }

    public static <T> Result<T> error(String error) {
        return new Result<>(false, null, error, null);
    }

    public static <T> Result<T> error(String error, T data) {
        return new Result<>(false, data, error, null);
    }
}
