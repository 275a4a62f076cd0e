package com.wzz.fulfillcrm.exception;

import cn.dev33.satoken.exception.NotLoginException;
import cn.dev33.satoken.exception.NotPermissionException;
import cn.dev33.satoken.exception.NotRoleException;
import cn.dev33.satoken.exception.SaTokenException;
import com.wzz.fulfillcrm.common.Result;
import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.MyBatisSystemException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Result<?>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        log.warn("不支持的请求方法: {}", e.getMessage());
        return build(HttpStatus.METHOD_NOT_ALLOWED, "不支持的请求方法");
    }

    /**
     * 处理请求参数类型转换失败 (如: "?clientId=p" 无法转为 Long)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Result<?>> handleMethodArgumentTypeMismatch(MethodArgumentTypeMismatchException ex) {
        Class<?> requiredType = ex.getRequiredType();
        String message = String.format("参数 [%s] 的值 '%s' 不是有效的 %s 类型",
                ex.getName(),
                ex.getValue(),
                requiredType != null ? requiredType.getSimpleName() : "未知");
        log.warn("请求参数类型错误: {}", message);
        return build(HttpStatus.BAD_REQUEST, message);
    }

    /**
     * 统一处理参数校验异常 (JSR-303)，MethodArgumentNotValidException 是 BindException 的子类
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<Result<?>> handleBindException(BindException e) {
        String msg = "参数校验失败";
        FieldError fieldError = e.getBindingResult().getFieldError();
        if (fieldError != null) {
            msg = fieldError.getField() + " " + fieldError.getDefaultMessage();
        }
        log.warn("参数校验或绑定异常: {}", msg);
        return build(HttpStatus.BAD_REQUEST, msg);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Result<?>> handleMissingServletRequestParameterException(MissingServletRequestParameterException e) {
        String msg = "必需的请求参数 '" + e.getParameterName() + "' 不存在";
        log.warn(msg);
        return build(HttpStatus.BAD_REQUEST, msg);
    }

    // JSON解析失败
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Result<?>> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        log.warn("请求体JSON解析失败: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "请求参数格式错误");
    }

    @ExceptionHandler(NotLoginException.class)
    public ResponseEntity<Result<?>> handleNotLoginException(NotLoginException nle) {
        String message;
        if (NotLoginException.NOT_TOKEN.equals(nle.getType())) {
            message = "请求头未提供Token";
        } else if (NotLoginException.INVALID_TOKEN.equals(nle.getType())) {
            message = "Token无效";
        } else if (NotLoginException.TOKEN_TIMEOUT.equals(nle.getType())) {
            message = "Token已过期";
        } else {
            message = "当前会话未登录";
        }
        return build(HttpStatus.UNAUTHORIZED, message);
    }

    @ExceptionHandler({NotRoleException.class, NotPermissionException.class})
    public ResponseEntity<Result<?>> handleNotRoleException(SaTokenException e) {
        log.warn("权限不足: {}", e.getMessage());
        return build(HttpStatus.FORBIDDEN, "权限不足");
    }

    @ExceptionHandler(SaTokenException.class)
    public ResponseEntity<Result<?>> handleSaTokenException(SaTokenException e) {
        log.error("未知SaToken异常: code={}, msg={}", e.getCode(), e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "认证服务器错误");
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Result<?>> handleBusinessException(BusinessException e) {
        log.warn("业务异常: code={}, msg={}", e.getCode(), e.getMessage());
        HttpStatus status = HttpStatus.resolve(e.getCode());
        if (status == null) {
            status = HttpStatus.BAD_REQUEST;
        }
        return ResponseEntity.status(status).body(Result.error(e.getMessage(), e.getData()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Result<?>> handleNoResourceFoundException(NoResourceFoundException e) {
        log.warn("资源未找到：{}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, "您访问的资源不存在");
    }

    /**
     * 数据库框架异常MyBatisSystemException
     */
    @ExceptionHandler(MyBatisSystemException.class)
    public ResponseEntity<Result<?>> handleMyBatisSystemException(MyBatisSystemException e) {
        log.error("数据库框架处理异常: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "数据库框架处理异常");
    }

    // 全局异常兜底
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<?>> handleAllException(Exception e) {
        log.error("服务器未知异常", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "系统繁忙，未知错误，请稍后再试");
    }

    private ResponseEntity<Result<?>> build(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Result.error(message));
    }
}
