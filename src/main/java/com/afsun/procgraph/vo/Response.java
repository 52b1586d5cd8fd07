package com.afsun.procgraph.vo;

import lombok.Data;

/**
 * 接口统一响应
 *
 * @author afsun
 */
@Data
public class Response<T> {

    public static final String SUCCESS = "200";
    public static final String BAD_REQUEST = "400";
    public static final String NOT_FOUND = "404";
    public static final String FAIL = "500";

    private String status;

    private T data;

    private String message;

    public Response() {
    }

    public Response(String status, T data, String message) {
        this.status = status;
        this.data = data;
        this.message = message;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public static <T> Response<T> success() {
        return new Response<>(SUCCESS, null, "");
    }

    public static <T> Response<T> success(T data) {
        return new Response<>(SUCCESS, data, "");
    }

    /**
     * 失败响应，状态码 500
     */
    public static <T> Response<T> fail(String message) {
        return new Response<>(FAIL, null, message);
    }

    /**
     * 失败响应，自定义状态码
     *
     * @param statusCode 状态码
     * @param message    错误信息
     */
    public static <T> Response<T> fail(int statusCode, String message) {
        return new Response<>(String.valueOf(statusCode), null, message);
    }
}
