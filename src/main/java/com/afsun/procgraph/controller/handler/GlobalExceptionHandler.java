package com.afsun.procgraph.controller.handler;

import com.afsun.procgraph.core.exceptions.NodeNotFoundException;
import com.afsun.procgraph.core.exceptions.ProcGraphException;
import com.afsun.procgraph.core.exceptions.SourceLoadException;
import com.afsun.procgraph.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 * 统一处理图谱构建与查询中的各类异常
 *
 * @author afsun
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 处理节点未找到异常
     */
    @ExceptionHandler(NodeNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Response<Void> handleNodeNotFoundException(NodeNotFoundException e) {
        log.warn("节点未找到: {}", e.getMessage());
        return Response.fail(404, e.getMessage() +
                "\n建议：1) 检查名称是否正确 2) 名称有歧义时带上模式前缀");
    }

    /**
     * 处理源码加载异常
     */
    @ExceptionHandler(SourceLoadException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleSourceLoadException(SourceLoadException e) {
        log.warn("源码加载失败: {}", e.getMessage());
        return Response.fail(400, e.getFormattedMessage());
    }

    /**
     * 处理其他图谱异常（快照写入等）
     */
    @ExceptionHandler(ProcGraphException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleProcGraphException(ProcGraphException e) {
        log.error("图谱处理异常", e);
        return Response.fail(500, e.getFormattedMessage());
    }

    /**
     * 处理非法参数异常
     */
    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleIllegalArgumentException(Exception e) {
        log.warn("非法参数: {}", e.getMessage());
        return Response.fail(400, "参数错误: " + e.getMessage());
    }

    /**
     * 处理其他未预期异常
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleException(Exception e) {
        log.error("系统异常", e);
        return Response.fail(500, "系统错误: " + e.getMessage() +
                "\n请联系技术支持");
    }
}
