package com.afsun.procgraph.core.exceptions;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 存储过程图谱异常基类
 * 携带错误码、出错的文件或目录以及处理建议
 *
 * @author afsun
 */
@Getter
public class ProcGraphException extends RuntimeException {

    private final String errorCode;

    /**
     * 出错的文件或目录，可为空
     */
    private final Path location;

    /**
     * 建议解决方案
     */
    private final String suggestion;

    protected ProcGraphException(String errorCode, String message, Path location, String suggestion,
                                 Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.location = location;
        this.suggestion = suggestion;
    }

    /**
     * [错误码] 信息，附带位置与建议
     */
    public String getFormattedMessage() {
        StringBuilder sb = new StringBuilder("[").append(errorCode).append("] ").append(getMessage());
        if (location != null) {
            sb.append("\n位置: ").append(location.toAbsolutePath());
        }
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\n建议: ").append(suggestion);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getFormattedMessage();
    }
}
