package com.bitanalytics.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {
    INVALID_ARGUMENT("INVALID_ARGUMENT", "参数不合法"),
    BAD_REQUEST("BAD_REQUEST", "请求参数错误"),
    STORE_UNAVAILABLE("STORE_UNAVAILABLE", "位图存储不可用"),
    INTERNAL_ERROR("INTERNAL_ERROR", "服务器内部错误");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}
