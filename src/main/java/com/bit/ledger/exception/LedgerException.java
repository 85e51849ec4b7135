package com.bit.ledger.exception;

/**
 * 账本层自定义异常：统一封装异常类型与错误信息
 */
public class LedgerException extends RuntimeException {

    private final ErrorType errorType;

    private final String detail;

    public LedgerException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
        this.detail = message;
    }

    public LedgerException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
        this.detail = message;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * 不带类型前缀的原始信息，接口层直接返回给调用方
     */
    public String getDetail() {
        return detail;
    }

    public static LedgerException notFound(String message) {
        return new LedgerException(ErrorType.NOT_FOUND, message);
    }

    public static LedgerException conflict(String message) {
        return new LedgerException(ErrorType.CONFLICT, message);
    }

    public static LedgerException inputError(String message) {
        return new LedgerException(ErrorType.INPUT_ERROR, message);
    }
}
