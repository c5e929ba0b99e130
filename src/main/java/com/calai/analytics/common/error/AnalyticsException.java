package com.calai.analytics.common.error;

/**
 * 分析管線的例外基底：錯誤碼（例如 SESSION_NOT_FOUND）放在 code()，message 是給 log 看的描述。
 */
public abstract class AnalyticsException extends RuntimeException {
    private final String code;

    protected AnalyticsException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected AnalyticsException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() { return code; }
}
