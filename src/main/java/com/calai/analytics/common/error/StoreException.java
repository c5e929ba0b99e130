package com.calai.analytics.common.error;

/** store 讀寫失敗（通常是暫時性），整個 session 交由呼叫端重跑。 */
public class StoreException extends AnalyticsException {

    public StoreException(String message, Throwable cause) {
        super("STORE_ERROR", message, cause);
    }
}
