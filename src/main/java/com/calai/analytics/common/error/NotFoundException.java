package com.calai.analytics.common.error;

public class NotFoundException extends AnalyticsException {

    public NotFoundException(String code, String message) {
        super(code, message);
    }

    public static NotFoundException session(Long sessionId, Long userId) {
        return new NotFoundException("SESSION_NOT_FOUND",
                "session not found: sessionId=" + sessionId + ", userId=" + userId);
    }
}
