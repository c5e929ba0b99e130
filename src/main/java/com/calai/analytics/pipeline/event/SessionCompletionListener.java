package com.calai.analytics.pipeline.event;

import com.calai.analytics.common.error.NotFoundException;
import com.calai.analytics.pipeline.service.SessionCompletionProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCompletionListener {

    private final SessionCompletionProcessor processor;

    /** 找不到 session 只記 log；store 失敗往外拋，由事件發布端重送 */
    @EventListener
    public void onSessionCompleted(WorkoutSessionCompletedEvent event) {
        try {
            processor.processSessionCompletion(event.sessionId(), event.userId(), event.zone());
        } catch (NotFoundException e) {
            log.warn("[session-completion] event failed: sessionId={}, userId={}, code={}",
                    event.sessionId(), event.userId(), e.code(), e);
        }
    }
}
