package com.calai.analytics.testsupport;

import org.springframework.test.context.ActiveProfiles;

/**
 * Spring 測試共用基底：強制 test profile（H2）
 */
@ActiveProfiles("test")
public abstract class BaseSpringTest {
}
