package com.nayem.courier.retry;

import com.nayem.courier.core.RequestKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a warning for each retried attempt.
 */
public class LoggingRetryListener implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

    @Override
    public boolean isEnabled() {
        return log.isWarnEnabled();
    }

    @Override
    public void onRetry(RequestKind kind, Class<?> requestType, int attempt, long delayMillis, Throwable error) {
        log.warn("{} '{}' execution failed at attempt {}, will retry in {}ms.",
                kind.getDisplayName(), requestType.getName(), attempt, delayMillis, error);
    }
}
