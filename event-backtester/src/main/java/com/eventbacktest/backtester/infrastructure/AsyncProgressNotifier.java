package com.eventbacktest.backtester.infrastructure;

import com.eventbacktest.backtester.domain.BacktestProgress;
import com.eventbacktest.backtester.domain.ProgressNotifier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.Map;

/**
 * Hands progress to a delegate on a task executor so the bar loop never waits for it.
 * Delegate failures and rejected submissions are logged and dropped.
 */
@Slf4j
public class AsyncProgressNotifier implements ProgressNotifier {

    private final TaskExecutor taskExecutor;
    private final ProgressNotifier delegate;

    public AsyncProgressNotifier(TaskExecutor taskExecutor, ProgressNotifier delegate) {
        this.taskExecutor = taskExecutor;
        this.delegate = delegate;
    }

    @Override
    public void onProgress(BacktestProgress progress) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        try {
            taskExecutor.execute(() -> deliver(progress, context));
        } catch (TaskRejectedException e) {
            log.warn("Dropped progress update {}/{}: {}", progress.barsProcessed(), progress.totalBars(), e.getMessage());
        }
    }

    private void deliver(BacktestProgress progress, Map<String, String> context) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            delegate.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("Progress delivery failed at {}/{}: {}", progress.barsProcessed(), progress.totalBars(),
                    e.getMessage(), e);
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }
}
