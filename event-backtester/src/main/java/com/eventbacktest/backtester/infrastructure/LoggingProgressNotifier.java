package com.eventbacktest.backtester.infrastructure;

import com.eventbacktest.backtester.domain.BacktestProgress;
import com.eventbacktest.backtester.domain.ProgressNotifier;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingProgressNotifier implements ProgressNotifier {

    @Override
    public void onProgress(BacktestProgress progress) {
        log.info("Progress: {}/{} bars ({}%)", progress.barsProcessed(), progress.totalBars(),
                progress.percentComplete());
    }
}
