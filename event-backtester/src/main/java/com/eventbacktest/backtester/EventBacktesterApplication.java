package com.eventbacktest.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the event-driven backtester.
 * Runs backtests and walk-forward suites in-process; see {@code backtest.suite.*} for the startup runner.
 */
@SpringBootApplication
public class EventBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventBacktesterApplication.class, args);
    }

}
