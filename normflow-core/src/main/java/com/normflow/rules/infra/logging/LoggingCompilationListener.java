package com.normflow.rules.infra.logging;

import com.normflow.rules.api.CompilationListener;

import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reports compilation progress through {@code java.util.logging}.
 */
public class LoggingCompilationListener implements CompilationListener {
    private static final Logger logger = Logger.getLogger(LoggingCompilationListener.class.getName());

    private final Level progressLevel;

    public LoggingCompilationListener() {
        this(Level.INFO);
    }

    public LoggingCompilationListener(Level progressLevel) {
        this.progressLevel = progressLevel;
    }

    @Override
    public void onStageStart(String stageName, int stageNumber, int totalStages) {
        logger.log(progressLevel, () -> String.format("Stage %d/%d %s started", stageNumber, totalStages, stageName));
    }

    @Override
    public void onStageComplete(String stageName, StageResult result) {
        logger.log(progressLevel, () -> String.format("Stage %s completed in %.2f ms %s",
                stageName, result.durationNanos() / 1_000_000.0, describe(result.metrics())));
    }

    @Override
    public void onError(String stageName, Exception error) {
        logger.log(Level.SEVERE, "Stage " + stageName + " failed: " + error.getMessage(), error);
    }

    static String describe(Map<String, Object> metrics) {
        return new TreeMap<>(metrics).toString();
    }
}
