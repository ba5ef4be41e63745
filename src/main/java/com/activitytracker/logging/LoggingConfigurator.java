package com.activitytracker.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import com.activitytracker.config.LoggingConfig;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Applies {@link LoggingConfig} to the running Logback context: root level plus a size-rotated
 * file appender. Safe to call again after a configuration reload.
 */
public final class LoggingConfigurator {

    private static final String FILE_APPENDER_NAME = "ACTIVITY_FILE";
    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";
    private static final String SQLITE_LOGGER = "org.sqlite";

    private LoggingConfigurator() {
    }

    public static void apply(LoggingConfig config) throws IOException {
        Objects.requireNonNull(config, "config");
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return;
        }
        synchronized (context) {
            Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.toLevel(config.level(), Level.INFO));
            context.getLogger(SQLITE_LOGGER).setLevel(Level.WARN);
            replaceFileAppender(context, root, config);
        }
    }

    private static void replaceFileAppender(LoggerContext context, Logger root, LoggingConfig config) throws IOException {
        var previous = root.getAppender(FILE_APPENDER_NAME);
        if (previous != null) {
            root.detachAppender(previous);
            previous.stop();
        }

        Path logPath = Path.of(config.file()).toAbsolutePath();
        if (logPath.getParent() != null) {
            Files.createDirectories(logPath.getParent());
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setName(FILE_APPENDER_NAME);
        appender.setContext(context);
        appender.setFile(logPath.toString());
        appender.setEncoder(encoder);

        FixedWindowRollingPolicy rollingPolicy = new FixedWindowRollingPolicy();
        rollingPolicy.setContext(context);
        rollingPolicy.setParent(appender);
        rollingPolicy.setFileNamePattern(logPath + ".%i");
        rollingPolicy.setMinIndex(1);
        rollingPolicy.setMaxIndex(Math.max(1, config.rotationCount()));
        rollingPolicy.start();

        SizeBasedTriggeringPolicy<ILoggingEvent> triggeringPolicy = new SizeBasedTriggeringPolicy<>();
        triggeringPolicy.setContext(context);
        triggeringPolicy.setMaxFileSize(FileSize.valueOf(Math.max(1, config.maxSizeMB()) + "MB"));
        triggeringPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        appender.setTriggeringPolicy(triggeringPolicy);
        appender.start();

        root.addAppender(appender);
    }
}
