package com.seiscatalog;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Simple logging utility that writes to stderr and, optionally, a log file.
 * Writes are serialized so worker threads can log concurrently.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;
    private final boolean debugEnabled;

    private static AppLogger instance;

    private AppLogger(Path logFile, boolean consoleEnabled, boolean debugEnabled) throws IOException {
        this.consoleOutput = System.err;
        this.consoleEnabled = consoleEnabled;
        this.debugEnabled = debugEnabled;

        if (logFile != null) {
            if (logFile.getParent() != null) {
                Files.createDirectories(logFile.getParent());
            }
            // Open log file in append mode
            FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
            this.fileOutput = new PrintStream(fos, true, "UTF-8");

            String separator = "=".repeat(60);
            fileOutput.println();
            fileOutput.println(separator);
            fileOutput.println("SeisCatalog started at " + LocalDateTime.now().format(TIME_FORMAT));
            fileOutput.println(separator);
        } else {
            this.fileOutput = null;
        }
    }

    private AppLogger(boolean debugEnabled) {
        this.consoleOutput = System.err;
        this.consoleEnabled = true;
        this.debugEnabled = debugEnabled;
        this.fileOutput = null;
    }

    /**
     * Replace the active logger. A null logFile logs to the console only.
     */
    public static synchronized void initialize(Path logFile, boolean consoleEnabled, boolean debugEnabled) throws IOException {
        AppLogger previous = instance;
        instance = new AppLogger(logFile, consoleEnabled, debugEnabled);
        if (previous != null) {
            previous.close();
        }
    }

    /**
     * The active logger; a console-only logger is created on first use.
     */
    public static synchronized AppLogger get() {
        if (instance == null) {
            instance = new AppLogger(false);
        }
        return instance;
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void debug(String message) {
        if (debugEnabled) {
            log("DEBUG", message);
        }
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        synchronized (this) {
            log("ERROR", message);
            if (fileOutput != null) {
                t.printStackTrace(fileOutput);
            }
            if (consoleEnabled) {
                t.printStackTrace(consoleOutput);
            }
        }
    }

    private synchronized void log(String level, String message) {
        String timestamp = LocalDateTime.now().format(TIME_FORMAT);
        String line = String.format("[%s] [%s] [%s] %s", timestamp, level, Thread.currentThread().getName(), message);

        if (fileOutput != null) {
            fileOutput.println(line);
        }

        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    public synchronized void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}
