package dev.trex.devtools.log;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;

/**
 * Mirrors runner output (System.out, System.err and {@link Logger}) into an optional runner log file.
 * Closing the context flushes the file and puts the console streams back.
 */
public class LoggingContext implements AutoCloseable {
    public static final String TREX_DONT_SPLIT_LOGS = "TREX_DONT_SPLIT_LOGS";

    private final OutputStream logOutputStream;

    private PrintStream originalOut;
    private PrintStream originalErr;

    private LoggingContext(String logFile) {
        this.logOutputStream = getOutputStream(logFile);
    }

    public boolean isConfigured() {
        return originalOut != null;
    }

    public void configureMainLoggers() {
        if (logOutputStream == null || isConfigured()) {
            return;
        }
        originalOut = System.out;
        originalErr = System.err;

        PrintStream systemOut = buildLoggingStream(System.out);
        PrintStream systemErr = buildLoggingStream(System.err);

        System.setOut(systemOut);
        System.setErr(systemErr);

        Logger.out = systemOut;
        Logger.err = systemErr;
    }

    @Override
    public void close() {
        if (isConfigured()) {
            System.out.flush();
            System.err.flush();

            System.setOut(originalOut);
            System.setErr(originalErr);
            Logger.out = originalOut;
            Logger.err = originalErr;

            originalOut = null;
            originalErr = null;
        }
        closeOutputStream(logOutputStream);
    }

    private TeePrintStream buildLoggingStream(PrintStream stream) {
        while (stream instanceof TeePrintStream) {
            stream = ((TeePrintStream) stream).getConsole();
        }
        return new TeePrintStream(logOutputStream, stream);
    }


    private static OutputStream getOutputStream(String filename) {
        if (filename == null) {
            return null;
        }
        try {
            return new BufferedOutputStream(new FileOutputStream(filename));
        } catch (IOException e) {
            System.err.println("Failed to configure runner log " + filename + ": " + e.getMessage());
            return null; // console only
        }
    }

    private static void closeOutputStream(OutputStream outputStream) {
        if (outputStream != null) {
            try {
                outputStream.close();
            } catch (IOException e) {
                System.err.println("Failed to close runner log: " + e.getMessage());
            }
        }
    }

    public static LoggingContext optional(String fileName) {
        boolean splitLogs = System.getProperty(TREX_DONT_SPLIT_LOGS) == null;
        if (splitLogs) {
            return new LoggingContext(fileName);
        } else {
            return bypass();
        }
    }

    public static LoggingContext bypass() {
        return new LoggingContext(null);
    }

}
