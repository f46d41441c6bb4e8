package dev.trex.devtools.log;

import java.io.PrintStream;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

public class Logger {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ISO_INSTANT;

    static volatile PrintStream out = System.out;
    static volatile PrintStream err = System.err;

    private final String prefix;

    public Logger(String prefix) {
        this.prefix = prefix;
    }

    public void info(String message) {
        print(out, "INFO", message);
    }

    public void info(String message, Object... args) {
        print(out, "INFO", String.format(message, args));
    }

    // Degraded but non-fatal conditions, e.g. a discovery override that fell back to defaults
    public void warn(String message, Object... args) {
        print(err, "WARN", String.format(message, args));
    }

    public void error(String message) {
        print(err, "ERROR", message);
    }

    public void error(String message, Object... args) {
        print(err, "ERROR", String.format(message, args));
    }

    private void print(PrintStream stream, String level, String message) {
        stream.println(level + ": " + FORMATTER.format(Instant.now()) + ": " + prefix + ": " + message);
    }

    public static Logger getLogger(Class<?> type) {
        return new Logger(type.getSimpleName());
    }

}
