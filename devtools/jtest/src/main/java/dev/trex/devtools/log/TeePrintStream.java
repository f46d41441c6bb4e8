package dev.trex.devtools.log;

import java.io.OutputStream;
import java.io.PrintStream;

/**
 * Writes everything both to the runner log and to the original console stream.
 */
public class TeePrintStream extends PrintStream {
    private final PrintStream console;

    public TeePrintStream(OutputStream log, PrintStream console) {
        super(log);
        this.console = console;
    }

    PrintStream getConsole() {
        return console;
    }

    @Override
    public void write(int b) {
        super.write(b);
        console.write(b);
    }

    @Override
    public void write(byte[] b) {
        write(b, 0, b.length);
    }

    @Override
    public void write(byte[] buf, int off, int len) {
        super.write(buf, off, len);
        console.write(buf, off, len);
    }

    @Override
    public void flush() {
        super.flush();
        console.flush();
    }

}
