package io.hintlite.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * Loads {@code logging.properties} from the classpath and sends the
 * {@code io.hintlite} loggers to the invocation's error stream, so that stdout
 * only carries what the host evaluates.
 */
final class LogSetup {

    // strong reference, LogManager only keeps loggers weakly
    private static final Logger ROOT = Logger.getLogger("io.hintlite");

    private LogSetup() {
        // utility
    }

    /**
     * @return the handler writing to {@code err}; pass it to {@link #detach}
     *         once the invocation is over
     */
    static Handler configure(boolean verbose, PrintStream err) {
        try (InputStream in = LogSetup.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(LogSetup.class.getName())
                    .log(Level.WARNING, "Failed to read logging.properties, using JDK defaults", e);
        }
        Level level = verbose ? Level.FINE : Level.INFO;
        Handler handler = new StreamHandler(err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        handler.setLevel(level);
        ROOT.setLevel(level);
        ROOT.setUseParentHandlers(false);
        ROOT.addHandler(handler);
        return handler;
    }

    static void detach(Handler handler) {
        if (handler == null) return;
        ROOT.removeHandler(handler);
        handler.flush();
    }
}
