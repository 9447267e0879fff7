package xmlrfc2md;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic channel for one conversion run.
 *
 * Everything goes to the error stream (the Markdown itself is written to a file), optionally mirrored
 * into a log file. Each run owns its own instance, so throttle counters never leak between documents.
 */
public final class Log implements Closeable
{
    private final PrintStream err;
    private final PrintStream file;
    private final boolean debug;

    private final Map<String, Integer> throttled = new LinkedHashMap<>();
    private int warnings = 0;
    private int errors = 0;

    public static Log open(Path logPath, boolean debug, PrintStream err) throws IOException
    {
        PrintStream f = null;
        if (logPath != null)
        {
            Path parent = logPath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            f = new PrintStream(Files.newOutputStream(logPath, StandardOpenOption.CREATE, StandardOpenOption.APPEND), true, StandardCharsets.UTF_8);
        }
        return new Log(err, f, debug);
    }

    public Log(PrintStream err, PrintStream file, boolean debug)
    {
        this.err = err;
        this.file = file;
        this.debug = debug;
    }

    /** A log that prints nothing but still counts; used when a caller doesn't care about diagnostics. */
    public static Log silent()
    {
        return new Log(new PrintStream(OutputStream.nullOutputStream()), null, false);
    }

    PrintStream err() { return err; }

    public void info(String msg)
    {
        println("INFO ", msg);
    }

    public void warn(String msg)
    {
        warnings++;
        println("WARN ", msg);
    }

    public void error(String msg)
    {
        errors++;
        println("ERROR", msg);
    }

    public void debug(String msg)
    {
        if (!debug) return;
        println("DEBUG", msg);
    }

    /**
     * Warns the first time a category is seen; later occurrences are only counted.
     */
    public void throttle(String category, String msg)
    {
        int seen = throttled.getOrDefault(category, 0);
        if (seen == 0)
        {
            warn(msg);
        }
        throttled.put(category, seen + 1);
    }

    /** Number of times a throttled category was hit, including the printed one. */
    public int throttledCount(String category)
    {
        return throttled.getOrDefault(category, 0);
    }

    public int warnings() { return warnings; }

    public int errors() { return errors; }

    public boolean isDebug() { return debug; }

    /** Reports throttled categories that swallowed further occurrences. */
    public void summarizeThrottled()
    {
        for (Map.Entry<String, Integer> e : throttled.entrySet())
        {
            int suppressed = e.getValue() - 1;
            if (suppressed > 0)
            {
                info("Suppressed " + suppressed + " further '" + e.getKey() + "' warning(s)");
            }
        }
    }

    private void println(String level, String msg)
    {
        String line = level + " " + msg;
        err.println(line);
        if (file != null) file.println(line);
    }

    @Override
    public void close()
    {
        if (file != null) file.close();
    }
}
