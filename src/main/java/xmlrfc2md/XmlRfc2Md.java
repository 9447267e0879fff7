package xmlrfc2md;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: converts a published RFC from XML to kramdown-rfc Markdown.
 *
 * Usage:
 *   xmlrfc2md <infile> <outfile> [--fill|-f|--no-fill] [--width <n>] [--debug|-v] [--log <file>]
 */
public final class XmlRfc2Md
{
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    // ---------------- CLI / options ----------------

    static final class Opts
    {
        Path inFile;
        Path outFile;

        boolean fill = false;
        int width = Integer.getInteger("xmlrfc2md.width", ConverterOptions.DEFAULT_WIDTH);
        boolean debug = Boolean.getBoolean("xmlrfc2md.debug");

        Path logPath = null;
    }

    static final class UsageException extends Exception
    {
        private static final long serialVersionUID = 1L;

        UsageException(String message)
        {
            super(message);
        }
    }

    private XmlRfc2Md()
    {
    }

    public static void main(String[] args)
    {
        System.exit(run(args, System.err));
    }

    static int run(String[] args, PrintStream err)
    {
        Opts opts;
        try
        {
            opts = parseArgs(args);
        }
        catch (UsageException e)
        {
            err.println(e.getMessage());
            usage(err);
            return EXIT_USAGE;
        }

        try (Log log = Log.open(opts.logPath, opts.debug, err))
        {
            return convert(opts, log);
        }
        catch (IOException e)
        {
            err.println("ERROR " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static Opts parseArgs(String[] args) throws UsageException
    {
        Opts o = new Opts();
        int positional = 0;

        for (int i = 0; i < args.length; i++)
        {
            String a = args[i];
            switch (a)
            {
                case "--fill":
                case "-f":
                    o.fill = true;
                    break;

                case "--no-fill":
                    o.fill = false;
                    break;

                case "--debug":
                case "-v":
                    o.debug = true;
                    break;

                case "--width":
                    if (i + 1 >= args.length) throw new UsageException("Missing value after --width");
                    o.width = parseWidth(args[++i]);
                    break;

                case "--log":
                    if (i + 1 >= args.length) throw new UsageException("Missing value after --log");
                    o.logPath = Paths.get(args[++i]);
                    break;

                default:
                    if (a.startsWith("-") && a.length() > 1)
                    {
                        throw new UsageException("Unknown argument: " + a);
                    }
                    if (positional == 0)
                    {
                        o.inFile = Paths.get(a);
                    }
                    else if (positional == 1)
                    {
                        o.outFile = Paths.get(a);
                    }
                    else
                    {
                        throw new UsageException("Unexpected argument: " + a);
                    }
                    positional++;
            }
        }

        if (positional < 2)
        {
            throw new UsageException("Both an input and an output file are required");
        }
        return o;
    }

    private static int parseWidth(String s) throws UsageException
    {
        try
        {
            int w = Integer.parseInt(s);
            if (w > 0) return w;
        }
        catch (NumberFormatException e)
        {
            throw new UsageException("--width expects a positive integer, got: " + s);
        }
        throw new UsageException("--width expects a positive integer, got: " + s);
    }

    private static void usage(PrintStream err)
    {
        err.println("Usage: xmlrfc2md <infile> <outfile> [--fill|-f|--no-fill] [--width <n>] [--debug|-v] [--log <file>]");
        err.println("  --fill, -f            Re-wrap paragraphs in the middle and back sections (might break some markdown)");
        err.println("  --no-fill             Keep line breaks as they are (default)");
        err.println("  --width <n>           Wrap column for --fill (default: " + ConverterOptions.DEFAULT_WIDTH + ")");
        err.println("  --debug, -v           Print debug diagnostics");
        err.println("  --log <file>          Also write all diagnostics to this log file");
    }

    // ---------------- Conversion ----------------

    private static int convert(Opts opts, Log log)
    {
        log.debug("Input:  " + opts.inFile.toAbsolutePath());
        log.debug("Output: " + opts.outFile.toAbsolutePath());

        String markdown;
        try
        {
            RfcConverter converter = new RfcConverter(new ConverterOptions(opts.fill, opts.width), log);
            markdown = converter.convert(opts.inFile);
        }
        catch (ConversionException e)
        {
            log.error(e.getMessage());
            if (opts.debug) e.printStackTrace(log.err());
            return EXIT_FAILED;
        }
        catch (IOException e)
        {
            log.error("Cannot read " + opts.inFile + ": " + e.getMessage());
            return EXIT_FAILED;
        }

        try
        {
            Files.writeString(opts.outFile, markdown, StandardCharsets.UTF_8);
        }
        catch (IOException e)
        {
            log.error("Cannot write " + opts.outFile + ": " + e.getMessage());
            return EXIT_FAILED;
        }

        log.summarizeThrottled();
        log.info("Done. " + opts.inFile.getFileName() + " -> " + opts.outFile.getFileName() +
                 " warnings=" + log.warnings() + " errors=" + log.errors());
        return EXIT_OK;
    }
}
