package xmlrfc2md;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class XmlRfc2MdTest
{
    @TempDir
    Path dir;

    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();
    private final PrintStream err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);

    private String errOutput()
    {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private Path sample() throws IOException
    {
        Path in = dir.resolve("sample.xml");
        try (InputStream src = XmlRfc2MdTest.class.getResourceAsStream("/sample-rfc.xml"))
        {
            Files.copy(src, in);
        }
        return in;
    }

    // ---------------- Argument parsing ----------------

    @Test
    void parsesAllOptions() throws Exception
    {
        XmlRfc2Md.Opts o = XmlRfc2Md.parseArgs(new String[]{"in.xml", "--fill", "--width", "72", "-v", "out.md", "--log", "run.log"});
        assertEquals(Path.of("in.xml"), o.inFile);
        assertEquals(Path.of("out.md"), o.outFile);
        assertTrue(o.fill);
        assertTrue(o.debug);
        assertEquals(72, o.width);
        assertEquals(Path.of("run.log"), o.logPath);
    }

    @Test
    void lastFillFlagWins() throws Exception
    {
        XmlRfc2Md.Opts o = XmlRfc2Md.parseArgs(new String[]{"-f", "--no-fill", "a", "b"});
        assertFalse(o.fill);
    }

    @Test
    void usageErrors()
    {
        assertThrows(XmlRfc2Md.UsageException.class, () -> XmlRfc2Md.parseArgs(new String[]{"only-one"}));
        assertThrows(XmlRfc2Md.UsageException.class, () -> XmlRfc2Md.parseArgs(new String[]{"a", "b", "c"}));
        assertThrows(XmlRfc2Md.UsageException.class, () -> XmlRfc2Md.parseArgs(new String[]{"a", "b", "--bogus"}));
        assertThrows(XmlRfc2Md.UsageException.class, () -> XmlRfc2Md.parseArgs(new String[]{"a", "b", "--width"}));
        assertThrows(XmlRfc2Md.UsageException.class, () -> XmlRfc2Md.parseArgs(new String[]{"a", "b", "--width", "0"}));
        assertThrows(XmlRfc2Md.UsageException.class, () -> XmlRfc2Md.parseArgs(new String[]{"a", "b", "--width", "wide"}));
    }

    // ---------------- Runs ----------------

    @Test
    void usageErrorExitsWithTwo()
    {
        assertEquals(XmlRfc2Md.EXIT_USAGE, XmlRfc2Md.run(new String[0], err));
        assertTrue(errOutput().contains("Usage: xmlrfc2md"));
    }

    @Test
    void successfulRunWritesMarkdown() throws IOException
    {
        Path out = dir.resolve("out.md");
        int rc = XmlRfc2Md.run(new String[]{sample().toString(), out.toString()}, err);

        assertEquals(XmlRfc2Md.EXIT_OK, rc);
        String md = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(md.startsWith("---\n"));
        assertTrue(md.contains("\n--- middle\n\n"));
        assertTrue(errOutput().contains("INFO  Done."));
    }

    @Test
    void logFileMirrorsDiagnostics() throws IOException
    {
        Path out = dir.resolve("out.md");
        Path logFile = dir.resolve("logs").resolve("run.log");
        int rc = XmlRfc2Md.run(new String[]{sample().toString(), out.toString(), "--log", logFile.toString()}, err);

        assertEquals(XmlRfc2Md.EXIT_OK, rc);
        String logged = Files.readString(logFile, StandardCharsets.UTF_8);
        assertTrue(logged.contains("WARN  language tag for source code may be incorrect"));
        assertTrue(logged.contains("INFO  Done."));
    }

    @Test
    void fatalConversionExitsWithOne() throws IOException
    {
        Path in = dir.resolve("bad.xml");
        Files.writeString(in, "<html/>", StandardCharsets.UTF_8);
        Path out = dir.resolve("out.md");

        assertEquals(XmlRfc2Md.EXIT_FAILED, XmlRfc2Md.run(new String[]{in.toString(), out.toString()}, err));
        assertTrue(errOutput().contains("ERROR Tag not found: \"rfc\""));
        assertFalse(Files.exists(out));
    }

    @Test
    void missingInputExitsWithOne()
    {
        Path in = dir.resolve("nope.xml");
        Path out = dir.resolve("out.md");

        assertEquals(XmlRfc2Md.EXIT_FAILED, XmlRfc2Md.run(new String[]{in.toString(), out.toString()}, err));
        assertTrue(errOutput().contains("Cannot read"));
    }
}
