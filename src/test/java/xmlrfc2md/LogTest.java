package xmlrfc2md;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogTest
{
    @Test
    void levelsAndCounters()
    {
        XmlFixtures.CapturingLog c = new XmlFixtures.CapturingLog();
        c.log.info("hello");
        c.log.warn("careful");
        c.log.error("broken");
        c.log.debug("details");

        assertEquals("INFO  hello\nWARN  careful\nERROR broken\nDEBUG details\n", c.output().replace("\r\n", "\n"));
        assertEquals(1, c.log.warnings());
        assertEquals(1, c.log.errors());
        assertTrue(c.log.isDebug());
    }

    @Test
    void throttledCategoryWarnsOnce()
    {
        XmlFixtures.CapturingLog c = new XmlFixtures.CapturingLog();
        for (int i = 0; i < 3; i++)
        {
            c.log.throttle("lang", "language may be wrong");
        }
        c.log.throttle("other", "something else");

        assertEquals(2, c.log.warnings());
        assertEquals(3, c.log.throttledCount("lang"));
        assertEquals(0, c.log.throttledCount("never"));

        c.log.summarizeThrottled();
        String out = c.output();
        assertTrue(out.contains("Suppressed 2 further 'lang' warning(s)"));
        assertFalse(out.contains("'other'"));
    }

    @Test
    void silentLogStillCounts()
    {
        Log log = Log.silent();
        log.warn("w");
        log.debug("d");
        assertEquals(1, log.warnings());
        assertFalse(log.isDebug());
    }
}
