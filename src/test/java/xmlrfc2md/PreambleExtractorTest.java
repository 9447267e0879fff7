package xmlrfc2md;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

class PreambleExtractorTest
{
    private static final String FRONT =
            "<front>" +
            "<title abbrev=\"Example\">An Example\n   Protocol</title>" +
            "<author initials=\"J.\" surname=\"Doe\" fullname=\"Jane Doe\" role=\"editor\">" +
            "<organization>Example Corp</organization>" +
            "<address><postal><street>1 Main St</street><city>Springfield</city><country>US</country></postal>" +
            "<email>jane@example.com</email></address>" +
            "</author>" +
            "<area>Security</area><workgroup>TLS</workgroup>" +
            "<keyword>alpha</keyword><keyword>beta</keyword>" +
            "<abstract><t>A.</t></abstract>" +
            "</front>";

    private XmlFixtures.CapturingLog diagnostics;
    private PreambleExtractor extractor;

    @BeforeEach
    void setUp()
    {
        diagnostics = new XmlFixtures.CapturingLog();
        extractor = new PreambleExtractor(diagnostics.log);
    }

    private static Element rfc(String attrs, String back)
    {
        return XmlFixtures.element("<rfc " + attrs + ">" + FRONT + "<middle/>" + back + "</rfc>");
    }

    private static String references(String slug, String body)
    {
        return "<references><name slugifiedName=\"" + slug + "\">R</name>" + body + "</references>";
    }

    // ---------------- Metadata ----------------

    @Test
    void metadataKeysInOrder()
    {
        Preamble p = extractor.extract(rfc("docName=\"draft-ex-00\" number=\"9999\" category=\"std\" ipr=\"trust200902\" " +
                                           "submissionType=\"IETF\" consensus=\"true\"", ""));
        Map<String, Object> m = p.metadata();

        assertEquals(List.of("title", "abbrev", "docname", "number", "category", "ipr", "submissiontype", "consensus",
                             "area", "workgroup", "keyword", "stand_alone", "pi", "kramdown_options", "author"),
                     List.copyOf(m.keySet()));
        assertEquals("An Example Protocol", m.get("title"));
        assertEquals(Boolean.TRUE, m.get("consensus"));
        assertEquals(List.of("alpha", "beta"), m.get("keyword"));
        assertEquals("yes", m.get("stand_alone"));
        assertEquals(Map.of("auto_id_prefix", "autogen-"), m.get("kramdown_options"));
    }

    @Test
    void absentAttributesAreOmitted()
    {
        Map<String, Object> m = extractor.extract(rfc("", "")).metadata();
        assertFalse(m.containsKey("docname"));
        assertFalse(m.containsKey("obsoletes"));
        assertFalse(m.containsKey("consensus"));
        assertFalse(m.containsKey("contributor"));
    }

    @Test
    void authorFields()
    {
        @SuppressWarnings("unchecked")
        List<Map<String, String>> authors = (List<Map<String, String>>) extractor.extract(rfc("", "")).metadata().get("author");

        assertEquals(1, authors.size());
        Map<String, String> a = authors.get(0);
        assertEquals(List.of("ins", "name", "role", "organization", "email", "street", "city", "country"),
                     List.copyOf(a.keySet()));
        assertEquals("J. Doe", a.get("ins"));
        assertEquals("Springfield", a.get("city"));
    }

    @Test
    void contributorsComeFromTheBackSection()
    {
        String back = "<back><section><name slugifiedName=\"name-contributors\">Contributors</name>" +
                      "<contact fullname=\"John Roe\"><organization/></contact></section></back>";
        Map<String, Object> m = extractor.extract(rfc("", back)).metadata();
        assertEquals(List.of(Map.of("name", "John Roe")), m.get("contributor"));
    }

    @Test
    void processingInstructions()
    {
        Map<String, String> defaults = PreambleExtractor.processingInstructions(XmlFixtures.element("<rfc/>"));
        assertEquals(List.of("rfcedstyle", "strict", "comments", "inline", "text-list-symbols", "docmapping"),
                     List.copyOf(defaults.keySet()));

        Map<String, String> all = PreambleExtractor.processingInstructions(
                XmlFixtures.element("<rfc tocInclude=\"true\" tocDepth=\"3\" sortRefs=\"true\" symRefs=\"true\"/>"));
        assertEquals("yes", all.get("toc"));
        assertEquals("yes", all.get("tocindent"));
        assertEquals("yes", all.get("sortrefs"));
        assertEquals("yes", all.get("symrefs"));

        Map<String, String> off = PreambleExtractor.processingInstructions(XmlFixtures.element("<rfc tocInclude=\"false\"/>"));
        assertFalse(off.containsKey("toc"));
    }

    @Test
    void missingFrontOrTitleIsFatal()
    {
        ConversionException noFront = assertThrows(ConversionException.class,
                () -> extractor.extract(XmlFixtures.element("<rfc><middle/></rfc>")));
        assertEquals("No front block found", noFront.getMessage());

        ConversionException noTitle = assertThrows(ConversionException.class,
                () -> extractor.extract(XmlFixtures.element("<rfc><front/></rfc>")));
        assertEquals("No title found in front block", noTitle.getMessage());
    }

    // ---------------- References ----------------

    @Test
    void referenceKinds()
    {
        String body =
                "<reference anchor=\"RFC9000\"><front><title>QUIC</title></front></reference>" +
                "<reference anchor=\"I-D.ietf-foo\"><front><title>Foo</title></front></reference>" +
                "<reference anchor=\"DOI\" target=\"https://doi.org/10.1/xyz\"><front><title>D</title></front></reference>" +
                "<reference anchor=\"PAPER\" target=\"https://example.com/paper\">" +
                "<front><title>The Paper</title><author fullname=\"A. Writer\"/><date month=\"May\" year=\"2020\"/>" +
                "<seriesInfo name=\"ISO\" value=\"1234\"/></front>" +
                "<refcontent>Vol 2</refcontent></reference>";
        String back = "<back><references><name>References</name>" +
                      references("name-normative-references", body) + "</references></back>";

        Map<String, BibEntry> refs = extractor.extract(rfc("", back)).normative();

        assertEquals(List.of("RFC9000", "I-D.ietf-foo", "DOI", "PAPER"), List.copyOf(refs.keySet()));
        assertSame(BibEntry.wellKnown(), refs.get("RFC9000"));
        assertSame(BibEntry.wellKnown(), refs.get("I-D.ietf-foo"));
        assertEquals(BibEntry.Kind.SHORT_FORM, refs.get("DOI").kind());
        assertEquals("DOI.10.1/xyz", ((BibEntry.ShortForm) refs.get("DOI")).value());

        BibEntry.FullRecord paper = assertInstanceOf(BibEntry.FullRecord.class, refs.get("PAPER"));
        assertEquals("The Paper", paper.title());
        assertEquals("May 2020", paper.date());
        assertEquals("https://example.com/paper", paper.target());
        assertEquals(Map.of("ISO", "1234"), paper.seriesInfo());
        assertEquals(List.of(Map.of("name", "A. Writer")), paper.authors());

        Map<String, Object> yaml = paper.toYaml();
        assertEquals(List.of("target", "refcontent", "title", "date", "author", "seriesinfo"), List.copyOf(yaml.keySet()));
    }

    @Test
    void undatedReferenceGetsExplicitFalse()
    {
        String back = "<back>" + references("name-normative-references",
                "<reference anchor=\"X\"><front><title>X</title></front></reference>") + "</back>";

        BibEntry.FullRecord x = (BibEntry.FullRecord) extractor.extract(rfc("", back)).normative().get("X");
        assertNull(x.date());
        Map<String, Object> yaml = x.toYaml();
        assertEquals(Boolean.FALSE, yaml.get("date"));
        assertFalse(yaml.containsKey("target"));
    }

    @Test
    void yearOnlyDate()
    {
        String back = "<back>" + references("name-normative-references",
                "<reference anchor=\"X\"><front><title>X</title><date year=\"1999\"/></front></reference>") + "</back>";

        BibEntry.FullRecord x = (BibEntry.FullRecord) extractor.extract(rfc("", back)).normative().get("X");
        assertEquals("1999", x.date());
    }

    @Test
    void referenceWithoutTitleIsFatal()
    {
        String back = "<back>" + references("name-normative-references",
                "<reference anchor=\"X\"><front/></reference>") + "</back>";
        assertThrows(ConversionException.class, () -> extractor.extract(rfc("", back)));
    }

    @Test
    void referenceGroups()
    {
        String back = "<back>" + references("name-normative-references",
                "<referencegroup anchor=\"BCP14\"/><referencegroup anchor=\"FOO\"/>") + "</back>";

        Map<String, BibEntry> refs = extractor.extract(rfc("", back)).normative();
        assertEquals(List.of("BCP14"), List.copyOf(refs.keySet()));
        assertEquals(BibEntry.Kind.WELL_KNOWN, refs.get("BCP14").kind());
        assertTrue(diagnostics.output().contains("unexpected reference group FOO, dropped"));
    }

    @Test
    void informationalSpellingIsAccepted()
    {
        String back = "<back>" + references("name-informational-references",
                "<reference anchor=\"RFC1\"><front><title>One</title></front></reference>") + "</back>";

        Preamble p = extractor.extract(rfc("", back));
        assertNull(p.normative());
        assertEquals(List.of("RFC1"), List.copyOf(p.informative().keySet()));
        assertTrue(diagnostics.output().contains("no normative references?"));
    }

    @Test
    void referencesWithoutAnchorAreSkipped()
    {
        String back = "<back>" + references("name-normative-references",
                "<reference><front><title>X</title></front></reference>" +
                "<reference anchor=\"RFC2\"><front><title>Two</title></front></reference>") + "</back>";

        Map<String, BibEntry> refs = extractor.extract(rfc("", back)).normative();
        assertEquals(List.of("RFC2"), List.copyOf(refs.keySet()));
        assertTrue(diagnostics.output().contains("reference missing an anchor"));
    }

    @Test
    void wellKnownAnchors()
    {
        assertTrue(PreambleExtractor.isWellKnown("RFC2119"));
        assertTrue(PreambleExtractor.isWellKnown("rfc8174"));
        assertTrue(PreambleExtractor.isWellKnown("STD68"));
        assertFalse(PreambleExtractor.isWellKnown("RFC"));
        assertFalse(PreambleExtractor.isWellKnown("W3C.REC-xml"));
    }
}
