package xmlrfc2md;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.w3c.dom.Element;

/**
 * Builds the kramdown-rfc front matter from the {@code <rfc>} attributes, the {@code <front>} block, the
 * Contributors section and the reference blocks under {@code <back>}.
 */
public final class PreambleExtractor
{
    static final String CONTRIBUTORS_SLUG = "name-contributors";

    private static final Pattern RFC_ANCHOR = Pattern.compile("rfc[0-9]+", Pattern.CASE_INSENSITIVE);
    private static final String DOI_PREFIX = "https://doi.org/";

    private final Log log;

    public PreambleExtractor(Log log)
    {
        this.log = log;
    }

    public Preamble extract(Element rfc)
    {
        Element front = Dom.firstChild(rfc, "front");
        if (front == null)
        {
            throw new ConversionException("No front block found");
        }
        Element titleEl = Dom.firstChild(front, "title");
        if (titleEl == null)
        {
            throw new ConversionException("No title found in front block");
        }

        Map<String, Object> preamble = new LinkedHashMap<>();
        putIfPresent(preamble, "title", Dom.normalizedText(titleEl));
        putIfPresent(preamble, "abbrev", Dom.attr(titleEl, "abbrev"));
        putIfPresent(preamble, "docname", Dom.attr(rfc, "docName"));
        putIfPresent(preamble, "number", Dom.attr(rfc, "number"));
        putIfPresent(preamble, "obsoletes", Dom.attr(rfc, "obsoletes"));
        putIfPresent(preamble, "updates", Dom.attr(rfc, "updates"));
        putIfPresent(preamble, "category", Dom.attr(rfc, "category"));
        putIfPresent(preamble, "ipr", Dom.attr(rfc, "ipr"));
        putIfPresent(preamble, "submissiontype", Dom.attr(rfc, "submissionType"));
        putIfPresent(preamble, "consensus", booleanAttr(rfc, "consensus"));
        putIfPresent(preamble, "area", Dom.normalizedText(Dom.firstChild(front, "area")));
        putIfPresent(preamble, "workgroup", Dom.normalizedText(Dom.firstChild(front, "workgroup")));

        List<String> keywords = new ArrayList<>();
        for (Element kw : Dom.children(front, "keyword"))
        {
            String k = Dom.normalizedText(kw);
            if (k != null && !k.isEmpty()) keywords.add(k);
        }
        preamble.put("keyword", keywords);

        // needed for some references to resolve
        preamble.put("stand_alone", "yes");
        preamble.put("pi", processingInstructions(rfc));

        Map<String, Object> kramdownOptions = new LinkedHashMap<>();
        kramdownOptions.put("auto_id_prefix", "autogen-");
        preamble.put("kramdown_options", kramdownOptions);

        preamble.put("author", convertPersons(front, "author"));

        Element contributors = findContributors(rfc);
        if (contributors != null)
        {
            preamble.put("contributor", convertPersons(contributors, "contact"));
        }

        Map<String, BibEntry> normative = convertReferences(rfc, "normative");
        Map<String, BibEntry> informative = convertReferences(rfc, "informative");
        if (informative == null)
        {
            // older RFCs spell it this way
            informative = convertReferences(rfc, "informational");
        }

        return new Preamble(preamble, normative, informative);
    }

    // ---------------- Processing instructions ----------------

    static Map<String, String> processingInstructions(Element rfc)
    {
        Map<String, String> pi = new LinkedHashMap<>();
        pi.put("rfcedstyle", "yes");
        pi.put("strict", "yes");
        pi.put("comments", "yes");
        pi.put("inline", "yes");
        pi.put("text-list-symbols", "-o*+");
        pi.put("docmapping", "yes");

        if ("true".equals(Dom.attr(rfc, "tocInclude")))
        {
            pi.put("toc", "yes");
        }
        if (Dom.attr(rfc, "tocDepth") != null)
        {
            // no direct equivalent for the depth itself
            pi.put("tocindent", "yes");
        }
        if ("true".equals(Dom.attr(rfc, "sortRefs")))
        {
            pi.put("sortrefs", "yes");
        }
        if ("true".equals(Dom.attr(rfc, "symRefs")))
        {
            pi.put("symrefs", "yes");
        }
        return pi;
    }

    // ---------------- Authors / contributors ----------------

    static List<Map<String, String>> convertPersons(Element parent, String tag)
    {
        List<Map<String, String>> persons = new ArrayList<>();
        for (Element a : Dom.children(parent, tag))
        {
            Map<String, String> person = new LinkedHashMap<>();
            String initials = Dom.attr(a, "initials");
            String surname = Dom.attr(a, "surname");
            if (initials != null && surname != null)
            {
                person.put("ins", initials + " " + surname);
            }
            putIfPresent(person, "name", Dom.attr(a, "fullname"));
            putIfPresent(person, "role", Dom.attr(a, "role"));

            String org = Dom.normalizedText(Dom.firstChild(a, "organization"));
            if (org != null && !org.isEmpty())
            {
                person.put("organization", org);
            }
            putIfPresent(person, "uri", Dom.normalizedText(Dom.find(a, "address/uri")));
            putIfPresent(person, "email", Dom.normalizedText(Dom.find(a, "address/email")));
            putIfPresent(person, "phone", Dom.normalizedText(Dom.find(a, "address/phone")));

            Element postal = Dom.find(a, "address/postal");
            if (postal != null)
            {
                for (String field : new String[]{"street", "city", "region", "code", "country"})
                {
                    putIfPresent(person, field, Dom.normalizedText(Dom.firstChild(postal, field)));
                }
            }
            persons.add(person);
        }
        return persons;
    }

    static Element findContributors(Element rfc)
    {
        for (Element s : Dom.findAll(rfc, "back/section"))
        {
            if (CONTRIBUTORS_SLUG.equals(ContentExtractor.sectionSlug(s)))
            {
                return s;
            }
        }
        return null;
    }

    // ---------------- References ----------------

    Element findReferences(Element rfc, String refType)
    {
        List<Element> blocks = Dom.findAll(rfc, "back/references/references");
        if (blocks.isEmpty())
        {
            blocks = Dom.findAll(rfc, "back/references");
        }
        String wanted = "name-" + refType + "-references";
        for (Element block : blocks)
        {
            Element name = Dom.firstChild(block, "name");
            if (name == null)
            {
                log.error("no name for reference block");
                continue;
            }
            String slug = Dom.attr(name, "slugifiedName");
            if (slug == null) slug = Markup.slug(Dom.normalizedText(name));
            if (wanted.equals(slug))
            {
                return block;
            }
        }
        return null;
    }

    /** Entries of the given reference block in document order, or null when there is no such block. */
    Map<String, BibEntry> convertReferences(Element rfc, String refType)
    {
        Element block = findReferences(rfc, refType);
        List<Element> refList = block == null ? List.of() : Dom.children(block, "reference");
        List<Element> groups = block == null ? List.of() : Dom.children(block, "referencegroup");
        if (refList.isEmpty() && groups.isEmpty())
        {
            log.warn("no " + refType + " references?");
            return null;
        }

        Map<String, BibEntry> refs = new LinkedHashMap<>();
        for (Element ref : refList)
        {
            String anchor = Dom.attr(ref, "anchor");
            if (anchor == null)
            {
                log.warn("reference missing an anchor");
                continue;
            }
            refs.put(anchor, convertReference(ref, anchor));
        }

        for (Element group : groups)
        {
            String anchor = Dom.attr(group, "anchor");
            if (anchor == null)
            {
                log.warn("reference group missing an anchor");
                continue;
            }
            if (anchor.startsWith("BCP") || anchor.startsWith("STD"))
            {
                refs.put(anchor, BibEntry.wellKnown());
            }
            else
            {
                log.warn("unexpected reference group " + anchor + ", dropped");
            }
        }
        return refs;
    }

    BibEntry convertReference(Element ref, String anchor)
    {
        if (isWellKnown(anchor))
        {
            return BibEntry.wellKnown();
        }
        String target = Dom.attr(ref, "target");
        if (target != null && target.startsWith(DOI_PREFIX))
        {
            return BibEntry.shortForm(target.substring(DOI_PREFIX.length()));
        }
        return fullReference(ref, anchor);
    }

    static boolean isWellKnown(String anchor)
    {
        return RFC_ANCHOR.matcher(anchor).matches() || anchor.startsWith("I-D.") ||
               anchor.startsWith("BCP") || anchor.startsWith("STD");
    }

    private BibEntry.FullRecord fullReference(Element ref, String anchor)
    {
        Element front = Dom.firstChild(ref, "front");
        if (front == null)
        {
            throw new ConversionException("reference " + anchor + " has no front");
        }
        // quoteTitle cannot be turned off on the kramdown-rfc side, so the title goes in as-is
        Element titleEl = Dom.firstChild(front, "title");
        if (titleEl == null)
        {
            throw new ConversionException("reference " + anchor + " has no title");
        }

        String refcontent = null;
        Element refcontentEl = Dom.firstChild(ref, "refcontent");
        if (refcontentEl != null)
        {
            String t = Dom.normalizedText(refcontentEl);
            if (!t.isEmpty()) refcontent = t;
        }

        return new BibEntry.FullRecord(
                Dom.attr(ref, "target"),
                refcontent,
                Dom.normalizedText(titleEl),
                referenceDate(Dom.firstChild(front, "date")),
                convertPersons(front, "author"),
                seriesInfo(front, anchor));
    }

    private static String referenceDate(Element date)
    {
        if (date == null) return null;
        String month = Dom.attr(date, "month");
        String year = Dom.attr(date, "year");
        if (month != null && !month.isEmpty() && year != null)
        {
            return month + " " + year;
        }
        if (year != null) return year;
        return month == null || month.isEmpty() ? null : month;
    }

    private Map<String, String> seriesInfo(Element front, String anchor)
    {
        Map<String, String> info = new LinkedHashMap<>();
        for (Element si : Dom.children(front, "seriesInfo"))
        {
            String name = Dom.attr(si, "name");
            String value = Dom.attr(si, "value");
            if (name == null || value == null)
            {
                log.warn("bad seriesInfo in reference " + anchor + ", skipping");
                continue;
            }
            info.put(name, value);
        }
        return info;
    }

    // ---------------- Helpers ----------------

    private static Boolean booleanAttr(Element e, String name)
    {
        String v = Dom.attr(e, name);
        if (v == null) return null;
        return "true".equals(v) || "yes".equals(v);
    }

    private static <V> void putIfPresent(Map<String, V> m, String key, V value)
    {
        if (value != null) m.put(key, value);
    }
}
