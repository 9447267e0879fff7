package xmlrfc2md;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One bibliography entry, keyed by its anchor in the reference map.
 *
 * <ul>
 *   <li>{@link WellKnown}: RFCs, drafts, BCPs and STDs that kramdown-rfc resolves from the anchor alone</li>
 *   <li>{@link ShortForm}: a DOI reference written as {@code DOI.<doi>}</li>
 *   <li>{@link FullRecord}: everything else, spelled out</li>
 * </ul>
 */
public abstract class BibEntry
{
    public enum Kind
    {
        WELL_KNOWN,
        SHORT_FORM,
        FULL_RECORD
    }

    private BibEntry()
    {
    }

    public abstract Kind kind();

    public static BibEntry wellKnown()
    {
        return WellKnown.INSTANCE;
    }

    public static BibEntry shortForm(String doi)
    {
        return new ShortForm("DOI." + doi);
    }

    public static final class WellKnown extends BibEntry
    {
        private static final WellKnown INSTANCE = new WellKnown();

        private WellKnown()
        {
        }

        @Override
        public Kind kind() { return Kind.WELL_KNOWN; }

        @Override
        public String toString() { return "WellKnown"; }
    }

    public static final class ShortForm extends BibEntry
    {
        private final String value;

        private ShortForm(String value)
        {
            this.value = value;
        }

        public String value() { return value; }

        @Override
        public Kind kind() { return Kind.SHORT_FORM; }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof ShortForm && ((ShortForm) o).value.equals(value);
        }

        @Override
        public int hashCode() { return value.hashCode(); }

        @Override
        public String toString() { return "ShortForm(" + value + ")"; }
    }

    public static final class FullRecord extends BibEntry
    {
        private final String target;
        private final String refcontent;
        private final String title;
        private final String date;
        private final List<Map<String, String>> authors;
        private final Map<String, String> seriesInfo;

        /**
         * @param date "month year", "year", or null when the reference carries no date
         */
        public FullRecord(String target, String refcontent, String title, String date,
                          List<Map<String, String>> authors, Map<String, String> seriesInfo)
        {
            this.target = target;
            this.refcontent = refcontent;
            this.title = Objects.requireNonNull(title, "title");
            this.date = date;
            this.authors = Collections.unmodifiableList(authors);
            this.seriesInfo = seriesInfo == null ? Collections.emptyMap() : Collections.unmodifiableMap(seriesInfo);
        }

        public String target() { return target; }

        public String title() { return title; }

        public String date() { return date; }

        public List<Map<String, String>> authors() { return authors; }

        public Map<String, String> seriesInfo() { return seriesInfo; }

        @Override
        public Kind kind() { return Kind.FULL_RECORD; }

        /** The record as an ordered mapping, in the key order kramdown-rfc documents. */
        public Map<String, Object> toYaml()
        {
            Map<String, Object> out = new LinkedHashMap<>();
            if (target != null) out.put("target", target);
            if (refcontent != null) out.put("refcontent", refcontent);
            out.put("title", title);
            // kramdown-rfc wants an explicit false for undated references
            out.put("date", date != null ? date : Boolean.FALSE);
            out.put("author", authors);
            if (!seriesInfo.isEmpty()) out.put("seriesinfo", seriesInfo);
            return out;
        }

        @Override
        public String toString() { return "FullRecord(" + title + ")"; }
    }
}
