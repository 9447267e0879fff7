package xmlrfc2md;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Front matter of one document: the ordered metadata mapping plus the normative and informative
 * bibliographies (either may be absent).
 */
public final class Preamble
{
    private final Map<String, Object> metadata;
    private final Map<String, BibEntry> normative;
    private final Map<String, BibEntry> informative;

    Preamble(Map<String, Object> metadata, Map<String, BibEntry> normative, Map<String, BibEntry> informative)
    {
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.normative = normative == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(normative));
        this.informative = informative == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(informative));
    }

    public Map<String, Object> metadata() { return metadata; }

    /** Normative references, or null when the document has none. */
    public Map<String, BibEntry> normative() { return normative; }

    /** Informative references, or null when the document has none. */
    public Map<String, BibEntry> informative() { return informative; }
}
