package xmlrfc2md;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;

import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Serializes a {@link Preamble} as kramdown-rfc YAML: the metadata mapping, a blank gap, then the
 * {@code normative:} and {@code informative:} mappings when present. The leading {@code ---} is left to the
 * caller. String values that a YAML reader would resolve to another type (numbers, booleans, null, timestamps)
 * are quoted, so a year-only date stays the string {@code "2020"}.
 */
public final class FrontMatterWriter
{
    private final ObjectMapper yaml;

    public FrontMatterWriter()
    {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .stringQuotingChecker(new PlainScalarChecker())
                .build();
        this.yaml = new ObjectMapper(factory);
    }

    public String write(Preamble preamble)
    {
        StringBuilder out = new StringBuilder();
        out.append(dump(preamble.metadata()));
        out.append("\n\n");
        if (preamble.normative() != null)
        {
            out.append(dump(Map.of("normative", references(preamble.normative()))));
        }
        if (preamble.informative() != null)
        {
            out.append(dump(Map.of("informative", references(preamble.informative()))));
        }
        return out.toString();
    }

    private static Map<String, Object> references(Map<String, BibEntry> refs)
    {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, BibEntry> e : refs.entrySet())
        {
            out.put(e.getKey(), yamlValue(e.getValue()));
        }
        return out;
    }

    /** Well-known entries are a bare key, resolved by kramdown-rfc from the anchor. */
    static Object yamlValue(BibEntry entry)
    {
        return switch (entry.kind())
        {
            case WELL_KNOWN -> null;
            case SHORT_FORM -> ((BibEntry.ShortForm) entry).value();
            case FULL_RECORD -> ((BibEntry.FullRecord) entry).toYaml();
        };
    }

    private String dump(Object value)
    {
        try
        {
            return yaml.writeValueAsString(value);
        }
        catch (JsonProcessingException e)
        {
            throw new ConversionException("Cannot serialize front matter: " + e.getOriginalMessage(), e);
        }
    }

    // ---------------- Quoting ----------------

    /**
     * Quotes every value that the YAML 1.1 core schema would not read back as a string, on top of the
     * reserved words and special characters Jackson already handles.
     */
    static final class PlainScalarChecker extends StringQuotingChecker.Default
    {
        private static final long serialVersionUID = 1L;

        private static final Resolver RESOLVER = new Resolver();

        @Override
        public boolean needToQuoteValue(String value)
        {
            return super.needToQuoteValue(value) || !Tag.STR.equals(RESOLVER.resolve(NodeId.scalar, value, true));
        }
    }
}
