package xmlrfc2md;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of RFC XML element kinds the content extractor knows how to render.
 *
 * Each kind says how its rendering joins the text before it: {@link Join#GAP} runs the space-insertion
 * heuristic, {@link Join#APPEND} concatenates as-is. Tags not listed map to {@link #UNKNOWN}.
 */
public enum ElementKind
{
    // paragraph and structure
    PARAGRAPH(Join.APPEND, "t"),
    SECTION(Join.APPEND, "section"),
    BLOCKQUOTE(Join.APPEND, "blockquote"),
    ASIDE(Join.APPEND, "aside"),

    // lists
    UNORDERED_LIST(Join.APPEND, "ul"),
    ORDERED_LIST(Join.APPEND, "ol"),
    DEFINITION_LIST(Join.APPEND, "dl"),
    LIST_ITEM(Join.APPEND, "li"),
    DEFINITION_TERM(Join.APPEND, "dt"),
    DEFINITION_DESCRIPTION(Join.APPEND, "dd"),

    // figures and tables
    SOURCECODE(Join.APPEND, "sourcecode", "artwork"),
    FIGURE(Join.APPEND, "figure"),
    TABLE(Join.APPEND, "table"),

    // inline
    XREF(Join.GAP, "xref"),
    EREF(Join.GAP, "eref"),
    BCP14(Join.GAP, "bcp14"),
    TT(Join.GAP, "tt"),
    EMPHASIS(Join.GAP, "emph", "em"),
    STRONG(Join.GAP, "strong"),
    SUPERSCRIPT(Join.APPEND, "sup"),
    SUBSCRIPT(Join.APPEND, "sub"),
    CONTACT(Join.APPEND, "contact"),
    BREAK(Join.APPEND, "br"),

    // handled elsewhere (section titles, front matter, bibliography) or without textual output
    IGNORED(Join.APPEND, "name", "references", "author", "displayreference", "iref"),

    UNKNOWN(Join.APPEND);

    public enum Join
    {
        GAP,
        APPEND
    }

    private static final Map<String, ElementKind> BY_TAG = new HashMap<>();

    static
    {
        for (ElementKind k : values())
        {
            for (String tag : k.tags)
            {
                BY_TAG.put(tag, k);
            }
        }
    }

    private final Join join;
    private final String[] tags;

    ElementKind(Join join, String... tags)
    {
        this.join = join;
        this.tags = tags;
    }

    public Join join()
    {
        return join;
    }

    public static ElementKind forTag(String tag)
    {
        return BY_TAG.getOrDefault(tag, UNKNOWN);
    }
}
