package xmlrfc2md;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.w3c.dom.Element;

/**
 * Walks a subtree of mixed text and elements in document order and renders it as kramdown-rfc markup.
 *
 * Leading text and the tail of every child are whitespace-folded and escaped; each child is dispatched on its
 * {@link ElementKind}. The {@link RenderContext} is passed down explicitly and never shared between siblings.
 */
public final class ContentExtractor
{
    /** Sections kramdown-rfc generates from the front matter on its own. */
    static final Set<String> GENERATED_SECTION_SLUGS = Set.of(
            "name-authors-addresses", "name-authors-address", "name-contributors"
    );

    /** Kinds whose output has to start on a line of its own. */
    private static final Set<ElementKind> LINE_START = EnumSet.of(
            ElementKind.UNORDERED_LIST, ElementKind.ORDERED_LIST, ElementKind.DEFINITION_LIST,
            ElementKind.DEFINITION_DESCRIPTION
    );

    /** Definition terms bring their own space in span mode. */
    private static final Set<ElementKind> SPAN_SEPARATED = EnumSet.of(
            ElementKind.UNORDERED_LIST, ElementKind.ORDERED_LIST
    );

    private final Log log;
    private final AnchorRegistry anchors;
    private final InlineRenderer inline;
    private final BlockRenderer blocks;

    public ContentExtractor(Log log, AnchorRegistry anchors)
    {
        this.log = log;
        this.anchors = anchors;
        this.inline = new InlineRenderer(log);
        this.blocks = new BlockRenderer(this, log);
    }

    public String extract(Element root, RenderContext ctx)
    {
        String output = "";
        String text = Dom.text(root);
        if (text != null)
        {
            output += Markup.collapseIndent(Markup.escapeInline(text), ctx.span());
        }

        for (Element child : Dom.children(root))
        {
            ElementKind kind = ElementKind.forTag(child.getTagName());
            if (LINE_START.contains(kind))
            {
                output = separate(output, kind, ctx);
            }

            String fragment = render(child, kind, ctx);
            output = kind.join() == ElementKind.Join.GAP ? Markup.concatWithGap(output, fragment) : output + fragment;

            String tail = Dom.tail(child);
            if (tail != null)
            {
                output += Markup.collapseIndent(Markup.escapeInline(tail), ctx.span());
            }
        }
        return output;
    }

    /** Renders one element on its own, without its tail. */
    String render(Element e, RenderContext ctx)
    {
        return render(e, ElementKind.forTag(e.getTagName()), ctx);
    }

    private String render(Element e, ElementKind kind, RenderContext ctx)
    {
        return switch (kind)
        {
            case PARAGRAPH -> paragraph(e, ctx);
            case SECTION -> section(e, ctx);
            case BLOCKQUOTE -> blocks.quote(e, ctx, "quote");
            case ASIDE -> blocks.quote(e, ctx, "aside");
            case UNORDERED_LIST -> extract(e, ctx.withListType(ListType.UNORDERED));
            case ORDERED_LIST -> extract(e, ctx.withListType(ListType.ORDERED));
            case DEFINITION_LIST -> blocks.definitionList(e, ctx);
            case LIST_ITEM -> blocks.listItem(e, ctx);
            case DEFINITION_TERM -> blocks.term(e, ctx);
            case DEFINITION_DESCRIPTION -> blocks.definition(e, ctx);
            case SOURCECODE -> blocks.sourcecode(e);
            case FIGURE -> blocks.figure(e);
            case TABLE -> blocks.table(e, ctx);
            case XREF -> inline.xref(e);
            case EREF -> inline.eref(e);
            case BCP14 -> inline.keyword(e);
            case TT -> inline.typewriter(e);
            case EMPHASIS -> inline.emphasis(e);
            case STRONG -> inline.strong(e);
            case SUPERSCRIPT -> inline.superscript(e);
            case SUBSCRIPT -> inline.subscript(e);
            case CONTACT -> inline.contact(e);
            case BREAK -> ctx.span() ? " " : "\n";
            case IGNORED -> "";
            case UNKNOWN -> unknown(e);
        };
    }

    // ---------------- Paragraphs and sections ----------------

    private String paragraph(Element t, RenderContext ctx)
    {
        String out = "";
        String anchor = Dom.attr(t, "anchor");
        // section-N.M-P anchors are generated by xml2rfc and reappear on their own
        if (anchor != null && !anchor.startsWith("section-") && !ctx.span())
        {
            out += Markup.attributeList(Map.of("id", anchor)) + "\n";
        }
        out += extract(t, ctx.paragraph());
        out += ctx.span() ? " " : "\n";
        return out;
    }

    private String section(Element section, RenderContext ctx)
    {
        String slug = sectionSlug(section);
        if (slug != null && GENERATED_SECTION_SLUGS.contains(slug))
        {
            log.debug("Skipping section '" + slug + "', generated from the front matter");
            return "";
        }

        Map<String, String> attrs = new LinkedHashMap<>();
        String numbered = Dom.attr(section, "numbered");
        if (numbered != null) attrs.put("numbered", numbered);

        String out = heading(section, ctx.sectionLevel() + 1, ctx);
        if (!attrs.isEmpty())
        {
            out += Markup.attributeList(attrs) + "\n";
        }
        out += extract(section, ctx.section());
        out += "\n";
        return out;
    }

    private String heading(Element section, int level, RenderContext ctx)
    {
        String anchorName = Dom.attr(section, "anchor");
        String anchor = "";
        if (anchorName != null)
        {
            anchors.add(anchorName);
            anchor = " {#" + anchorName + "}";
        }

        Element name = Dom.firstChild(section, "name");
        if (name == null)
        {
            log.error("section with no name" + (anchorName != null ? " (" + anchorName + ")" : ""));
            return "";
        }
        String title = extract(name, ctx.spanned()).trim();
        return "\n" + "#".repeat(level) + " " + title + anchor + "\n";
    }

    /** Slug of a section's title: the prepped {@code slugifiedName}, or one derived from the title text. */
    static String sectionSlug(Element section)
    {
        Element name = Dom.firstChild(section, "name");
        if (name == null) return null;
        String slug = Dom.attr(name, "slugifiedName");
        if (slug != null) return slug;
        return Markup.slug(Dom.normalizedText(name));
    }

    private String unknown(Element e)
    {
        log.error("skipping unknown element: " + e.getTagName());
        return "";
    }

    /**
     * Puts a list on a line of its own. In span mode there are no line breaks, so list items only get a space
     * between them and the text before.
     */
    private static String separate(String output, ElementKind kind, RenderContext ctx)
    {
        if (!ctx.span())
        {
            return atLineStart(output) ? output : output + "\n";
        }
        if (!SPAN_SEPARATED.contains(kind) || output.isEmpty() ||
            Character.isWhitespace(output.charAt(output.length() - 1)))
        {
            return output;
        }
        return output + " ";
    }

    private static boolean atLineStart(String output)
    {
        int nl = output.lastIndexOf('\n');
        return output.substring(nl + 1).isBlank();
    }
}
