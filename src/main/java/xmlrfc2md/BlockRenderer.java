package xmlrfc2md;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.w3c.dom.Element;

/**
 * Renders block content: list items, definition lists, tables, figures, source blocks and quotes.
 * Nested content is handed back to the {@link ContentExtractor}.
 */
final class BlockRenderer
{
    /** One level of list nesting. */
    static final String INDENT_UNIT = "    ";

    private static final Set<ElementKind> BLOCK_KINDS = EnumSet.of(
            ElementKind.PARAGRAPH, ElementKind.UNORDERED_LIST, ElementKind.ORDERED_LIST, ElementKind.DEFINITION_LIST,
            ElementKind.SOURCECODE, ElementKind.FIGURE, ElementKind.TABLE, ElementKind.BLOCKQUOTE, ElementKind.ASIDE
    );

    private static final Set<ElementKind> LIST_KINDS = EnumSet.of(
            ElementKind.UNORDERED_LIST, ElementKind.ORDERED_LIST, ElementKind.DEFINITION_LIST
    );

    private final ContentExtractor extractor;
    private final Log log;

    BlockRenderer(ContentExtractor extractor, Log log)
    {
        this.extractor = extractor;
        this.log = log;
    }

    // ---------------- Lists ----------------

    String listItem(Element li, RenderContext ctx)
    {
        if (ctx.span())
        {
            // table cells hold one line, items follow each other on it
            return renderItem(li, ctx.listItem()) + " ";
        }

        String out = "";
        String anchor = Dom.attr(li, "anchor");
        if (anchor != null)
        {
            out += Markup.attributeList(Map.of("id", anchor)) + "\n";
        }
        out += renderItem(li, ctx.listItem());
        out += "\n";
        return out;
    }

    /**
     * A tight item is the marker followed by its content. A loose item (several paragraphs or block children)
     * gets its first block after the marker and every further block indented one level below it.
     */
    private String renderItem(Element li, RenderContext item)
    {
        String markerIndent = item.span() ? "" : INDENT_UNIT.repeat(item.listLevel() - 1);
        String marker = markerIndent + item.listType().marker();
        RenderContext content = item.paragraph();

        List<Element> kids = Dom.children(li);
        if (item.span() || !isLoose(li, kids))
        {
            return marker + extractor.extract(li, content).strip();
        }

        String continuation = INDENT_UNIT.repeat(item.listLevel());
        StringBuilder out = new StringBuilder();
        boolean first = true;
        for (Element kid : kids)
        {
            ElementKind kind = ElementKind.forTag(kid.getTagName());
            if (first)
            {
                String body = kind == ElementKind.PARAGRAPH
                        ? extractor.extract(kid, content)
                        : extractor.render(kid, content);
                out.append(marker).append(body.strip());
                first = false;
            }
            else if (LIST_KINDS.contains(kind))
            {
                // nested items indent themselves
                out.append('\n').append(trimBlankLines(extractor.render(kid, content)));
            }
            else
            {
                String body = extractor.render(kid, content).strip();
                if (body.isEmpty()) continue;
                out.append('\n').append(Markup.indent(body, continuation));
            }
            out.append('\n');
        }
        return out.toString();
    }

    /** True for an item or definition made of blocks, with no text of its own. */
    private static boolean isLoose(Element item, List<Element> kids)
    {
        String text = Dom.text(item);
        if (text != null && !text.isBlank()) return false;
        if (kids.size() < 2) return false;
        return BLOCK_KINDS.contains(ElementKind.forTag(kids.get(0).getTagName()));
    }

    String definitionList(Element dl, RenderContext ctx)
    {
        String out = "";
        String indent = Dom.attr(dl, "indent");
        if (indent != null && !ctx.span())
        {
            out += "\n" + Markup.attributeList(Map.of("indent", indent));
        }
        return out + extractor.extract(dl, ctx.withListType(ListType.DEFINITION));
    }

    String term(Element dt, RenderContext ctx)
    {
        if (ctx.span())
        {
            return " " + extractor.extract(dt, ctx.paragraph()).strip();
        }

        String out = "\n";
        String anchor = Dom.attr(dt, "anchor");
        if (anchor != null)
        {
            out += Markup.attributeList(Map.of("id", anchor)) + "\n";
        }
        return out + extractor.extract(dt, ctx.paragraph()).strip();
    }

    /**
     * A definition with several blocks keeps a blank line between them, so they stay separate paragraphs
     * under the same term.
     */
    String definition(Element dd, RenderContext ctx)
    {
        RenderContext content = ctx.paragraph();
        List<Element> kids = Dom.children(dd);
        if (ctx.span() || !isLoose(dd, kids))
        {
            return ": " + hangingIndent(extractor.extract(dd, content).strip());
        }

        StringBuilder out = new StringBuilder(": ");
        boolean first = true;
        for (Element kid : kids)
        {
            String block = extractor.render(kid, content).strip();
            if (block.isEmpty()) continue;
            if (first)
            {
                out.append(hangingIndent(block));
                first = false;
            }
            else
            {
                out.append("\n\n").append(Markup.indent(block, INDENT_UNIT));
            }
        }
        return out.toString();
    }

    /** Keeps the first line after the marker and indents the rest below it. */
    private static String hangingIndent(String body)
    {
        int nl = body.indexOf('\n');
        if (nl < 0)
        {
            return body;
        }
        return body.substring(0, nl + 1) + Markup.indent(body.substring(nl + 1), INDENT_UNIT);
    }

    // ---------------- Quotes ----------------

    /** {@code kind} is "quote" or "aside". */
    String quote(Element e, RenderContext ctx, String kind)
    {
        String body = extractor.extract(e, ctx.paragraph()).strip();
        if (ctx.span())
        {
            return body;
        }
        StringBuilder out = new StringBuilder("{:").append(kind).append("}\n");
        for (String line : body.split("\n", -1))
        {
            out.append(line.isBlank() ? ">" : "> " + line).append('\n');
        }
        return out.toString();
    }

    // ---------------- Tables ----------------

    String table(Element table, RenderContext ctx)
    {
        StringBuilder content = new StringBuilder("\n");
        RenderContext cell = ctx.spanned();

        Element thead = Dom.firstChild(table, "thead");
        if (thead != null)
        {
            Element tr = Dom.firstChild(thead, "tr");
            if (tr == null)
            {
                log.error("no tr in table head");
                return "";
            }
            List<Element> ths = Dom.children(tr, "th");
            for (Element th : ths)
            {
                content.append('|').append(extractor.extract(th, cell).strip());
            }
            content.append('\n');
            for (Element th : ths)
            {
                content.append('|').append(alignment(Dom.attr(th, "align"))).append(' ');
            }
            content.append('\n');
        }

        List<Element> bodies = Dom.children(table, "tbody");
        if (bodies.isEmpty())
        {
            log.error("no body for table" + describe(table));
            return "";
        }
        List<Element> rows = new ArrayList<>();
        for (Element tbody : bodies)
        {
            rows.addAll(Dom.children(tbody, "tr"));
        }
        if (rows.isEmpty())
        {
            log.error("no rows in table body" + describe(table));
            return "";
        }
        rows.addAll(Dom.findAll(table, "tfoot/tr"));

        for (Element tr : rows)
        {
            for (Element td : Dom.children(tr))
            {
                String tag = td.getTagName();
                if (!"td".equals(tag) && !"th".equals(tag)) continue;
                content.append('|').append(extractor.extract(td, cell).strip());
            }
            content.append('\n');
        }

        String ial = captionAttributes(table);
        if (!ial.isEmpty())
        {
            content.append(ial).append('\n');
        }
        return content.toString();
    }

    static String alignment(String align)
    {
        if (align == null) return "-";
        switch (align)
        {
            case "left":
                return ":-";
            case "center":
                return ":-:";
            default:
                return "-:";
        }
    }

    // ---------------- Figures / source code ----------------

    String sourcecode(Element e)
    {
        String lang = Dom.attr(e, "type");
        String text = Dom.textContent(e);
        String t = Markup.escapeSourcecode(text == null ? "" : text);

        Map<String, String> attrs = new LinkedHashMap<>();
        if ("true".equals(Dom.attr(e, "markers")))
        {
            attrs.put("sourcecode-markers", "true");
        }
        String name = Dom.attr(e, "name");
        if (name != null)
        {
            attrs.put("sourcecode-name", name);
        }
        String ial = attrs.isEmpty() ? "" : "\n" + Markup.attributeList(attrs);

        if (lang == null)
        {
            return "\n~~~\n" + t + "\n~~~" + ial;
        }
        log.throttle("sourcecode-language", "language tag for source code may be incorrect");
        return "\n~~~ " + lang + "\n" + t + "\n~~~" + ial;
    }

    String figure(Element fig)
    {
        String anchor = Dom.attr(fig, "anchor");
        String label = anchor == null ? "[no anchor]" : anchor;

        Element content;
        Element artset = Dom.firstChild(fig, "artset");
        if (artset != null)
        {
            log.warn("artset found for figure " + label + ", kramdown does not support raw SVG yet, extracting ASCII art");
            content = null;
            for (Element art : Dom.children(artset, "artwork"))
            {
                if ("ascii-art".equals(Dom.attr(art, "type")))
                {
                    content = art;
                    break;
                }
            }
            if (content == null)
            {
                log.error("no ASCII art for " + label);
                return "";
            }
        }
        else
        {
            content = Dom.firstChild(fig, "artwork");
            if (content == null) content = Dom.firstChild(fig, "sourcecode");
            if (content == null)
            {
                log.warn("figure " + label + " has no content?");
                return "";
            }
        }

        String ial = captionAttributes(fig);
        if (ial.isEmpty())
        {
            return sourcecode(content);
        }
        return sourcecode(content) + "\n" + ial + "\n";
    }

    // ---------------- Helpers ----------------

    /** Attribute list carrying the anchor and caption of a table or figure, or "" when it has neither. */
    private static String captionAttributes(Element e)
    {
        Map<String, String> attrs = new LinkedHashMap<>();
        String anchor = Dom.attr(e, "anchor");
        if (anchor != null) attrs.put("id", anchor);
        Element name = Dom.firstChild(e, "name");
        if (name != null)
        {
            attrs.put("title", Markup.escapeTitle(Dom.normalizedText(name)));
        }
        return Markup.attributeList(attrs);
    }

    private static String describe(Element e)
    {
        String anchor = Dom.attr(e, "anchor");
        return anchor == null ? "" : " " + anchor;
    }

    /** Drops leading blank lines and trailing whitespace, keeping the indentation of the first real line. */
    private static String trimBlankLines(String s)
    {
        String out = s.stripTrailing();
        while (true)
        {
            int nl = out.indexOf('\n');
            if (nl < 0 || !out.substring(0, nl).isBlank()) return out;
            out = out.substring(nl + 1);
        }
    }
}
