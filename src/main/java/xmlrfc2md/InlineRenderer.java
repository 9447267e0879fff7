package xmlrfc2md;

import org.w3c.dom.Element;

/**
 * Renders single inline elements (cross-references, keywords, code, emphasis, links) to kramdown-rfc text.
 * The caller decides how the result is joined to the text before it.
 */
final class InlineRenderer
{
    static final String BAD_XREF = "badxref";

    private final Log log;

    InlineRenderer(Log log)
    {
        this.log = log;
    }

    // ---------------- Cross-references ----------------

    String xref(Element e)
    {
        String target = Dom.attr(e, "target");
        String section = Dom.attr(e, "section");
        String sectionFormat = Dom.attr(e, "sectionFormat");
        String format = Dom.attr(e, "format");
        String text = inlineText(e);

        if (target == null)
        {
            log.error("missing target in xref");
            return BAD_XREF;
        }
        if (!text.isEmpty())
        {
            if (format != null && !"default".equals(format))
            {
                log.warn("Cannot render specially formatted xref with text content (target " + target + ")");
            }
            return "[" + Markup.escapeInline(text) + "](#" + target + ")";
        }
        if (section == null)
        {
            if ("counter".equals(format))
            {
                return "{{<" + target + "}}";
            }
            return "{{" + target + "}}";
        }

        String fmt = sectionFormat == null ? "of" : sectionFormat;
        switch (fmt)
        {
            case "of":
                return "Section " + section + " of {{" + target + "}}";
            case "comma":
                return "{{" + target + "}}, Section " + section;
            case "parens":
                return "{{" + target + "}} (" + section + ")";
            case "bare":
                return section;
            default:
                throw new ConversionException("Unsupported xref section format: " + fmt);
        }
    }

    // ---------------- External references ----------------

    String eref(Element e)
    {
        String target = Dom.attr(e, "target");
        if (target == null)
        {
            log.error("missing target in eref");
            return "";
        }

        String text = inlineText(e);
        if (!text.isEmpty())
        {
            return "[" + Markup.escapeInline(text) + "](" + target + ")";
        }

        String brackets = Dom.attr(e, "brackets");
        if (brackets == null || "none".equals(brackets))
        {
            return target;
        }
        if (target.startsWith("http"))
        {
            // kramdown autolink, must stay unescaped
            return "<" + target + ">";
        }
        return "&lt;" + target + "&gt;";
    }

    // ---------------- Text formatting ----------------

    /** BCP 14 keywords (MUST, SHOULD NOT, ...) are recognized by kramdown-rfc from plain text. */
    String keyword(Element e)
    {
        return inlineText(e);
    }

    String typewriter(Element e)
    {
        return "`" + inlineText(e) + "`";
    }

    String emphasis(Element e)
    {
        return "*" + inlineText(e) + "*";
    }

    String strong(Element e)
    {
        return "**" + inlineText(e) + "**";
    }

    String superscript(Element e)
    {
        return "<sup>" + inlineText(e) + "</sup>";
    }

    String subscript(Element e)
    {
        return "<sub>" + inlineText(e) + "</sub>";
    }

    /** A contact mentioned in running text; the Contributors section itself goes to the front matter. */
    String contact(Element e)
    {
        String fullname = Dom.attr(e, "fullname");
        if (fullname == null)
        {
            log.warn("inline contact without fullname");
            return "";
        }
        return " " + fullname;
    }

    private static String inlineText(Element e)
    {
        String s = Dom.textContent(e);
        if (s == null || s.trim().isEmpty()) return "";
        return Markup.collapseIndent(s.trim(), true);
    }
}
