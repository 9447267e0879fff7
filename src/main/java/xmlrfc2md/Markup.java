package xmlrfc2md;

import java.util.Locale;
import java.util.Map;

/**
 * Text helpers shared by the renderers: whitespace folding, inline joining, escaping, attribute lists and
 * optional paragraph re-wrapping.
 */
public final class Markup
{
    private Markup()
    {
    }

    // ---------------- Whitespace ----------------

    /**
     * Replaces the leading whitespace of every line by a single space (lines without leading whitespace are
     * kept as they are). In span mode the lines are joined with one space instead of a line break.
     */
    public static String collapseIndent(String text, boolean span)
    {
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++)
        {
            String ln = lines[i];
            int start = 0;
            while (start < ln.length() && Character.isWhitespace(ln.charAt(start))) start++;
            String rest = ln.substring(start);

            if (i == 0)
            {
                sb.append(start > 0 ? " " + rest : rest);
            }
            else if (span)
            {
                sb.append(' ').append(rest);
            }
            else
            {
                sb.append('\n').append(start > 0 ? " " + rest : rest);
            }
        }
        return sb.toString();
    }

    /**
     * Joins two inline fragments, inserting a space unless the boundary already rules one out: the left side
     * ends with an opening bracket, a quote, a period or whitespace, or the right side starts with whitespace.
     */
    public static String concatWithGap(String left, String right)
    {
        if (left.isEmpty() || right.isEmpty()) return left + right;

        char last = left.charAt(left.length() - 1);
        char first = right.charAt(0);
        if (last == '(' || last == '[' || last == '.' || last == '"' || Character.isWhitespace(last) ||
            Character.isWhitespace(first))
        {
            return left + right;
        }
        return left + " " + right;
    }

    // ---------------- Escaping ----------------

    public static String escapeInline(String t)
    {
        return t.replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("[", "\\[")
                .replace("]", "\\]")
                .replace("\t", " ");
    }

    public static String escapeTitle(String t)
    {
        return t.replace("\t", " ");
    }

    public static String escapeSourcecode(String t)
    {
        return t.replace("\t", " ");
    }

    // ---------------- Attribute lists ----------------

    /**
     * Renders a kramdown inline attribute list such as <code>{: #fig-1 title='Layout'}</code>. The key
     * {@code id} becomes an anchor; an empty map gives an empty string.
     */
    public static String attributeList(Map<String, String> pairs)
    {
        if (pairs.isEmpty()) return "";

        StringBuilder sb = new StringBuilder("{:");
        for (Map.Entry<String, String> e : pairs.entrySet())
        {
            if ("id".equals(e.getKey()))
            {
                sb.append(" #").append(e.getValue());
            }
            else
            {
                sb.append(' ').append(e.getKey()).append("='").append(e.getValue()).append('\'');
            }
        }
        return sb.append('}').toString();
    }

    /** Prefixes every non-empty line. */
    public static String indent(String text, String prefix)
    {
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++)
        {
            if (i > 0) sb.append('\n');
            if (!lines[i].isEmpty()) sb.append(prefix);
            sb.append(lines[i]);
        }
        return sb.toString();
    }

    /**
     * Heading slug in the form produced by xml2rfc for {@code slugifiedName}: {@code "Authors' Addresses"}
     * becomes {@code "name-authors-addresses"}.
     */
    public static String slug(String title)
    {
        String s = title.toLowerCase(Locale.ROOT)
                        .replaceAll("[^\\p{L}\\p{N}\\s-]", "")
                        .trim()
                        .replaceAll("[\\s-]+", "-");
        return "name-" + s;
    }

    // ---------------- Re-wrapping ----------------

    /**
     * Greedily re-wraps every line longer than {@code width}. Lines are never merged, words are never broken
     * (hyphens included), continuation lines keep the indentation of the line they came from. Headings,
     * table rows, attribute lists, quotes and everything inside fenced code blocks are left alone.
     * Wrapping already wrapped text at the same width returns it unchanged.
     */
    public static String wrapParagraphs(String text, int width)
    {
        if (width <= 0) throw new IllegalArgumentException("Wrap width must be positive: " + width);

        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length());
        boolean inFence = false;
        for (int i = 0; i < lines.length; i++)
        {
            if (i > 0) sb.append('\n');
            String ln = lines[i];
            String body = ln.substring(indentLength(ln));

            if (isFence(body))
            {
                inFence = !inFence;
                sb.append(ln);
            }
            else if (inFence || isMarkupLine(body) || ln.length() <= width)
            {
                sb.append(ln);
            }
            else
            {
                sb.append(wrapLine(ln, width));
            }
        }
        return sb.toString();
    }

    private static String wrapLine(String ln, int width)
    {
        String indent = ln.substring(0, indentLength(ln));
        String body = ln.substring(indent.length()).replaceAll(" +$", "");
        if (body.isEmpty()) return ln;

        String[] words = body.split(" +");
        StringBuilder out = new StringBuilder();
        StringBuilder current = new StringBuilder(indent).append(words[0]);
        for (int w = 1; w < words.length; w++)
        {
            String word = words[w];
            String lead = word.substring(indentLength(word));
            // a continuation line must never start with something that reads as markup
            if (current.length() + 1 + word.length() <= width || isMarkupLine(lead) || isFence(lead))
            {
                current.append(' ').append(word);
            }
            else
            {
                out.append(current).append('\n');
                current = new StringBuilder(indent).append(word);
            }
        }
        return out.append(current).toString();
    }

    private static int indentLength(String ln)
    {
        int i = 0;
        while (i < ln.length() && (ln.charAt(i) == ' ' || ln.charAt(i) == '\t')) i++;
        return i;
    }

    private static boolean isFence(String body)
    {
        return body.startsWith("~~~") || body.startsWith("```");
    }

    private static boolean isMarkupLine(String body)
    {
        return body.startsWith("#") || body.startsWith("|") || body.startsWith("{:") || body.startsWith(">");
    }
}
