package xmlrfc2md;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Read-only helpers over the DOM, giving elements the "text / tail" view of mixed content.
 *
 * An element's text is the character data before its first child element; the tail of an element is the
 * character data between it and its next element sibling. Comments and processing instructions are skipped.
 */
final class Dom
{
    private Dom()
    {
    }

    // ---------------- Attributes ----------------

    /** Attribute value, or null when the attribute is absent. */
    static String attr(Element e, String name)
    {
        return e.hasAttribute(name) ? e.getAttribute(name) : null;
    }

    // ---------------- Children ----------------

    static List<Element> children(Element parent)
    {
        List<Element> out = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling())
        {
            if (n.getNodeType() == Node.ELEMENT_NODE) out.add((Element) n);
        }
        return out;
    }

    static List<Element> children(Element parent, String tag)
    {
        List<Element> out = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling())
        {
            if (n.getNodeType() == Node.ELEMENT_NODE && tag.equals(((Element) n).getTagName()))
            {
                out.add((Element) n);
            }
        }
        return out;
    }

    static Element firstChild(Element parent, String tag)
    {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling())
        {
            if (n.getNodeType() == Node.ELEMENT_NODE && tag.equals(((Element) n).getTagName()))
            {
                return (Element) n;
            }
        }
        return null;
    }

    /** First element matching a slash-separated path of child tags, e.g. {@code "address/postal/city"}. */
    static Element find(Element parent, String path)
    {
        List<Element> all = findAll(parent, path);
        return all.isEmpty() ? null : all.get(0);
    }

    /** All elements matching a slash-separated path of child tags, in document order. */
    static List<Element> findAll(Element parent, String path)
    {
        if (parent == null) return Collections.emptyList();
        List<Element> current = Collections.singletonList(parent);
        for (String step : path.split("/"))
        {
            List<Element> next = new ArrayList<>();
            for (Element e : current)
            {
                next.addAll(children(e, step));
            }
            current = next;
        }
        return current;
    }

    // ---------------- Text ----------------

    /** Character data before the first child element, or null if there is none. */
    static String text(Element e)
    {
        return collectText(e.getFirstChild());
    }

    /** Character data after the element, up to its next element sibling, or null if there is none. */
    static String tail(Element e)
    {
        return collectText(e.getNextSibling());
    }

    /** All character data below the element, or null for a null element. */
    static String textContent(Element e)
    {
        if (e == null) return null;
        return e.getTextContent();
    }

    /** Text content with runs of whitespace folded to single spaces and trimmed; null stays null. */
    static String normalizedText(Element e)
    {
        String s = textContent(e);
        if (s == null) return null;
        return s.trim().replaceAll("\\s+", " ");
    }

    private static String collectText(Node start)
    {
        StringBuilder sb = null;
        for (Node n = start; n != null; n = n.getNextSibling())
        {
            short type = n.getNodeType();
            if (type == Node.ELEMENT_NODE) break;
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE)
            {
                if (sb == null) sb = new StringBuilder();
                sb.append(n.getNodeValue());
            }
        }
        return sb == null ? null : sb.toString();
    }
}
