package xmlrfc2md;

import java.util.Objects;

/**
 * Ambient state for one recursive extraction call. Immutable: every subtree gets its own copy.
 *
 * <ul>
 *   <li>{@code sectionLevel} heading depth of the enclosing section (0 outside any section)</li>
 *   <li>{@code listLevel} list nesting depth, used for indentation</li>
 *   <li>{@code listType} type of the list whose items are being walked</li>
 *   <li>{@code span} collapse line breaks into spaces (table cells, headings)</li>
 * </ul>
 */
public final class RenderContext
{
    private static final RenderContext ROOT = new RenderContext(0, 0, ListType.NONE, false);

    private final int sectionLevel;
    private final int listLevel;
    private final ListType listType;
    private final boolean span;

    private RenderContext(int sectionLevel, int listLevel, ListType listType, boolean span)
    {
        if (sectionLevel < 0 || listLevel < 0)
        {
            throw new IllegalArgumentException("Negative nesting level: section=" + sectionLevel + " list=" + listLevel);
        }
        this.sectionLevel = sectionLevel;
        this.listLevel = listLevel;
        this.listType = Objects.requireNonNull(listType, "listType");
        this.span = span;
    }

    public static RenderContext root()
    {
        return ROOT;
    }

    public static RenderContext of(int sectionLevel, int listLevel, ListType listType, boolean span)
    {
        return new RenderContext(sectionLevel, listLevel, listType, span);
    }

    public int sectionLevel() { return sectionLevel; }

    public int listLevel() { return listLevel; }

    public ListType listType() { return listType; }

    public boolean span() { return span; }

    /** Body of a subsection: one level deeper, list state reset. */
    public RenderContext section()
    {
        return new RenderContext(sectionLevel + 1, 0, ListType.NONE, false);
    }

    /** Paragraph-like content: same levels, not inside a list container any more. */
    public RenderContext paragraph()
    {
        return new RenderContext(sectionLevel, listLevel, ListType.NONE, span);
    }

    public RenderContext withListType(ListType type)
    {
        return new RenderContext(sectionLevel, listLevel, type, span);
    }

    /** Content of a list item, one nesting level deeper. */
    public RenderContext listItem()
    {
        return new RenderContext(sectionLevel, listLevel + 1, listType, span);
    }

    /** Single-line rendering, as needed inside table cells and headings. */
    public RenderContext spanned()
    {
        return new RenderContext(sectionLevel, 0, ListType.NONE, true);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof RenderContext)) return false;
        RenderContext that = (RenderContext) o;
        return sectionLevel == that.sectionLevel && listLevel == that.listLevel && listType == that.listType && span == that.span;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(sectionLevel, listLevel, listType, span);
    }

    @Override
    public String toString()
    {
        return "RenderContext{section=" + sectionLevel + ", list=" + listLevel + ", type=" + listType + ", span=" + span + "}";
    }
}
