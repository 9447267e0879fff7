package xmlrfc2md;

/**
 * Output options for one conversion.
 */
public final class ConverterOptions
{
    public static final int DEFAULT_WIDTH = 120;

    private final boolean fill;
    private final int width;

    public ConverterOptions(boolean fill, int width)
    {
        if (width <= 0)
        {
            throw new IllegalArgumentException("Wrap width must be positive: " + width);
        }
        this.fill = fill;
        this.width = width;
    }

    public static ConverterOptions defaults()
    {
        return new ConverterOptions(false, Integer.getInteger("xmlrfc2md.width", DEFAULT_WIDTH));
    }

    /** Re-wrap the middle and back segments. */
    public boolean fill() { return fill; }

    public int width() { return width; }
}
