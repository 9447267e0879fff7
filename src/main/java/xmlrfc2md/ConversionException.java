package xmlrfc2md;

/**
 * A fatal input problem. The run stops and nothing is written.
 */
public class ConversionException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public ConversionException(String message)
    {
        super(message);
    }

    public ConversionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
