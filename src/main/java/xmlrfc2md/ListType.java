package xmlrfc2md;

/**
 * Kind of list the current item belongs to; decides the item marker.
 */
public enum ListType
{
    NONE(""),
    UNORDERED("* "),
    ORDERED("1. "),
    DEFINITION("");

    private final String marker;

    ListType(String marker)
    {
        this.marker = marker;
    }

    public String marker()
    {
        return marker;
    }
}
