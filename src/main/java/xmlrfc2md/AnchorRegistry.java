package xmlrfc2md;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of the anchors seen on section headings during one run.
 */
public final class AnchorRegistry
{
    private final List<String> anchors = new ArrayList<>();

    void add(String anchor)
    {
        anchors.add(anchor);
    }

    public List<String> anchors()
    {
        return Collections.unmodifiableList(anchors);
    }

    public int size()
    {
        return anchors.size();
    }
}
