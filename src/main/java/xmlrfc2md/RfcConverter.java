package xmlrfc2md;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Converts one RFC XML (v3) document into kramdown-rfc Markdown.
 *
 * Output layout:
 * <pre>
 * ---
 * &lt;front matter YAML&gt;
 * --- abstract
 * ...
 * --- middle
 * ...
 * --- back        (only when the document has a back block)
 * ...
 * </pre>
 * The whole text is built in memory; a fatal problem throws {@link ConversionException} before anything is
 * written.
 */
public final class RfcConverter
{
    static final String ROOT_TAG = "rfc";

    private final ConverterOptions options;
    private final Log log;
    private final FrontMatterWriter frontMatter = new FrontMatterWriter();

    public RfcConverter(ConverterOptions options, Log log)
    {
        this.options = options;
        this.log = log;
    }

    // ---------------- Entry points ----------------

    public String convert(Path file) throws IOException
    {
        try (InputStream in = Files.newInputStream(file))
        {
            return convert(in);
        }
    }

    public String convert(InputStream in) throws IOException
    {
        return convert(parseXml(in));
    }

    public String convert(Document doc)
    {
        Element root = doc.getDocumentElement();
        if (root == null || !ROOT_TAG.equals(root.getTagName()))
        {
            throw new ConversionException("Tag not found: \"" + ROOT_TAG + "\"");
        }

        Preamble preamble = new PreambleExtractor(log).extract(root);

        Element abstractEl = Dom.find(root, "front/abstract");
        if (abstractEl == null)
        {
            throw new ConversionException("No abstract found");
        }
        Element middle = Dom.firstChild(root, "middle");
        if (middle == null)
        {
            throw new ConversionException("Cannot find middle part of document");
        }
        Element back = Dom.firstChild(root, "back");

        AnchorRegistry anchors = new AnchorRegistry();
        ContentExtractor extractor = new ContentExtractor(log, anchors);

        StringBuilder out = new StringBuilder();
        out.append("---\n");
        out.append(frontMatter.write(preamble));
        out.append("\n");

        out.append("--- abstract\n\n");
        out.append(extractor.extract(abstractEl, RenderContext.root()));
        out.append("\n\n");

        out.append("\n--- middle\n\n");
        out.append(fill(extractor.extract(middle, RenderContext.root())));

        if (back != null)
        {
            out.append("\n--- back\n\n");
            out.append(fill(extractor.extract(back, RenderContext.root())));
        }

        log.debug("Registered " + anchors.size() + " section anchors");
        return out.toString();
    }

    private String fill(String text)
    {
        return options.fill() ? Markup.wrapParagraphs(text, options.width()) : text;
    }

    // ---------------- XML parse ----------------

    Document parseXml(InputStream in) throws IOException
    {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(false);
        f.setValidating(false);
        f.setIgnoringComments(true);
        f.setExpandEntityReferences(true);
        f.setXIncludeAware(false);
        // Never fetch external DTDs or entities; internal entity declarations still expand.
        setFeature(f, "http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        setFeature(f, "http://xml.org/sax/features/external-general-entities", false);
        setFeature(f, "http://xml.org/sax/features/external-parameter-entities", false);

        try
        {
            DocumentBuilder b = f.newDocumentBuilder();
            b.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
            b.setErrorHandler(new ParseErrors(log));
            return b.parse(in);
        }
        catch (ParserConfigurationException | SAXException e)
        {
            throw new ConversionException("Exception while parsing input file: " + e.getMessage(), e);
        }
    }

    private void setFeature(DocumentBuilderFactory f, String feature, boolean value)
    {
        try
        {
            f.setFeature(feature, value);
        }
        catch (ParserConfigurationException e)
        {
            log.debug("XML parser does not support " + feature + ": " + e.getMessage());
        }
    }

    private static final class ParseErrors implements ErrorHandler
    {
        private final Log log;

        ParseErrors(Log log)
        {
            this.log = log;
        }

        @Override
        public void warning(SAXParseException e)
        {
            log.warn("XML line " + e.getLineNumber() + ": " + e.getMessage());
        }

        @Override
        public void error(SAXParseException e)
        {
            log.error("XML line " + e.getLineNumber() + ": " + e.getMessage());
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException
        {
            throw e;
        }
    }
}
