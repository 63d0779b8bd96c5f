package mta.nzb.checker.service.nzb;

import mta.nzb.checker.exception.NzbParseException;
import mta.nzb.checker.model.ParsedNzb;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * NzbParser
 * Streams an NZB document and extracts its segment message-ids, file subjects and newsgroups.
 *
 * <pre>
 * &lt;nzb&gt;
 *   &lt;file subject="..."&gt;
 *     &lt;groups&gt;&lt;group&gt;alt.binaries.x&lt;/group&gt;&lt;/groups&gt;
 *     &lt;segments&gt;
 *       &lt;segment bytes="N" number="K"&gt;&amp;lt;id@host&amp;gt;&lt;/segment&gt;
 *     &lt;/segments&gt;
 *   &lt;/file&gt;
 * &lt;/nzb&gt;
 * </pre>
 */
@Component
public class NzbParser {

    private static final Logger logger = LoggerFactory.getLogger(NzbParser.class);

    private static final String ARCHIVE_HINT = "7z";

    private final XMLInputFactory inputFactory;

    public NzbParser() {
        this.inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    /**
     * Parses raw NZB bytes.
     *
     * @param data NZB document
     * @return segment ids (unique, bracketed, document order) and file metadata
     * @throws NzbParseException if the document is malformed or has no file or segment
     */
    public ParsedNzb parse(byte[] data) {
        if (data == null || data.length == 0) {
            throw new NzbParseException("NZB payload is empty");
        }

        Set<String> segmentIds = new LinkedHashSet<>();
        Set<String> subjects = new LinkedHashSet<>();
        Set<String> groups = new LinkedHashSet<>();
        boolean archiveHint = false;
        int files = 0;

        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(new ByteArrayInputStream(data));
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                switch (reader.getLocalName()) {
                    case "file" -> {
                        files++;
                        String subject = decode(reader.getAttributeValue(null, "subject"));
                        if (!subject.isEmpty()) {
                            subjects.add(subject);
                            archiveHint |= containsArchiveHint(subject);
                        }
                    }
                    case "group" -> {
                        String group = decode(reader.getElementText());
                        if (!group.isEmpty()) {
                            groups.add(group);
                        }
                    }
                    case "segment" -> {
                        String raw = decode(reader.getElementText());
                        String id = normalizeMessageId(raw);
                        if (!id.isEmpty()) {
                            segmentIds.add(id);
                        } else if (!raw.isEmpty()) {
                            logger.warn("Skipping segment with malformed message-id ({} chars)", raw.length());
                        }
                    }
                    default -> {
                        // head, meta, segments and groups wrappers carry nothing we need
                    }
                }
            }
        } catch (XMLStreamException e) {
            throw new NzbParseException("Malformed NZB document: " + e.getMessage(), e);
        } finally {
            closeQuietly(reader);
        }

        if (files == 0) {
            throw new NzbParseException("NZB document contains no file elements");
        }
        if (segmentIds.isEmpty()) {
            throw new NzbParseException("NZB document contains no segments");
        }

        return new ParsedNzb(new ArrayList<>(segmentIds), archiveHint, subjects, groups);
    }

    /**
     * Wraps a message-id in angle brackets unless it already is.
     * Ids with whitespace, control characters or inner angle brackets are rejected (RFC 5536).
     *
     * @param id raw id, e.g. "part1of9.abc@news.example" or "&lt;part1of9.abc@news.example&gt;"
     * @return "&lt;part1of9.abc@news.example&gt;", or "" for blank or malformed input
     */
    public static String normalizeMessageId(String id) {
        if (id == null) {
            return "";
        }
        String bare = stripBrackets(id.trim());
        if (bare.isEmpty() || !isValidIdBody(bare)) {
            return "";
        }
        return "<" + bare + ">";
    }

    private static boolean isValidIdBody(String bare) {
        for (int i = 0; i < bare.length(); i++) {
            char c = bare.charAt(i);
            if (c <= ' ' || c == 0x7f || c == '<' || c == '>' || Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    static boolean containsArchiveHint(String subject) {
        return subject != null && subject.toLowerCase(Locale.ROOT).contains(ARCHIVE_HINT);
    }

    /**
     * The XML reader already resolved the standard entities; posters that double-escape
     * (&amp;amp;lt;) or use HTML named entities leave the rest for HtmlUtils.
     */
    private static String decode(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.indexOf('&') >= 0 ? HtmlUtils.htmlUnescape(raw) : raw;
        return value.trim();
    }

    private static String stripBrackets(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '<') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '>') {
            end--;
        }
        return value.substring(start, end).trim();
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException ignored) {
            // reader over an in-memory stream, nothing left to release
        }
    }
}
