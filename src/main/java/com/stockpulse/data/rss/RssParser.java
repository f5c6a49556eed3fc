package com.stockpulse.data.rss;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/** Parses RSS 2.0 items. Documents with a DOCTYPE are rejected. */
public final class RssParser {
    private static final Logger LOG = LogManager.getLogger(RssParser.class);

    private RssParser() {
    }

    /**
     * Parses up to {@code maxItems} items. A document that is not well-formed XML yields an empty list.
     */
    public static List<RssItem> parse(String xml, int maxItems) {
        List<RssItem> out = new ArrayList<>();
        if (xml == null || xml.isBlank()) {
            return out;
        }
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            doc = factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            LOG.warn("unparseable RSS document: {}", e.getMessage());
            return out;
        }
        NodeList items = doc.getElementsByTagName("item");
        for (int i = 0; i < items.getLength() && out.size() < maxItems; i++) {
            Element item = (Element) items.item(i);
            String title = text(item, "title");
            String link = text(item, "link");
            out.add(new RssItem(
                    title,
                    link,
                    sourceText(item, title, link),
                    parseDate(text(item, "pubDate")),
                    text(item, "description")
            ));
        }
        return out;
    }

    static Instant parseDate(String pubDate) {
        if (pubDate == null || pubDate.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(pubDate.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            LOG.debug("unparseable pubDate '{}'", pubDate);
            return null;
        }
    }

    private static String text(Element parent, String tag) {
        NodeList nl = parent.getElementsByTagName(tag);
        if (nl.getLength() == 0) {
            return null;
        }
        Node n = nl.item(0);
        return n == null ? null : n.getTextContent();
    }

    private static String sourceText(Element item, String title, String link) {
        String source = text(item, "source");
        if (source != null && !source.trim().isEmpty()) {
            return source.trim();
        }

        // aggregators append the outlet to the title as "headline - Outlet"
        if (title != null && title.contains(" - ")) {
            String[] parts = title.split(" - ");
            String guessed = parts[parts.length - 1].trim();
            if (parts.length >= 2 && !guessed.isEmpty()) {
                return guessed;
            }
        }

        if (link != null && !link.trim().isEmpty()) {
            try {
                String host = URI.create(link.trim()).getHost();
                if (host != null && !host.trim().isEmpty()) {
                    return host.trim();
                }
            } catch (IllegalArgumentException e) {
                LOG.debug("bad item link '{}'", link);
            }
        }
        return "";
    }
}
