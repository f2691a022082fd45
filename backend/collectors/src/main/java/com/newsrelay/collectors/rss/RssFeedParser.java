package com.newsrelay.collectors.rss;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

public final class RssFeedParser {
    private static final Logger LOGGER = Logger.getLogger(RssFeedParser.class.getName());
    private static final List<String> RSS_BODY_TAGS = List.of("yandex:full-text", "content:encoded", "description");
    private static final List<String> RSS_DATE_TAGS = List.of("pubDate", "dc:date", "published");
    private static final List<String> ATOM_BODY_TAGS = List.of("content", "summary");
    private static final List<String> ATOM_DATE_TAGS = List.of("published", "updated");

    private RssFeedParser() {
    }

    public static ParsedFeed parse(String xml) {
        if (xml == null || xml.isBlank()) {
            return ParsedFeed.invalid();
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);

            var builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                    LOGGER.fine("Feed parser warning: " + exception.getMessage());
                }

                @Override
                public void error(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }
            });

            Document document = builder.parse(new ByteArrayInputStream(xml.trim().getBytes(StandardCharsets.UTF_8)));
            Element root = document.getDocumentElement();
            if (root == null) {
                return new ParsedFeed(List.of(), false);
            }
            String rootName = root.getTagName().toLowerCase(Locale.ROOT);
            if ("rss".equals(rootName) || rootName.endsWith("rdf")) {
                return new ParsedFeed(parseRss(document), false);
            }
            if ("feed".equals(rootName)) {
                return new ParsedFeed(parseAtom(document), false);
            }
            return new ParsedFeed(List.of(), false);
        } catch (Exception e) {
            LOGGER.fine("Invalid feed XML: " + e.getMessage());
            return ParsedFeed.invalid();
        }
    }

    private static List<FeedEntry> parseRss(Document document) {
        NodeList items = document.getElementsByTagName("item");
        List<FeedEntry> entries = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            Node item = items.item(i);
            String link = childText(item, "link").orElse("");
            entries.add(new FeedEntry(
                    childText(item, "guid").orElse(null),
                    childText(item, "title").orElse(""),
                    link,
                    firstChildText(item, RSS_BODY_TAGS).orElse(""),
                    firstChildText(item, RSS_DATE_TAGS).orElse(null)
            ));
        }
        return entries;
    }

    private static List<FeedEntry> parseAtom(Document document) {
        NodeList nodes = document.getElementsByTagName("entry");
        List<FeedEntry> entries = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node entry = nodes.item(i);
            entries.add(new FeedEntry(
                    childText(entry, "id").orElse(null),
                    childText(entry, "title").orElse(""),
                    atomLink(entry).orElse(""),
                    firstChildText(entry, ATOM_BODY_TAGS).orElse(""),
                    firstChildText(entry, ATOM_DATE_TAGS).orElse(null)
            ));
        }
        return entries;
    }

    private static Optional<String> firstChildText(Node parent, List<String> tagNames) {
        for (String tagName : tagNames) {
            Optional<String> text = childText(parent, tagName).filter(value -> !value.isBlank());
            if (text.isPresent()) {
                return text;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> childText(Node parent, String tagName) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        String text = children.item(0).getTextContent();
        return text == null ? Optional.empty() : Optional.of(text.trim());
    }

    private static Optional<String> atomLink(Node entry) {
        if (!(entry instanceof Element element)) {
            return Optional.empty();
        }
        NodeList links = element.getElementsByTagName("link");
        String fallback = null;
        for (int i = 0; i < links.getLength(); i++) {
            if (!(links.item(i) instanceof Element link)) {
                continue;
            }
            String href = link.getAttribute("href");
            if (href == null || href.isBlank()) {
                continue;
            }
            String rel = link.getAttribute("rel");
            if (rel == null || rel.isBlank() || "alternate".equals(rel)) {
                return Optional.of(href.trim());
            }
            if (fallback == null) {
                fallback = href.trim();
            }
        }
        return Optional.ofNullable(fallback);
    }
}
