package com.aacprocessors.core.processor.impl.gridset;

import com.aacprocessors.core.exception.FormatException;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventFactory;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLEventWriter;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.Characters;
import javax.xml.stream.events.StartDocument;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Streams an XML document event by event and replaces selected text nodes.
 *
 * <p>Elements named as joined are treated as one text: their character data, including
 * that of nested rich-text runs, is looked up as a whole and a replacement takes the
 * place of all their content.
 *
 * <p>Every other event is copied as read. Documents in which nothing was replaced should
 * be kept as their original bytes; {@link Result#changed()} tells the caller which case
 * applies.
 */
final class XmlTextRewriter {

    private static final XMLInputFactory INPUT_FACTORY = createInputFactory();
    private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newFactory();
    private static final XMLEventFactory EVENT_FACTORY = XMLEventFactory.newFactory();

    /**
     * Decides the replacement for one text node.
     */
    @FunctionalInterface
    interface TextRule {
        /**
         * @param path open elements from the document root to the text's parent
         * @param text complete text content of the node
         * @return replacement text, or empty to keep the original
         */
        Optional<String> replace(List<StartElement> path, String text);
    }

    /**
     * Outcome of a rewrite.
     *
     * @param content rewritten document
     * @param replacements number of text nodes replaced
     */
    record Result(byte[] content, int replacements) {
        boolean changed() {
            return replacements > 0;
        }
    }

    private XmlTextRewriter() {
    }

    /**
     * Rewrites one document, looking up every text node on its own.
     *
     * @see #rewrite(byte[], String, Set, TextRule)
     */
    static Result rewrite(byte[] xml, String entryName, TextRule rule) {
        return rewrite(xml, entryName, Set.of(), rule);
    }

    /**
     * Rewrites one document.
     *
     * @param xml document bytes
     * @param entryName entry name used in error messages
     * @param joinedElements local names of elements whose whole text content is one lookup
     * @param rule replacement rule
     * @return rewritten document and replacement count
     * @throws FormatException if the document is not well-formed
     */
    static Result rewrite(byte[] xml, String entryName, Set<String> joinedElements, TextRule rule) {
        try {
            XMLEventReader reader = INPUT_FACTORY.createXMLEventReader(new ByteArrayInputStream(xml));
            String encoding = "UTF-8";
            if (reader.peek() instanceof StartDocument start && start.encodingSet()) {
                encoding = start.getCharacterEncodingScheme();
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream(xml.length + 64);
            XMLEventWriter writer = OUTPUT_FACTORY.createXMLEventWriter(out, encoding);
            Deque<StartElement> open = new ArrayDeque<>();
            List<XMLEvent> joined = null;
            int joinedDepth = 0;
            int replacements = 0;

            while (reader.hasNext()) {
                XMLEvent event = reader.nextEvent();
                if (event.isStartElement()) {
                    open.addLast(event.asStartElement());
                    if (joined == null && joinedElements.contains(event.asStartElement().getName().getLocalPart())) {
                        joined = new ArrayList<>();
                        joinedDepth = open.size();
                    }
                } else if (event.isEndElement()) {
                    if (joined != null && open.size() == joinedDepth) {
                        joined.add(event);
                        if (replaceJoined(joined, List.copyOf(open), rule, writer)) {
                            replacements++;
                        }
                        joined = null;
                        open.pollLast();
                        continue;
                    }
                    open.pollLast();
                } else if (joined == null && event.isCharacters() && !open.isEmpty()) {
                    Characters characters = event.asCharacters();
                    if (!characters.isWhiteSpace()) {
                        Optional<String> replacement = rule.replace(List.copyOf(open), characters.getData());
                        if (replacement.isPresent()) {
                            event = EVENT_FACTORY.createCharacters(replacement.get());
                            replacements++;
                        }
                    }
                }
                if (joined != null) {
                    joined.add(event);
                } else {
                    writer.add(event);
                }
            }
            writer.flush();
            writer.close();
            reader.close();
            return new Result(out.toByteArray(), replacements);
        } catch (XMLStreamException e) {
            throw new FormatException("Malformed XML in " + entryName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes a buffered joined element, either unchanged or with its content replaced.
     *
     * @return whether the content was replaced
     */
    private static boolean replaceJoined(List<XMLEvent> events, List<StartElement> path, TextRule rule,
                                         XMLEventWriter writer) throws XMLStreamException {
        StringBuilder text = new StringBuilder();
        for (XMLEvent event : events) {
            if (event.isCharacters() && !event.asCharacters().isWhiteSpace()) {
                text.append(event.asCharacters().getData());
            }
        }
        Optional<String> replacement = text.length() == 0
            ? Optional.empty()
            : rule.replace(path, text.toString());
        if (replacement.isEmpty()) {
            for (XMLEvent event : events) {
                writer.add(event);
            }
            return false;
        }
        writer.add(events.get(0));
        writer.add(EVENT_FACTORY.createCharacters(replacement.get()));
        writer.add(events.get(events.size() - 1));
        return true;
    }

    /**
     * Returns whether an element on the path has the given local name.
     */
    static boolean hasAncestor(List<StartElement> path, String localName) {
        return path.stream().anyMatch(element -> localName.equals(element.getName().getLocalPart()));
    }

    /**
     * Returns the value of an attribute, or null.
     */
    static String attribute(StartElement element, String localName) {
        Attribute attribute = element.getAttributeByName(new QName(localName));
        return attribute == null ? null : attribute.getValue();
    }

    private static XMLInputFactory createInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        return factory;
    }
}
