package com.aacprocessors.core.processor.base;

import com.aacprocessors.core.exception.FormatException;
import com.aacprocessors.core.exception.SchemaException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;

import java.io.IOException;

/**
 * Abstract base class for processors whose pagesets are archives of per-page documents
 * (XML or JSON), parsed with Jackson.
 *
 * <p>This class provides pre-configured Jackson mappers and utility methods for:
 * <ul>
 *   <li>XML parsing and writing via XmlMapper</li>
 *   <li>JSON parsing and writing via ObjectMapper</li>
 *   <li>JsonNode navigation and attribute extraction</li>
 *   <li>Mapping parse failures to {@link FormatException}</li>
 * </ul>
 *
 * @see AbstractProcessor
 * @since 1.0.0
 */
public abstract class AbstractDocumentArchiveProcessor extends AbstractProcessor {

    /**
     * XML mapper for grid documents.
     * Thread-safe and reusable across parse operations.
     */
    protected final XmlMapper xmlMapper;

    /**
     * JSON mapper for boards and manifests.
     * Thread-safe and reusable across parse operations.
     */
    protected final ObjectMapper objectMapper;

    /**
     * Constructor that initializes both XML and JSON mappers.
     */
    protected AbstractDocumentArchiveProcessor() {
        super();
        this.xmlMapper = new XmlMapper();
        this.xmlMapper.enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION);
        this.xmlMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.xmlMapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    // ==================== Parsing ====================

    /**
     * Parses an XML document into a JsonNode tree.
     *
     * @param content raw document bytes
     * @param entryName archive entry name used in error messages
     * @return root JsonNode of parsed XML (root element contents)
     * @throws FormatException if the document is not well-formed XML
     */
    protected JsonNode parseXml(byte[] content, String entryName) {
        try {
            return xmlMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new FormatException("Malformed XML in " + entryName + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FormatException("Unreadable XML in " + entryName, e);
        }
    }

    /**
     * Parses a JSON document into a JsonNode tree.
     *
     * @param content raw document bytes
     * @param entryName archive entry name used in error messages
     * @return root JsonNode of parsed JSON
     * @throws FormatException if the document is not well-formed JSON
     */
    protected JsonNode parseJson(byte[] content, String entryName) {
        try {
            JsonNode node = objectMapper.readTree(content);
            if (node == null || node.isMissingNode()) {
                throw new FormatException("Empty JSON document " + entryName);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new FormatException("Malformed JSON in " + entryName + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FormatException("Unreadable JSON in " + entryName, e);
        }
    }

    // ==================== JsonNode Navigation Utilities ====================

    /**
     * Extracts an attribute value from a JsonNode.
     *
     * <p>This handles both XML attributes and JSON object properties.
     *
     * @param node JsonNode to extract from
     * @param attributeName attribute/property name
     * @return attribute value as string, or null if not found
     */
    protected String extractAttribute(JsonNode node, String attributeName) {
        if (node == null) {
            return null;
        }

        JsonNode attrNode = node.get(attributeName);
        if (attrNode != null && attrNode.isValueNode() && !attrNode.isNull()) {
            return attrNode.asText();
        }

        return null;
    }

    /**
     * Extracts the text of an XML element that may also carry attributes.
     *
     * <p>Jackson exposes the text of an element with attributes under the empty property
     * name. Rich text held in child elements (e.g. {@code <p><s><r>Hi</r></s></p>}) is
     * flattened in document order; plain values directly on the element are attributes
     * and are skipped.
     *
     * @param node element node
     * @return element text, or empty string
     */
    protected String elementText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        JsonNode text = node.get("");
        if (text != null && text.isValueNode()) {
            return text.asText();
        }
        StringBuilder builder = new StringBuilder();
        node.elements().forEachRemaining(child -> {
            if (child.isContainerNode()) {
                appendDescendantText(child, builder);
            }
        });
        return builder.toString();
    }

    private void appendDescendantText(JsonNode node, StringBuilder builder) {
        if (node.isValueNode()) {
            builder.append(node.asText());
            return;
        }
        node.elements().forEachRemaining(child -> appendDescendantText(child, builder));
    }

    /**
     * Reads a required integer field.
     *
     * @throws SchemaException if the field is missing or not an integer
     */
    protected int requireInt(JsonNode node, String field, String documentName) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new SchemaException(documentName + " is missing integer field '" + field + "'");
        }
        return value.asInt();
    }

    /**
     * Reads a required non-empty text field.
     *
     * @throws SchemaException if the field is missing or empty
     */
    protected String requireText(JsonNode node, String field, String documentName) {
        String value = extractAttribute(node, field);
        if (value == null || value.isEmpty()) {
            throw new SchemaException(documentName + " is missing required field '" + field + "'");
        }
        return value;
    }

    /**
     * Normalizes a JsonNode to always be an array.
     *
     * <p>If the node is already an array, returns it as-is.
     * If the node is a single object, wraps it in an array.
     * Useful for handling XML elements that can appear once or multiple times.
     *
     * @param node JsonNode to normalize
     * @return array JsonNode
     */
    protected JsonNode normalizeToArray(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return xmlMapper.createArrayNode();
        }
        if (node.isArray()) {
            return node;
        }
        return xmlMapper.createArrayNode().add(node);
    }
}
