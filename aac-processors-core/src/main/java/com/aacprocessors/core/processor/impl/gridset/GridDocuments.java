package com.aacprocessors.core.processor.impl.gridset;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;

import java.util.List;

/**
 * Grid 3 documents as written by {@link GridsetProcessor}.
 *
 * <p>Only the elements the tree model maps to are produced. Reading goes through
 * Jackson's tree model instead, so that documents written by Grid 3 itself, which carry
 * many more elements, load without a matching class for each.
 */
final class GridDocuments {

    private GridDocuments() {
    }

    @JacksonXmlRootElement(localName = "Grid")
    @JsonPropertyOrder({"Name", "GridGuid", "ColumnDefinitions", "RowDefinitions", "Cells"})
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Grid(
        @JacksonXmlProperty(isAttribute = true, localName = "Name") String name,
        @JacksonXmlProperty(isAttribute = true, localName = "GridGuid") String gridGuid,
        @JacksonXmlElementWrapper(localName = "ColumnDefinitions")
        @JacksonXmlProperty(localName = "ColumnDefinition") List<Definition> columnDefinitions,
        @JacksonXmlElementWrapper(localName = "RowDefinitions")
        @JacksonXmlProperty(localName = "RowDefinition") List<Definition> rowDefinitions,
        @JacksonXmlElementWrapper(localName = "Cells")
        @JacksonXmlProperty(localName = "Cell") List<Cell> cells
    ) {}

    /** Row or column definition; Grid 3 sizes tracks evenly when no size is given. */
    record Definition() {}

    @JsonPropertyOrder({"X", "Y", "Content"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Cell(
        @JacksonXmlProperty(isAttribute = true, localName = "X") Integer x,
        @JacksonXmlProperty(isAttribute = true, localName = "Y") Integer y,
        @JacksonXmlProperty(localName = "Content") Content content
    ) {}

    @JsonPropertyOrder({"ContentType", "Commands", "CaptionAndImage"})
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Content(
        @JacksonXmlProperty(localName = "ContentType") String contentType,
        @JacksonXmlElementWrapper(localName = "Commands")
        @JacksonXmlProperty(localName = "Command") List<Command> commands,
        @JacksonXmlProperty(localName = "CaptionAndImage") CaptionAndImage captionAndImage
    ) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Command(
        @JacksonXmlProperty(isAttribute = true, localName = "ID") String id,
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "Parameter") List<Parameter> parameters
    ) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Parameter(
        @JacksonXmlProperty(isAttribute = true, localName = "Key") String key,
        @JacksonXmlText String value
    ) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record CaptionAndImage(
        @JacksonXmlProperty(localName = "Caption") String caption
    ) {}

    @JacksonXmlRootElement(localName = "GridSetSettings")
    record Settings(
        @JacksonXmlProperty(localName = "StartGrid") String startGrid
    ) {}

    @JacksonXmlRootElement(localName = "FileMap")
    record FileMap(
        @JacksonXmlElementWrapper(localName = "Entries")
        @JacksonXmlProperty(localName = "Entry") List<FileMapEntry> entries
    ) {}

    record FileMapEntry(
        @JacksonXmlProperty(isAttribute = true, localName = "StaticFile") String staticFile
    ) {}
}
