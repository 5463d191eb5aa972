package com.pathwayloader.core.parser;

import com.pathwayloader.core.model.EdgeRecord;
import com.pathwayloader.core.model.NetworkDescription;
import com.pathwayloader.core.model.NetworkTables;
import com.pathwayloader.core.model.NodeRecord;
import com.pathwayloader.core.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses PathwayMapper flat-text network files.
 *
 * <p>The file layout is:
 * <pre>{@code
 * <title line>
 * <description lines>
 * --NODE_NAME  NODE_ID  NODE_TYPE  PARENT_ID  ...
 * <node rows>
 *
 * --EDGE_ID  SOURCE  TARGET  EDGE_TYPE  ...
 * <edge rows>
 * }</pre>
 *
 * <p>Columns are tab separated. Columns beyond the ones named above are kept as the
 * record's attribute bag. A missing section header, an empty file, a repeated header
 * column, a duplicate node identifier or a row wider than its header raise
 * {@link NetworkParseException}. A leading byte order mark is ignored.
 */
public class NetworkFileParser {

    private static final Logger log = LoggerFactory.getLogger(NetworkFileParser.class);

    public static final String NODE_NAME = "--NODE_NAME";
    public static final String NODE_ID = "NODE_ID";
    public static final String NODE_TYPE = "NODE_TYPE";
    public static final String PARENT_ID = "PARENT_ID";

    public static final String EDGE_ID = "--EDGE_ID";
    public static final String SOURCE = "SOURCE";
    public static final String TARGET = "TARGET";
    public static final String EDGE_TYPE = "EDGE_TYPE";

    private static final String NO_PARENT = "-1";
    private static final String BYTE_ORDER_MARK = "\uFEFF";
    private static final Set<String> NODE_COLUMNS = Set.of(NODE_NAME, NODE_ID, NODE_TYPE, PARENT_ID);
    private static final Set<String> EDGE_COLUMNS = Set.of(EDGE_ID, SOURCE, TARGET, EDGE_TYPE);

    /**
     * Reads and parses a network file.
     *
     * @param file network file
     * @return parsed network named after the file
     * @throws IOException if the file cannot be read
     * @throws NetworkParseException if the content is malformed
     */
    public ParsedNetwork parse(Path file) throws IOException {
        String sourceName = file.getFileName().toString();
        if (Files.size(file) == 0) {
            throw new NetworkParseException(sourceName, "File is empty");
        }
        log.info("Examining file: {}", file);
        return parse(Files.readString(file, StandardCharsets.UTF_8), sourceName);
    }

    /**
     * Parses network file content.
     *
     * @param content raw file content
     * @param sourceName name used in log messages and errors
     * @return parsed network
     * @throws NetworkParseException if the content is malformed
     */
    public ParsedNetwork parse(String content, String sourceName) {
        if (content == null || content.isBlank()) {
            throw new NetworkParseException(sourceName, "File is empty");
        }
        if (content.startsWith(BYTE_ORDER_MARK)) {
            content = content.substring(1);
        }
        List<String> lines = content.lines().toList();

        int nodeHeaderIndex = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).startsWith(NODE_NAME)) {
                nodeHeaderIndex = i;
                break;
            }
        }
        if (nodeHeaderIndex < 0) {
            throw new NetworkParseException(sourceName, "Missing node section header (" + NODE_NAME + ")");
        }

        NetworkDescription description = parseHeader(lines.subList(0, nodeHeaderIndex));

        List<String> nodeColumns = splitHeader(sourceName, nodeHeaderIndex, lines.get(nodeHeaderIndex));
        requireColumns(sourceName, nodeHeaderIndex, nodeColumns, List.of(NODE_NAME, NODE_ID, NODE_TYPE));

        List<NodeRecord> nodes = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int index = nodeHeaderIndex + 1;
        for (; index < lines.size() && !endsNodeSection(lines.get(index)); index++) {
            Map<String, String> row = toRow(sourceName, index, nodeColumns, lines.get(index));
            NodeRecord node = toNode(sourceName, index, row);
            if (!seenIds.add(node.id())) {
                throw new NetworkParseException(sourceName, index + 1, "Duplicate node id: " + node.id());
            }
            nodes.add(node);
        }

        while (index < lines.size() && lines.get(index).isBlank()) {
            index++;
        }
        if (index >= lines.size()) {
            throw new NetworkParseException(sourceName, "Missing edge section header (" + SOURCE + ", "
                + TARGET + ", " + EDGE_TYPE + ")");
        }

        int edgeHeaderIndex = index;
        List<String> edgeColumns = splitHeader(sourceName, edgeHeaderIndex, lines.get(edgeHeaderIndex));
        requireColumns(sourceName, edgeHeaderIndex, edgeColumns, List.of(SOURCE, TARGET, EDGE_TYPE));

        List<EdgeRecord> edges = new ArrayList<>();
        for (index = edgeHeaderIndex + 1; index < lines.size(); index++) {
            if (lines.get(index).isBlank()) {
                continue;
            }
            Map<String, String> row = toRow(sourceName, index, edgeColumns, lines.get(index));
            edges.add(toEdge(sourceName, index, row));
        }

        log.debug("Parsed {}: {} nodes, {} edges", sourceName, nodes.size(), edges.size());
        return new ParsedNetwork(sourceName, description, new NetworkTables(nodes, edges, List.of()));
    }

    private boolean endsNodeSection(String line) {
        return line.isBlank() || line.startsWith(EDGE_ID);
    }

    private NetworkDescription parseHeader(List<String> headerLines) {
        List<String> text = headerLines.stream()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .toList();
        if (text.isEmpty()) {
            return NetworkDescription.empty();
        }
        return new NetworkDescription(text.get(0), String.join(" ", text.subList(1, text.size())));
    }

    private List<String> splitHeader(String sourceName, int index, String line) {
        List<String> columns = new ArrayList<>();
        for (String column : line.split("\t", -1)) {
            columns.add(column.trim());
        }
        while (!columns.isEmpty() && columns.get(columns.size() - 1).isEmpty()) {
            columns.remove(columns.size() - 1);
        }
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            if (!column.isEmpty() && !seen.add(column)) {
                throw new NetworkParseException(sourceName, index + 1, "Duplicate column in section header: " + column);
            }
        }
        return columns;
    }

    private void requireColumns(String sourceName, int index, List<String> columns, List<String> required) {
        for (String column : required) {
            if (!columns.contains(column)) {
                throw new NetworkParseException(sourceName, index + 1,
                    "Section header lacks column " + column + ": " + columns);
            }
        }
    }

    private Map<String, String> toRow(String sourceName, int index, List<String> columns, String line) {
        String[] cells = line.split("\t", -1);
        for (int i = columns.size(); i < cells.length; i++) {
            if (!cells[i].isBlank()) {
                throw new NetworkParseException(sourceName, index + 1,
                    "Row has " + cells.length + " cells but header has " + columns.size());
            }
        }
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i), i < cells.length ? cells[i].trim() : "");
        }
        return row;
    }

    private NodeRecord toNode(String sourceName, int index, Map<String, String> row) {
        String id = row.get(NODE_ID);
        if (id.isEmpty()) {
            throw new NetworkParseException(sourceName, index + 1, "Node row without " + NODE_ID);
        }
        String parent = row.getOrDefault(PARENT_ID, "");
        if (NO_PARENT.equals(parent)) {
            parent = null;
        }
        return new NodeRecord(id, row.get(NODE_NAME), NodeType.fromTag(row.get(NODE_TYPE)), parent,
            extraColumns(row, NODE_COLUMNS));
    }

    private EdgeRecord toEdge(String sourceName, int index, Map<String, String> row) {
        String source = row.get(SOURCE);
        String target = row.get(TARGET);
        String type = row.get(EDGE_TYPE);
        if (source.isEmpty() || target.isEmpty() || type.isEmpty()) {
            throw new NetworkParseException(sourceName, index + 1,
                "Edge row needs " + SOURCE + ", " + TARGET + " and " + EDGE_TYPE);
        }
        String edgeId = row.getOrDefault(EDGE_ID, "");
        return new EdgeRecord(edgeId.isEmpty() ? null : edgeId, source, target, type,
            extraColumns(row, EDGE_COLUMNS));
    }

    private Map<String, String> extraColumns(Map<String, String> row, Set<String> known) {
        Map<String, String> extra = new LinkedHashMap<>();
        row.forEach((column, value) -> {
            if (!known.contains(column) && !column.isEmpty()) {
                extra.put(column, value);
            }
        });
        return extra;
    }
}
