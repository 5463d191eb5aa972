package com.pathwayloader.core.emit;

import com.pathwayloader.core.model.EdgeRecord;
import com.pathwayloader.core.model.MembershipRelation;
import com.pathwayloader.core.model.NetworkDescription;
import com.pathwayloader.core.model.NetworkTables;
import com.pathwayloader.core.model.NodeRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts assembled tables into a {@link NetworkDocument}.
 *
 * <p>Node ids are assigned sequentially in table order, edge ids continue after the last
 * node id. Every complex node carries a {@value #MEMBER_ATTRIBUTE} list (possibly empty)
 * of member display names. Extra input columns become node or edge attributes, renamed
 * through the configured column name map. No validation happens here: the tables must already be
 * consistent.
 */
public class NetworkEmitter {

    public static final String NAME_ATTRIBUTE = "name";
    public static final String DESCRIPTION_ATTRIBUTE = "description";
    public static final String TYPE_ATTRIBUTE = "type";
    public static final String MEMBER_ATTRIBUTE = "member";

    private final Map<String, String> constantAttributes;
    private final Map<String, String> columnNames;

    /**
     * @param constantAttributes network attributes added to every network, e.g. version
     */
    public NetworkEmitter(Map<String, String> constantAttributes) {
        this(constantAttributes, Map.of());
    }

    /**
     * @param constantAttributes network attributes added to every network, e.g. version
     * @param columnNames input column name to emitted attribute name; unlisted columns keep their name
     */
    public NetworkEmitter(Map<String, String> constantAttributes, Map<String, String> columnNames) {
        this.constantAttributes = constantAttributes == null ? Map.of() : new LinkedHashMap<>(constantAttributes);
        this.columnNames = columnNames == null ? Map.of() : Map.copyOf(columnNames);
    }

    /**
     * Builds the network.
     *
     * @param tables assembled tables
     * @param description header metadata of the source file
     * @param fallbackName network name when the header has no title
     * @return network document
     */
    public NetworkDocument emit(NetworkTables tables, NetworkDescription description, String fallbackName) {
        Map<String, Long> nodeIds = new HashMap<>();
        Map<String, String> names = new HashMap<>();
        List<NetworkDocument.Node> nodes = new ArrayList<>();
        List<NetworkDocument.Attribute> nodeAttributes = new ArrayList<>();

        long nextId = 0;
        for (NodeRecord record : tables.nodes()) {
            long id = nextId++;
            nodeIds.put(record.id(), id);
            names.put(record.id(), record.name());
            nodes.add(new NetworkDocument.Node(id, record.name(), record.isGene() ? record.name() : null));
            nodeAttributes.add(new NetworkDocument.Attribute(id, TYPE_ATTRIBUTE, record.type().label(), null));
            record.attributes().forEach((key, value) -> {
                if (!value.isBlank()) {
                    nodeAttributes.add(new NetworkDocument.Attribute(id, attributeName(key), value, null));
                }
            });
        }

        Map<String, List<String>> members = new LinkedHashMap<>();
        for (NodeRecord record : tables.nodes()) {
            if (record.isComplex()) {
                members.put(record.id(), new ArrayList<>());
            }
        }
        for (MembershipRelation relation : tables.memberships()) {
            members.computeIfAbsent(relation.complexId(), id -> new ArrayList<>())
                .add(names.get(relation.memberId()));
        }
        members.forEach((complexId, memberNames) -> nodeAttributes.add(new NetworkDocument.Attribute(
            nodeIds.get(complexId), MEMBER_ATTRIBUTE, List.copyOf(memberNames), NetworkDocument.LIST_OF_STRING)));

        List<NetworkDocument.Edge> edges = new ArrayList<>();
        List<NetworkDocument.Attribute> edgeAttributes = new ArrayList<>();
        for (EdgeRecord record : tables.edges()) {
            long id = nextId++;
            edges.add(new NetworkDocument.Edge(id, nodeIds.get(record.sourceId()), nodeIds.get(record.targetId()),
                record.interactionType()));
            record.attributes().forEach((key, value) -> {
                if (!value.isBlank()) {
                    edgeAttributes.add(new NetworkDocument.Attribute(id, attributeName(key), value, null));
                }
            });
        }

        List<NetworkDocument.NetworkAttribute> networkAttributes = new ArrayList<>();
        String name = description.title().isEmpty() ? fallbackName : description.title();
        networkAttributes.add(new NetworkDocument.NetworkAttribute(NAME_ATTRIBUTE, name));
        networkAttributes.add(new NetworkDocument.NetworkAttribute(DESCRIPTION_ATTRIBUTE, description.description()));
        constantAttributes.forEach((key, value) -> {
            if (!NAME_ATTRIBUTE.equals(key) && !DESCRIPTION_ATTRIBUTE.equals(key) && value != null) {
                networkAttributes.add(new NetworkDocument.NetworkAttribute(key, value));
            }
        });

        return new NetworkDocument(nodes, edges, nodeAttributes, edgeAttributes, networkAttributes);
    }

    private String attributeName(String column) {
        return columnNames.getOrDefault(column, column);
    }
}
