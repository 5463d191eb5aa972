package com.pathwayloader.core.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Serializes a {@link NetworkDocument} to CX JSON.
 *
 * <p>Aspect order: {@code numberVerification}, {@code metaData}, {@code networkAttributes},
 * {@code nodes}, {@code edges}, {@code nodeAttributes}, {@code edgeAttributes},
 * {@code status}.
 */
public class CxWriter {

    private static final long NUMBER_VERIFICATION = 281474976710655L;

    private final ObjectMapper mapper;

    public CxWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes the document as a CX aspect list.
     *
     * @param document network to serialize
     * @return CX JSON text
     * @throws IllegalStateException if serialization fails
     */
    public String write(NetworkDocument document) {
        ArrayNode cx = mapper.createArrayNode();

        ArrayNode numberVerification = mapper.createArrayNode();
        numberVerification.addObject().put("longNumber", NUMBER_VERIFICATION);
        aspect(cx, "numberVerification", numberVerification);

        ArrayNode metaData = mapper.createArrayNode();
        meta(metaData, "networkAttributes", document.networkAttributes().size());
        meta(metaData, "nodes", document.nodes().size());
        meta(metaData, "edges", document.edges().size());
        meta(metaData, "nodeAttributes", document.nodeAttributes().size());
        meta(metaData, "edgeAttributes", document.edgeAttributes().size());
        aspect(cx, "metaData", metaData);

        ArrayNode networkAttributes = mapper.createArrayNode();
        document.networkAttributes().forEach(attribute -> networkAttributes.addObject()
            .put("n", attribute.name())
            .put("v", attribute.value()));
        aspect(cx, "networkAttributes", networkAttributes);

        ArrayNode nodes = mapper.createArrayNode();
        for (NetworkDocument.Node node : document.nodes()) {
            ObjectNode element = nodes.addObject().put("@id", node.id()).put("n", node.name());
            if (node.represents() != null) {
                element.put("r", node.represents());
            }
        }
        aspect(cx, "nodes", nodes);

        ArrayNode edges = mapper.createArrayNode();
        document.edges().forEach(edge -> edges.addObject()
            .put("@id", edge.id())
            .put("s", edge.sourceId())
            .put("t", edge.targetId())
            .put("i", edge.interaction()));
        aspect(cx, "edges", edges);

        aspect(cx, "nodeAttributes", attributes(document.nodeAttributes()));
        aspect(cx, "edgeAttributes", attributes(document.edgeAttributes()));

        ArrayNode status = mapper.createArrayNode();
        status.addObject().put("error", "").put("success", true);
        aspect(cx, "status", status);

        try {
            return mapper.writeValueAsString(cx);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize network to CX", e);
        }
    }

    private ArrayNode attributes(List<NetworkDocument.Attribute> attributes) {
        ArrayNode array = mapper.createArrayNode();
        for (NetworkDocument.Attribute attribute : attributes) {
            ObjectNode element = array.addObject().put("po", attribute.propertyOf()).put("n", attribute.name());
            if (attribute.value() instanceof List<?> values) {
                ArrayNode list = element.putArray("v");
                values.forEach(value -> list.add(String.valueOf(value)));
            } else {
                element.put("v", String.valueOf(attribute.value()));
            }
            if (attribute.dataType() != null) {
                element.put("d", attribute.dataType());
            }
        }
        return array;
    }

    private void meta(ArrayNode metaData, String name, int count) {
        metaData.addObject()
            .put("name", name)
            .put("elementCount", count)
            .put("version", "1.0")
            .put("consistencyGroup", 1);
    }

    private void aspect(ArrayNode cx, String name, ArrayNode elements) {
        cx.addObject().set(name, elements);
    }
}
