package com.pathwayloader.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link NodeType} and the node record helpers built on it.
 */
class NodeTypeTest {

    @ParameterizedTest
    @CsvSource({
        "GENE, GENE",
        "gene, GENE",
        "Complex, COMPLEX",
        "FAMILY, FAMILY",
        "GENERIC_FAMILY, GENERIC_FAMILY",
        "generic family, GENERIC_FAMILY",
        "Generic-Family, GENERIC_FAMILY",
        "COMPARTMENT, COMPARTMENT",
        "PROCESS, PROCESS",
        "drug, OTHER"
    })
    void fromTag_normalizesTag(String tag, NodeType expected) {
        assertThat(NodeType.fromTag(tag)).isEqualTo(expected);
    }

    @Test
    void fromTag_blankOrNull_isOther() {
        assertThat(NodeType.fromTag("")).isEqualTo(NodeType.OTHER);
        assertThat(NodeType.fromTag(null)).isEqualTo(NodeType.OTHER);
    }

    @Test
    void isComplex_coversComplexAndFamilies() {
        assertThat(NodeType.values())
            .filteredOn(NodeType::isComplex)
            .containsExactlyInAnyOrder(NodeType.COMPLEX, NodeType.FAMILY, NodeType.GENERIC_FAMILY);
    }

    @Test
    void nodeRecord_blankParentBecomesNull() {
        NodeRecord node = new NodeRecord("a", "GENE_A", NodeType.GENE, " ", Map.of());

        assertThat(node.parentId()).isNull();
        assertThat(node.isGene()).isTrue();
        assertThat(node.isComplex()).isFalse();
    }

    @Test
    void nodeRecord_withAttribute_returnsCopy() {
        NodeRecord node = NodeRecord.of("a", "GENE_A", NodeType.GENE);

        NodeRecord tagged = node.withAttribute("compartment", "Nucleus");

        assertThat(node.attributes()).isEmpty();
        assertThat(tagged.attributes()).containsEntry("compartment", "Nucleus");
        assertThatThrownBy(() -> tagged.attributes().put("x", "y"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
