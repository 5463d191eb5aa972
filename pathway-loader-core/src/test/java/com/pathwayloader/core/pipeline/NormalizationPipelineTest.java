package com.pathwayloader.core.pipeline;

import com.pathwayloader.core.config.LoaderConfig;
import com.pathwayloader.core.emit.NetworkDocument;
import com.pathwayloader.core.emit.NetworkEmitter;
import com.pathwayloader.core.model.EdgeRecord;
import com.pathwayloader.core.model.Finding;
import com.pathwayloader.core.model.FindingType;
import com.pathwayloader.core.model.MembershipRelation;
import com.pathwayloader.core.model.NodeRecord;
import com.pathwayloader.core.parser.NetworkFileParser;
import com.pathwayloader.core.parser.ParsedNetwork;
import com.pathwayloader.core.validate.GeneSymbolAuthority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.pathwayloader.core.testutil.NetworkFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for {@link NormalizationPipeline} on parsed network files.
 */
class NormalizationPipelineTest {

    private NetworkFileParser parser;
    private NormalizationPipeline pipeline;

    @BeforeEach
    void setUp() {
        parser = new NetworkFileParser();
        pipeline = NormalizationPipeline.create(LoaderConfig.defaults(), GeneSymbolAuthority.of(APPROVED_SYMBOLS));
    }

    @Test
    void create_runsStagesInFixedOrder() {
        assertThat(pipeline.getStages())
            .extracting(PipelineStage::getId)
            .containsExactly("name-validation", "nesting-resolution", "edge-deduplication", "graph-assembly");
    }

    @Test
    void run_nestedFamily_flattensOuterMemberList() {
        NormalizationResult result = run(NESTED_FAMILY_NETWORK, "nested.txt");

        assertThat(membersOf(result, "f1")).containsExactly("a", "b");
        assertThat(membersOf(result, "f2")).containsExactly("a", "b");
        assertThat(result.findingsOfType(FindingType.NESTED_COMPLEX))
            .singleElement()
            .satisfies(finding -> {
                assertThat(finding.nodeName()).isEqualTo("FAM1");
                assertThat(finding.detail()).contains("FAM2");
            });
    }

    @Test
    void run_nestedFamily_emitsFlatMemberAttribute() {
        NetworkDocument document = run(NESTED_FAMILY_NETWORK, "nested.txt").document();

        long fam1 = nodeId(document, "FAM1");
        assertThat(document.nodeAttribute(fam1, NetworkEmitter.MEMBER_ATTRIBUTE))
            .contains(List.of("GENE_A", "GENE_B"));
    }

    @Test
    void run_duplicateEdges_collapseToOne() {
        NormalizationResult result = run(NESTED_FAMILY_NETWORK, "nested.txt");

        assertThat(result.tables().edges())
            .extracting(EdgeRecord::sourceId, EdgeRecord::targetId, EdgeRecord::interactionType)
            .containsExactly(tuple("a", "c", "interacts"));
        assertThat(result.statistics().duplicateEdgesRemoved()).isEqualTo(1);
    }

    @Test
    void run_unconnectedGene_isPruned() {
        NormalizationResult result = run(NESTED_FAMILY_NETWORK, "nested.txt");

        assertThat(result.tables().nodes()).extracting(NodeRecord::name).doesNotContain("GENE_X");
        assertThat(result.document().nodes()).extracting(NetworkDocument.Node::name).doesNotContain("GENE_X");
        assertThat(result.statistics().orphanGenesPruned()).isEqualTo(1);
    }

    @Test
    void run_unapprovedGeneName_isReportedAndRetained() {
        String content = """
            Unapproved
            --NODE_NAME\tNODE_ID\tNODE_TYPE\tPARENT_ID
            FOOBAR123\tq\tGENE\t-1
            GENE_A\ta\tGENE\t-1

            --EDGE_ID\tSOURCE\tTARGET\tEDGE_TYPE
            e1\tq\ta\tACTIVATES
            """;

        NormalizationResult result = run(content, "unapproved.txt");

        assertThat(result.findingsOfType(FindingType.INVALID_GENE_NAME))
            .extracting(Finding::nodeId, Finding::nodeName)
            .containsExactly(tuple("q", "FOOBAR123"));
        assertThat(result.document().nodes()).extracting(NetworkDocument.Node::name).contains("FOOBAR123");
    }

    @Test
    @Timeout(5)
    void run_membershipCycle_completesWithFinding() {
        String content = """
            Cycle
            --NODE_NAME\tNODE_ID\tNODE_TYPE\tPARENT_ID
            FAM1\tf1\tFAMILY\tf2
            FAM2\tf2\tFAMILY\tf1
            GENE_A\ta\tGENE\tf2
            GENE_C\tc\tGENE\t-1

            --EDGE_ID\tSOURCE\tTARGET\tEDGE_TYPE
            e1\ta\tc\tACTIVATES
            """;

        NormalizationResult result = run(content, "cycle.txt");

        assertThat(result.findingsOfType(FindingType.MEMBERSHIP_CYCLE)).isNotEmpty();
        assertThat(result.document().nodes()).extracting(NetworkDocument.Node::name)
            .containsExactly("FAM1", "FAM2", "GENE_A", "GENE_C");
        assertThat(result.document().edges()).hasSize(1);
    }

    @Test
    void run_membershipEdges_becomeMembersNotEdges() {
        String content = """
            Membership edges
            --NODE_NAME\tNODE_ID\tNODE_TYPE\tPARENT_ID
            CPLX\tk\tCOMPLEX\t-1
            GENE_A\ta\tGENE\t-1
            GENE_B\tb\tGENE\t-1

            --EDGE_ID\tSOURCE\tTARGET\tEDGE_TYPE
            e1\ta\tk\tIS_MEMBER_OF
            e2\tb\tk\tis_member_of
            """;

        NormalizationResult result = run(content, "membership.txt");

        assertThat(result.tables().edges()).isEmpty();
        assertThat(membersOf(result, "k")).containsExactly("a", "b");
        assertThat(result.statistics().membershipEdgesConsumed()).isEqualTo(2);
    }

    @Test
    void run_referentialClosureHolds() {
        NormalizationResult result = run(NESTED_FAMILY_NETWORK, "nested.txt");

        Set<String> ids = result.tables().nodesById().keySet();
        assertThat(result.tables().edges()).allSatisfy(edge -> {
            assertThat(ids).contains(edge.sourceId(), edge.targetId());
        });
        assertThat(result.tables().memberships()).allSatisfy(relation -> {
            assertThat(ids).contains(relation.complexId(), relation.memberId());
        });

        Set<Long> documentIds = result.document().nodes().stream()
            .map(NetworkDocument.Node::id)
            .collect(Collectors.toSet());
        assertThat(result.document().edges()).allSatisfy(edge -> {
            assertThat(documentIds).contains(edge.sourceId(), edge.targetId());
        });
    }

    @Test
    void run_headerBecomesNetworkAttributes() {
        NetworkDocument document = run(NESTED_FAMILY_NETWORK, "nested.txt").document();

        assertThat(document.networkAttribute(NetworkEmitter.NAME_ATTRIBUTE)).contains("Nested Family Pathway");
        assertThat(document.networkAttribute(NetworkEmitter.DESCRIPTION_ATTRIBUTE))
            .hasValueSatisfying(description -> assertThat(description).contains("Families nesting other families."));
    }

    @Test
    void run_statisticsReflectEveryStage() {
        PipelineStatistics statistics = run(NESTED_FAMILY_NETWORK, "nested.txt").statistics();

        assertThat(statistics.nodesParsed()).isEqualTo(6);
        assertThat(statistics.edgesParsed()).isEqualTo(2);
        assertThat(statistics.membershipRelations()).isEqualTo(4);
        assertThat(statistics.nodesEmitted()).isEqualTo(5);
        assertThat(statistics.edgesEmitted()).isEqualTo(1);
        assertThat(statistics.hasChanges()).isTrue();
    }

    @Test
    void run_stagesThatReportNothing_leaveNoFindings() {
        String content = """
            Plain
            --NODE_NAME\tNODE_ID\tNODE_TYPE\tPARENT_ID
            GENE_A\ta\tGENE\t-1
            GENE_B\tb\tGENE\t-1

            --EDGE_ID\tSOURCE\tTARGET\tEDGE_TYPE
            e1\ta\tb\tACTIVATES
            """;

        NormalizationResult result = run(content, "plain.txt");

        assertThat(result.findings()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.statistics().hasChanges()).isFalse();
    }

    private NormalizationResult run(String content, String sourceName) {
        ParsedNetwork parsed = parser.parse(content, sourceName);
        return pipeline.run(parsed);
    }

    private static List<String> membersOf(NormalizationResult result, String complexId) {
        return result.tables().memberships().stream()
            .filter(relation -> relation.complexId().equals(complexId))
            .map(MembershipRelation::memberId)
            .toList();
    }

    private static long nodeId(NetworkDocument document, String name) {
        Map<String, Long> ids = document.nodes().stream()
            .collect(Collectors.toMap(NetworkDocument.Node::name, NetworkDocument.Node::id));
        return ids.get(name);
    }
}
