package com.pathwayloader.core.report;

import com.pathwayloader.core.emit.CxWriter;
import com.pathwayloader.core.emit.NetworkDocument;
import com.pathwayloader.core.model.Finding;
import com.pathwayloader.core.model.FindingType;
import com.pathwayloader.core.model.NetworkTables;
import com.pathwayloader.core.output.NetworkOutput;
import com.pathwayloader.core.output.OutputFile;
import com.pathwayloader.core.pipeline.BatchSummary;
import com.pathwayloader.core.pipeline.NetworkLoadResult;
import com.pathwayloader.core.pipeline.NormalizationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BatchOutputBuilder}.
 */
class BatchOutputBuilderTest {

    private BatchOutputBuilder builder;
    private BatchSummary summary;

    @BeforeEach
    void setUp() {
        builder = new BatchOutputBuilder(new CxWriter(), new FindingReportFormatter());
        NormalizationResult wnt = new NormalizationResult("wnt.txt", null, NetworkTables.empty(),
            new NetworkDocument(null, null, null, null, null),
            List.of(
                new Finding(FindingType.INVALID_GENE_NAME, "q", "FOOBAR123", "not an approved gene symbol"),
                new Finding(FindingType.MEMBERSHIP_CYCLE, "f1", "FAM1", "membership cycle f1 -> f2 -> f1")),
            List.of(), null);
        summary = new BatchSummary(List.of(
            NetworkLoadResult.succeeded(wnt),
            NetworkLoadResult.failed("broken.txt", "File is empty")));
    }

    @Test
    void build_withReports_writesNetworksThenReports() {
        NetworkOutput output = builder.build(summary, true);

        assertThat(output.files()).extracting(OutputFile::relativePath)
            .containsExactly("wnt.cx", BatchOutputBuilder.INVALID_NAMES_REPORT, BatchOutputBuilder.NESTED_COMPLEXES_REPORT);
        assertThat(output.files().get(0).contentType()).isEqualTo(OutputFile.CX_CONTENT_TYPE);
        assertThat(output.files().get(1).content()).contains("FOOBAR123");
        assertThat(output.files().get(2).content()).contains("membership cycle");
    }

    @Test
    void build_withoutReports_writesNetworksOnly() {
        NetworkOutput output = builder.build(summary, false);

        assertThat(output.files()).extracting(OutputFile::relativePath).containsExactly("wnt.cx");
    }

    @Test
    void build_failedNetworks_produceNoFiles() {
        NetworkOutput output = builder.build(summary, true);

        assertThat(output.files()).extracting(OutputFile::relativePath)
            .noneMatch(path -> path.startsWith("broken"));
    }
}
