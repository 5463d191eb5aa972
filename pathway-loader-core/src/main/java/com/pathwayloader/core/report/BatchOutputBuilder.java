package com.pathwayloader.core.report;

import com.pathwayloader.core.emit.CxWriter;
import com.pathwayloader.core.model.FindingType;
import com.pathwayloader.core.output.NetworkOutput;
import com.pathwayloader.core.output.OutputFile;
import com.pathwayloader.core.pipeline.BatchSummary;
import com.pathwayloader.core.pipeline.NormalizationResult;
import com.pathwayloader.core.util.FileUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns a batch summary into the files an {@link com.pathwayloader.core.output.OutputWriter} writes:
 * one {@code <base>.cx} per normalized network plus the two finding reports.
 */
public class BatchOutputBuilder {

    public static final String INVALID_NAMES_REPORT = "invalid_gene_names.tsv";
    public static final String NESTED_COMPLEXES_REPORT = "nested_complexes.tsv";

    private final CxWriter cxWriter;
    private final FindingReportFormatter formatter;

    public BatchOutputBuilder(CxWriter cxWriter, FindingReportFormatter formatter) {
        this.cxWriter = cxWriter;
        this.formatter = formatter;
    }

    /**
     * Builds the output files.
     *
     * @param summary batch outcome; failed networks produce no files
     * @param includeReports whether to add the finding reports
     * @return files to write
     */
    public NetworkOutput build(BatchSummary summary, boolean includeReports) {
        List<NormalizationResult> succeeded = summary.succeeded();
        List<OutputFile> files = new ArrayList<>();
        for (NormalizationResult result : succeeded) {
            files.add(new OutputFile(FileUtils.baseName(result.sourceName()) + ".cx",
                cxWriter.write(result.document()), OutputFile.CX_CONTENT_TYPE));
        }
        if (includeReports) {
            files.add(new OutputFile(INVALID_NAMES_REPORT,
                formatter.format(succeeded, Set.of(FindingType.INVALID_GENE_NAME)), OutputFile.TSV_CONTENT_TYPE));
            files.add(new OutputFile(NESTED_COMPLEXES_REPORT,
                formatter.format(succeeded, Set.of(FindingType.NESTED_COMPLEX, FindingType.MEMBERSHIP_CYCLE)),
                OutputFile.TSV_CONTENT_TYPE));
        }
        return new NetworkOutput(files);
    }
}
