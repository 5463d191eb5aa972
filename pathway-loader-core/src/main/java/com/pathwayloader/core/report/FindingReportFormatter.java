package com.pathwayloader.core.report;

import com.pathwayloader.core.model.Finding;
import com.pathwayloader.core.model.FindingType;
import com.pathwayloader.core.pipeline.NormalizationResult;

import java.util.List;
import java.util.Set;

/**
 * Formats findings as tab separated tables for diagnostic persistence.
 *
 * <p>Columns: {@code NETWORK, NODE_ID, NODE_NAME, DETAIL}. Tabs and line breaks inside
 * values are replaced by spaces.
 */
public class FindingReportFormatter {

    public static final String HEADER = "NETWORK\tNODE_ID\tNODE_NAME\tDETAIL";

    /**
     * Formats the findings of the given types across networks.
     *
     * @param results normalized networks, in report order
     * @param types finding types to include
     * @return TSV text with header, one row per finding
     */
    public String format(List<NormalizationResult> results, Set<FindingType> types) {
        StringBuilder table = new StringBuilder(HEADER).append('\n');
        for (NormalizationResult result : results) {
            for (Finding finding : result.findings()) {
                if (types.contains(finding.type())) {
                    table.append(clean(result.sourceName())).append('\t')
                        .append(clean(finding.nodeId())).append('\t')
                        .append(clean(finding.nodeName())).append('\t')
                        .append(clean(finding.detail())).append('\n');
                }
            }
        }
        return table.toString();
    }

    private static String clean(String value) {
        return value.replaceAll("[\\t\\r\\n]+", " ");
    }
}
