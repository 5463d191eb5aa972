package com.pathwayloader.core.pipeline.stage;

import com.pathwayloader.core.model.Finding;
import com.pathwayloader.core.model.FindingType;
import com.pathwayloader.core.model.NetworkTables;
import com.pathwayloader.core.model.NodeRecord;
import com.pathwayloader.core.pipeline.StageResult;
import com.pathwayloader.core.pipeline.base.AbstractStage;
import com.pathwayloader.core.validate.GeneSymbolAuthority;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks gene node display names against the naming authority.
 *
 * <p>Validity is advisory: unknown names produce an {@link FindingType#INVALID_GENE_NAME}
 * finding and the node is kept as is. Non-gene nodes are not checked.
 */
public class NameValidationStage extends AbstractStage {

    public static final String STAGE_ID = "name-validation";

    private final GeneSymbolAuthority authority;

    public NameValidationStage(GeneSymbolAuthority authority) {
        this.authority = Objects.requireNonNull(authority, "authority must not be null");
    }

    @Override
    public String getId() {
        return STAGE_ID;
    }

    @Override
    public String getDisplayName() {
        return "Gene Name Validator";
    }

    @Override
    public StageResult apply(NetworkTables tables) {
        List<Finding> findings = new ArrayList<>();
        for (NodeRecord node : tables.nodes()) {
            if (node.isGene() && !authority.isValid(node.name())) {
                log.debug("Invalid gene symbol '{}' on node {}", node.name(), node.id());
                findings.add(new Finding(FindingType.INVALID_GENE_NAME, node.id(), node.name(),
                    "not an approved gene symbol"));
            }
        }
        return result(tables, findings, List.of(), Map.of());
    }
}
