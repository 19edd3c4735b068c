package com.archflow.core.graph;

import com.archflow.core.nodes.AlternativeDesignNode;
import com.archflow.core.nodes.AuditNode;
import com.archflow.core.nodes.CostReviewNode;
import com.archflow.core.nodes.DesignNode;
import com.archflow.core.nodes.ReliabilityReviewNode;
import com.archflow.core.nodes.RecommenderNode;
import com.archflow.core.nodes.RequirementsNode;
import com.archflow.core.nodes.SecurityReviewNode;
import com.archflow.core.nodes.TerraformCoderNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Wires the architecture-design agents into the pipeline graph:
 * <pre>
 * requirements -> [design | alternative_design] -> [security | cost | reliability]
 *              -> audit --(needs_revision)--> designs
 *                   \--(approved)--> recommender -> terraform_coder
 * </pre>
 */
@Component
public class DesignPipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(DesignPipelineGraph.class);

    public static final String REQUIREMENTS_STAGE = "requirements";
    public static final String DESIGNS_STAGE = "designs";
    public static final String ANALYSIS_STAGE = "analysis";
    public static final String AUDIT_STAGE = "audit";
    public static final String RECOMMEND_STAGE = "recommend";
    public static final String TERRAFORM_STAGE = "terraform";

    private final PipelineGraph graph;

    public DesignPipelineGraph(RequirementsNode requirements,
                               DesignNode design,
                               AlternativeDesignNode alternativeDesign,
                               SecurityReviewNode security,
                               CostReviewNode cost,
                               ReliabilityReviewNode reliability,
                               AuditNode audit,
                               RecommenderNode recommender,
                               TerraformCoderNode terraformCoder) {
        this.graph = PipelineGraph.builder()
                .single(REQUIREMENTS_STAGE, requirements)
                .parallel(DESIGNS_STAGE, design, alternativeDesign)
                .parallel(ANALYSIS_STAGE, security, cost, reliability)
                .decision(AUDIT_STAGE, audit)
                .single(RECOMMEND_STAGE, recommender)
                .single(TERRAFORM_STAGE, terraformCoder)
                .revisionEdge(AUDIT_STAGE, DESIGNS_STAGE)
                .build();
        log.info("Design pipeline graph built with {} stages", graph.stages().size());
    }

    public PipelineGraph graph() {
        return graph;
    }
}
