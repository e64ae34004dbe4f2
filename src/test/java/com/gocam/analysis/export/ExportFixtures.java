package com.gocam.analysis.export;

import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.GoCamModel;
import com.gocam.analysis.graph.GraphBuilder;

import static com.gocam.analysis.TestModels.*;

final class ExportFixtures {

    private ExportFixtures() {
    }

    static GoCamGraph kinaseCascade(String modelId) {
        return new GraphBuilder().build(GoCamModel.builder()
                .id(modelId)
                .title("kinase cascade")
                .individual(activity("a1", "GO:0004672", "protein kinase activity"))
                .individual(activity("a2", "GO:0004672", "protein kinase activity"))
                .individual(gene("g1", "PomBase:SPAC1.01", "cdc2"))
                .fact(fact("f1", "a1", "enabled by", "g1"))
                .fact(fact("f2", "a1", "directly positively regulates", "a2"))
                .build());
    }
}
