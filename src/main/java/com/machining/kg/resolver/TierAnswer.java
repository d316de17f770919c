package com.machining.kg.resolver;

import com.machining.kg.dto.GraphFact;
import com.machining.kg.index.ScoredUnit;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class TierAnswer {

    private String answer;

    /** Terminal state the query enters with this answer */
    private QueryState state;

    /** Null when no index retrieval produced the answer */
    private RetrievalMode mode;

    @Builder.Default
    private List<ScoredUnit> units = new ArrayList<>();

    @Builder.Default
    private List<GraphFact> facts = new ArrayList<>();
}
