package com.machining.kg.exception;

import com.machining.kg.resolver.QueryState;
import lombok.Getter;

import java.util.Map;

@Getter
public class QueryCancelledException extends MachiningKgException {

    private final QueryState state;

    public QueryCancelledException(QueryState state) {
        super(ErrorCode.QUERY_CANCELLED, "Query cancelled at state " + state, Map.of("state", state.name()), null);
        this.state = state;
    }
}
