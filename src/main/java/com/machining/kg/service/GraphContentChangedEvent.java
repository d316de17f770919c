package com.machining.kg.service;

import com.machining.kg.dto.LoadReport;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a load wrote to the graph, including an aborted load whose
 * earlier batches committed. Anything derived from the graph is stale from here on.
 */
@Getter
public class GraphContentChangedEvent extends ApplicationEvent {

    private final LoadReport report;

    public GraphContentChangedEvent(Object source, LoadReport report) {
        super(source);
        this.report = report;
    }
}
