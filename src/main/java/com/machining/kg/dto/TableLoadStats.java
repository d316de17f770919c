package com.machining.kg.dto;

import lombok.Data;

@Data
public class TableLoadStats {
    private long rowsRead;
    private long rowsWritten;
    private long rowsSkipped;
    private int batchesCommitted;
    private String failure; // set when the whole table was rejected
}
