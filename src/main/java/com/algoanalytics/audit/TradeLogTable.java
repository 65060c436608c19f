package com.algoanalytics.audit;

import java.util.List;
import lombok.Value;

/** Tabular form of an audit log: a header row and one row of string cells per trade. */
@Value
public class TradeLogTable {

    List<String> columns;
    List<List<String>> rows;

    public int getRowCount() {
        return rows.size();
    }

    /** Cell by row index and column name. */
    public String cell(int row, String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.get(row).get(index);
    }
}
