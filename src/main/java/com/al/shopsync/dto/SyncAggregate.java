package com.al.shopsync.dto;

import com.al.shopsync.model.SyncResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Totals and per-item results of a sync invocation.
 *
 * <p>
 * {@code total == successful + failed == results.size()} holds after every
 * {@link #append(List)}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SyncAggregate {

    private int total;

    private int successful;

    private int failed;

    /**
     * Results in input order
     */
    private List<SyncResult> results = new ArrayList<>();

    public static SyncAggregate empty() {
        return new SyncAggregate(0, 0, 0, new ArrayList<>());
    }

    public static SyncAggregate of(List<SyncResult> results) {
        SyncAggregate aggregate = empty();
        aggregate.append(results);
        return aggregate;
    }

    public void append(List<SyncResult> batch) {
        for (SyncResult result : batch) {
            results.add(result);
            total++;
            if (result.isSuccess()) {
                successful++;
            } else {
                failed++;
            }
        }
    }

    public SyncAggregate copy() {
        return new SyncAggregate(total, successful, failed, new ArrayList<>(results));
    }
}
