package com.batchpool.processor;

import com.batchpool.exception.BatchPoolException;
import com.batchpool.transform.TransformOutput;

/**
 * Result of one item: an output or the failure naming the item.
 */
record ItemOutcome<O extends TransformOutput>(O output, BatchPoolException failure) {

    static <O extends TransformOutput> ItemOutcome<O> success(O output) {
        return new ItemOutcome<>(output, null);
    }

    static <O extends TransformOutput> ItemOutcome<O> failure(BatchPoolException failure) {
        return new ItemOutcome<>(null, failure);
    }

    boolean isSuccess() {
        return failure == null;
    }
}
