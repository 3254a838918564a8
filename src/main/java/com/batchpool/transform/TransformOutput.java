package com.batchpool.transform;

/**
 * Size metadata every transform output reports for batch aggregation.
 */
public interface TransformOutput {

    /**
     * Bytes read from the input.
     */
    long inputBytes();

    /**
     * Bytes produced.
     */
    long outputBytes();

    /**
     * Domain units processed, e.g. pixels.
     */
    long unitCount();
}
