package com.amannm.pdftk.assembly;

/**
 * How parsed ranges are turned into an output sequence.
 */
public enum AssemblyMode {
    /** Ranges in order, or every page of every document when there are none. */
    CAT,
    /** Every page of the single document, turned as the ranges say. */
    ROTATE,
    /** One page from each range in turn until all ranges run dry. */
    SHUFFLE
}
