package com.schemalens.core.model;

/**
 * Side of an edge as seen from one identifier: outgoing edges are its "References",
 * incoming edges its "Referenced By".
 */
public enum Direction {
    OUTGOING,
    INCOMING
}
