package com.shapekit.core.testutil;

/**
 * Direction an event stream test exercises.
 */
public enum EventStreamTestVariety {
    /** Events are turned into wire messages. */
    MARSHALL,
    /** Wire messages are turned into events or errors. */
    UNMARSHALL
}
