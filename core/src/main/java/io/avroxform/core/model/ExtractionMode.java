package io.avroxform.core.model;

/** How output rows are assembled from a decoded record. */
public enum ExtractionMode {
    /** Fixed four-field layout: {@code username, tweet, timestamp, photo}. */
    STATIC,

    /** One cell per configured column, addressed by path expression. */
    DYNAMIC
}
