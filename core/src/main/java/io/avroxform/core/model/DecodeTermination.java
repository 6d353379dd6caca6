package io.avroxform.core.model;

/** Why the repeated-decode loop stopped. None of these is reported as an error. */
public enum DecodeTermination {
    /** Every byte of the record stream was consumed. */
    END_OF_STREAM,

    /** The codec rejected the bytes at the current offset; the tail was dropped. */
    DECODE_FAILURE,

    /** The codec returned a record without consuming any byte; the tail was dropped. */
    NO_PROGRESS
}
