package com.jsonparser.generator.runtime;

/**
 * Why a single parse call failed. None of these invalidate the parser handle.
 */
public enum ParseFailure {
    PROCESS_SPAWN_FAILED,
    MALFORMED_OUTPUT,
    PARSE_FAILURE_SENTINEL,
    TIMED_OUT
}
