package com.jsonparser.generator.build;

/**
 * Stage of a build attempt that failed.
 */
public enum BuildFailure {
    TEMPLATE_FAILED,
    WORKSPACE_CREATE_FAILED,
    SOURCE_WRITE_FAILED,
    EXTERNAL_BUILD_FAILED
}
