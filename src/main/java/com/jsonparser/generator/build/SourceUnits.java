package com.jsonparser.generator.build;

import lombok.Value;

/**
 * Header and implementation halves of a generated source.
 */
@Value
class SourceUnits {
    String header;
    String implementation;
}
