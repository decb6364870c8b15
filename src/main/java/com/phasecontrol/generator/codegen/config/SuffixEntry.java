package com.phasecontrol.generator.codegen.config;

/**
 * Value of one {@code suffix_mapping} entry: either a plain suffix
 * ({@link PlainSuffix}) or a pair of variants chosen by qualifier code
 * ({@link QualifierSuffix}).
 */
public interface SuffixEntry {
}
