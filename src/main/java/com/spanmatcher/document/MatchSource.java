package com.spanmatcher.document;

/** 片段来源引擎 */
public enum MatchSource {
    EXACT,
    FUZZY,
    REGEX
}
