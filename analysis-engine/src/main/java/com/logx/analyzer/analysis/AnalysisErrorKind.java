package com.logx.analyzer.analysis;

/**
 * Why an analysis run did not complete.
 *
 * @author Naveed Gung
 */
public enum AnalysisErrorKind {

    /** No evidence file exists for the upload id. */
    NOT_FOUND,

    /** No parser accepted the evidence file. */
    UNSUPPORTED_FORMAT,

    /** A parser ran but reported an error. */
    PARSE_FAILURE,

    RULE_ENGINE_FAILURE,

    /** Cancelled on request or after the run timeout. */
    CANCELLED,

    /** Unexpected fault, including storage I/O errors. */
    INTERNAL
}
