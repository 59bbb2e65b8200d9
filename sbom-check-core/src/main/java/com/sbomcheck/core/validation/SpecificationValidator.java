package com.sbomcheck.core.validation;

import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.parser.ParsedDocument;

import java.util.List;

/**
 * Checks a parsed document against the SPDX specification.
 *
 * <p>Findings use the same {@link Diagnostic} shape as completeness findings but never
 * carry the completeness marker. Implementations must not throw for invalid
 * documents; every problem is returned as a diagnostic.
 */
public interface SpecificationValidator {

    /**
     * Validates a document.
     *
     * @param document parsed document
     * @return specification findings, empty if none
     */
    List<Diagnostic> validate(ParsedDocument document);
}
