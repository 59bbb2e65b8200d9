package com.sbomcheck.core.validation;

import com.sbomcheck.core.diagnostic.Diagnostic;
import com.sbomcheck.core.diagnostic.ElementType;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.model.SpdxFile;
import com.sbomcheck.core.model.SpdxPackage;
import com.sbomcheck.core.parser.ParsedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Runs the SPDX java library's own verification over a parsed document.
 *
 * <p>The library reports plain strings. Each one becomes a specification
 * {@link Diagnostic}; a message that names a package or file of the document is
 * attributed to that element, anything else to the document with no IDs.
 */
public class SpdxLibraryValidator implements SpecificationValidator {

    private static final Logger log = LoggerFactory.getLogger(SpdxLibraryValidator.class);

    @Override
    public List<Diagnostic> validate(ParsedDocument parsed) {
        List<String> messages = parsed.libraryDocument().verify();
        log.debug("SPDX library verification returned {} messages", messages.size());

        List<Diagnostic> diagnostics = new ArrayList<>(messages.size());
        for (String message : messages) {
            diagnostics.add(toDiagnostic(message, parsed.document()));
        }
        return List.copyOf(diagnostics);
    }

    static Diagnostic toDiagnostic(String message, SpdxDocument document) {
        List<Map.Entry<String, ElementType>> candidates = new ArrayList<>();
        for (SpdxPackage spdxPackage : document.packages()) {
            candidates.add(Map.entry(spdxPackage.spdxId(), ElementType.PACKAGE));
        }
        for (SpdxFile file : document.files()) {
            candidates.add(Map.entry(file.spdxId(), ElementType.FILE));
        }
        // longest first so SPDXRef-a does not claim a message about SPDXRef-ab
        candidates.sort(Comparator.comparingInt(
            (Map.Entry<String, ElementType> entry) -> entry.getKey().length()).reversed());

        for (Map.Entry<String, ElementType> candidate : candidates) {
            if (message.contains(candidate.getKey())) {
                return Diagnostic.specification(candidate.getValue(), candidate.getKey(),
                    document.documentId(), message);
            }
        }
        return Diagnostic.specification(ElementType.DOCUMENT, null, null, message);
    }
}
