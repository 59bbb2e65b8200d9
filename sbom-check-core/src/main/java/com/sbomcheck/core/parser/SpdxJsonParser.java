package com.sbomcheck.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sbomcheck.core.model.SpdxDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spdx.jacksonstore.MultiFormatStore;
import org.spdx.library.InvalidSPDXAnalysisException;
import org.spdx.library.ModelCopyManager;
import org.spdx.storage.simple.InMemSpdxStore;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads an SPDX 2.x JSON document with the SPDX java library and builds the document model.
 *
 * <p>Each document is loaded into its own in-memory store through the library's JSON
 * store. Anything the library refuses to load, including malformed license expressions
 * and dangling element references, is reported as a single message of the form
 * {@code Error while parsing document <name>: [<problem>]}.
 *
 * <p>Thread-safe; no state is shared between calls.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * JsonNode tree = objectMapper.readTree(json);
 * try {
 *     ParsedDocument parsed = new SpdxJsonParser().parse(tree);
 * } catch (SpdxParsingException e) {
 *     e.getMessages().forEach(log::warn);
 * }
 * }</pre>
 */
public class SpdxJsonParser {

    private static final Logger log = LoggerFactory.getLogger(SpdxJsonParser.class);

    /** Library setting that keeps license lookups on the list bundled in its jar. */
    static final String LOCAL_LICENSES_PROPERTY = "org.spdx.useJARLicenseInfoOnly";
    static final String LEGACY_LOCAL_LICENSES_PROPERTY = "SPDXParser.OnlyUseLocalLicenses";

    static {
        // checks run offline unless the caller chose otherwise
        if (System.getProperty(LOCAL_LICENSES_PROPERTY) == null) {
            System.setProperty(LOCAL_LICENSES_PROPERTY, "true");
        }
        if (System.getProperty(LEGACY_LOCAL_LICENSES_PROPERTY) == null) {
            System.setProperty(LEGACY_LOCAL_LICENSES_PROPERTY, "true");
        }
    }

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SpdxModelMapper modelMapper = new SpdxModelMapper();

    /**
     * Parses a JSON tree into a document.
     *
     * @param root root node of the JSON document
     * @return the library's document and the model built from it
     * @throws SpdxParsingException if the SPDX library cannot load the document
     */
    public ParsedDocument parse(JsonNode root) throws SpdxParsingException {
        if (root == null || !root.isObject()) {
            throw new SpdxParsingException(List.of(
                "Error while parsing document: the document root must be a JSON object."));
        }
        String subject = subject(root);
        if (!root.hasNonNull("creationInfo")) {
            throw new SpdxParsingException(List.of(
                "Error while parsing " + subject + ": [CreationInfo does not exist.]"));
        }

        byte[] serialized;
        try {
            serialized = objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw failure(subject, e.getOriginalMessage(), e);
        }

        MultiFormatStore store = new MultiFormatStore(new InMemSpdxStore(), MultiFormatStore.Format.JSON);
        try (InputStream in = new ByteArrayInputStream(serialized)) {
            String documentUri = store.deSerialize(in, false);
            org.spdx.library.model.SpdxDocument libraryDocument =
                new org.spdx.library.model.SpdxDocument(store, documentUri, new ModelCopyManager(), false);
            SpdxDocument document = modelMapper.toModel(libraryDocument,
                ids(root, "packages"), ids(root, "files"));
            log.debug("Loaded {} with {} packages and {} files", documentUri,
                document.packages().size(), document.files().size());
            return new ParsedDocument(document, libraryDocument);
        } catch (InvalidSPDXAnalysisException | IOException e) {
            throw failure(subject, e.getMessage(), e);
        } catch (RuntimeException e) {
            // the library signals some shape errors with unchecked exceptions
            throw failure(subject, e.toString(), e);
        }
    }

    private static SpdxParsingException failure(String subject, String problem, Exception cause) {
        log.debug("SPDX library rejected {}", subject, cause);
        return new SpdxParsingException(
            List.of("Error while parsing " + subject + ": [" + problem + "]"), cause);
    }

    private static String subject(JsonNode root) {
        JsonNode name = root.get("name");
        return name != null && name.isTextual() ? "document " + name.asText() : "document";
    }

    private static List<String> ids(JsonNode root, String field) {
        List<String> ids = new ArrayList<>();
        JsonNode elements = root.get(field);
        if (elements != null && elements.isArray()) {
            for (JsonNode element : elements) {
                JsonNode id = element.get("SPDXID");
                if (id != null && id.isTextual()) {
                    ids.add(id.asText());
                }
            }
        }
        return ids;
    }
}
