package com.sbomcheck.core.model;

import java.util.Objects;

/**
 * A typed relationship between two SPDX elements.
 *
 * @param spdxElementId source element ID
 * @param relationshipType relationship type
 * @param relatedSpdxElementId target element ID (may be {@code NOASSERTION} or {@code NONE})
 * @param comment optional comment
 */
public record Relationship(
    String spdxElementId,
    RelationshipType relationshipType,
    String relatedSpdxElementId,
    String comment
) {
    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(spdxElementId, "spdxElementId must not be null");
        Objects.requireNonNull(relationshipType, "relationshipType must not be null");
        Objects.requireNonNull(relatedSpdxElementId, "relatedSpdxElementId must not be null");
    }

    public Relationship(String spdxElementId, RelationshipType relationshipType, String relatedSpdxElementId) {
        this(spdxElementId, relationshipType, relatedSpdxElementId, null);
    }

    /**
     * Returns true if this relationship has the given type and source.
     *
     * @param type relationship type
     * @param sourceId source element ID
     * @return true on match
     */
    public boolean is(RelationshipType type, String sourceId) {
        return relationshipType == type && spdxElementId.equals(sourceId);
    }
}
