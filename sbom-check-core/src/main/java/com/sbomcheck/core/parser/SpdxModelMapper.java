package com.sbomcheck.core.parser;

import com.sbomcheck.core.model.Checksum;
import com.sbomcheck.core.model.CreationInfo;
import com.sbomcheck.core.model.Relationship;
import com.sbomcheck.core.model.RelationshipType;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.model.SpdxFile;
import com.sbomcheck.core.model.SpdxPackage;
import com.sbomcheck.core.model.SpdxValue;
import org.spdx.library.InvalidSPDXAnalysisException;
import org.spdx.library.model.SpdxCreatorInformation;
import org.spdx.library.model.SpdxElement;
import org.spdx.library.model.SpdxModelFactory;
import org.spdx.library.model.SpdxPackageVerificationCode;
import org.spdx.library.model.license.AnyLicenseInfo;
import org.spdx.library.model.license.SpdxNoAssertionLicense;
import org.spdx.library.model.license.SpdxNoneLicense;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Copies the SPDX library's object graph into the immutable document model.
 *
 * <p>The library's in-memory store does not keep element order, so packages and files
 * are sorted back into the order of the serialized document. Relationships are taken
 * from every element, followed by the {@code documentDescribes} and {@code hasFiles}
 * shorthands when they are not already stated explicitly.
 */
final class SpdxModelMapper {

    SpdxDocument toModel(org.spdx.library.model.SpdxDocument source,
                         List<String> packageOrder,
                         List<String> fileOrder) throws InvalidSPDXAnalysisException {
        CreationInfo creationInfo = creationInfo(source);

        List<org.spdx.library.model.SpdxPackage> sourcePackages =
            elements(source, org.spdx.library.model.SpdxPackage.class, packageOrder);
        List<org.spdx.library.model.SpdxFile> sourceFiles =
            elements(source, org.spdx.library.model.SpdxFile.class, fileOrder);

        List<SpdxPackage> packages = new ArrayList<>();
        for (org.spdx.library.model.SpdxPackage sourcePackage : sourcePackages) {
            packages.add(spdxPackage(sourcePackage));
        }
        List<SpdxFile> files = new ArrayList<>();
        for (org.spdx.library.model.SpdxFile sourceFile : sourceFiles) {
            files.add(spdxFile(sourceFile));
        }

        List<Relationship> relationships = new ArrayList<>();
        addRelationships(source, relationships);
        for (org.spdx.library.model.SpdxPackage sourcePackage : sourcePackages) {
            addRelationships(sourcePackage, relationships);
        }
        for (org.spdx.library.model.SpdxFile sourceFile : sourceFiles) {
            addRelationships(sourceFile, relationships);
        }

        for (SpdxElement described : source.getDocumentDescribes()) {
            addIfMissing(relationships,
                new Relationship(source.getId(), RelationshipType.DESCRIBES, described.getId()));
        }
        for (org.spdx.library.model.SpdxPackage sourcePackage : sourcePackages) {
            for (org.spdx.library.model.SpdxFile contained : sourcePackage.getFiles()) {
                addIfMissing(relationships,
                    new Relationship(sourcePackage.getId(), RelationshipType.CONTAINS, contained.getId()));
            }
        }

        return new SpdxDocument(creationInfo, packages, files, relationships);
    }

    private CreationInfo creationInfo(org.spdx.library.model.SpdxDocument source)
            throws InvalidSPDXAnalysisException {
        SpdxCreatorInformation creator = source.getCreationInfo();
        if (creator == null) {
            throw new InvalidSPDXAnalysisException("CreationInfo does not exist.");
        }
        AnyLicenseInfo dataLicense = source.getDataLicense();
        return new CreationInfo(
            nullToEmpty(source.getSpecVersion()),
            source.getId(),
            source.getName().orElse(""),
            source.getDocumentUri(),
            dataLicense == null ? null : dataLicense.toString(),
            new ArrayList<>(creator.getCreators()),
            creator.getCreated(),
            creator.getLicenseListVersion().orElse(null),
            creator.getComment().orElse(null)
        );
    }

    private SpdxPackage spdxPackage(org.spdx.library.model.SpdxPackage source)
            throws InvalidSPDXAnalysisException {
        String verificationCode = null;
        Optional<SpdxPackageVerificationCode> code = source.getPackageVerificationCode();
        if (code.isPresent()) {
            verificationCode = code.get().getValue();
        }
        return new SpdxPackage(
            source.getId(),
            source.getName().orElse(""),
            source.getVersionInfo().orElse(null),
            SpdxValue.parse(source.getSupplier().orElse(null)),
            SpdxValue.parse(source.getDownloadLocation().orElse(null)),
            source.isFilesAnalyzed(),
            license(source.getLicenseConcluded()),
            license(source.getLicenseDeclared()),
            SpdxValue.parse(source.getCopyrightText()),
            verificationCode
        );
    }

    private SpdxFile spdxFile(org.spdx.library.model.SpdxFile source) throws InvalidSPDXAnalysisException {
        List<Checksum> checksums = new ArrayList<>();
        for (org.spdx.library.model.Checksum checksum : source.getChecksums()) {
            checksums.add(new Checksum(checksum.getAlgorithm().name(), checksum.getValue()));
        }
        List<String> licenseInfoInFile = new ArrayList<>();
        for (AnyLicenseInfo licenseInfo : source.getLicenseInfoFromFiles()) {
            licenseInfoInFile.add(licenseInfo.toString());
        }
        return new SpdxFile(
            source.getId(),
            source.getName().orElse(""),
            checksums,
            license(source.getLicenseConcluded()),
            licenseInfoInFile,
            SpdxValue.parse(source.getCopyrightText())
        );
    }

    private void addRelationships(SpdxElement element, List<Relationship> relationships)
            throws InvalidSPDXAnalysisException {
        for (org.spdx.library.model.Relationship relationship : element.getRelationships()) {
            Optional<SpdxElement> related = relationship.getRelatedSpdxElement();
            if (related.isEmpty() || relationship.getRelationshipType() == null) {
                continue;
            }
            RelationshipType type = RelationshipType.fromName(relationship.getRelationshipType().name())
                .orElse(RelationshipType.OTHER);
            addIfMissing(relationships, new Relationship(element.getId(), type, related.get().getId(),
                relationship.getComment().orElse(null)));
        }
    }

    private static <T extends SpdxElement> List<T> elements(org.spdx.library.model.SpdxDocument source,
                                                            Class<T> type,
                                                            List<String> order)
            throws InvalidSPDXAnalysisException {
        List<T> elements = new ArrayList<>();
        try (Stream<?> stream = SpdxModelFactory.getElements(
                source.getModelStore(), source.getDocumentUri(), source.getCopyManager(), type)) {
            stream.map(type::cast).forEach(elements::add);
        }
        elements.sort(Comparator.comparingInt(element -> position(order, element.getId())));
        return elements;
    }

    private static int position(List<String> order, String id) {
        int index = order.indexOf(id);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    private static SpdxValue license(AnyLicenseInfo license) {
        if (license == null) {
            return SpdxValue.absent();
        }
        if (license instanceof SpdxNoAssertionLicense) {
            return SpdxValue.noAssertion();
        }
        if (license instanceof SpdxNoneLicense) {
            return SpdxValue.none();
        }
        return SpdxValue.parse(license.toString());
    }

    private static void addIfMissing(List<Relationship> relationships, Relationship candidate) {
        boolean present = relationships.stream().anyMatch(existing ->
            existing.spdxElementId().equals(candidate.spdxElementId())
                && existing.relationshipType() == candidate.relationshipType()
                && existing.relatedSpdxElementId().equals(candidate.relatedSpdxElementId()));
        if (!present) {
            relationships.add(candidate);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
