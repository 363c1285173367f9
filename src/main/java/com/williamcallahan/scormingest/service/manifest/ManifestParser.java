package com.williamcallahan.scormingest.service.manifest;

import com.williamcallahan.scormingest.domain.manifest.CourseManifest;
import com.williamcallahan.scormingest.domain.manifest.ManifestError;
import com.williamcallahan.scormingest.domain.manifest.ManifestErrorCode;
import com.williamcallahan.scormingest.domain.manifest.Sco;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Derives the course title and ordered SCO list from an extracted package's {@code imsmanifest.xml}.
 *
 * <p>Items are gathered depth-first in document order from the default organization, so nested
 * outline entries appear right after their parent. An item becomes a SCO only when its
 * {@code identifierref} names a resource whose scorm type is {@code sco}; navigation-only items
 * and items pointing at assets are dropped.</p>
 */
@Service
public class ManifestParser {
    private static final Logger log = LoggerFactory.getLogger(ManifestParser.class);

    public static final String MANIFEST_FILE_NAME = "imsmanifest.xml";
    static final String UNTITLED_SCO = "Untitled SCO";

    private static final String MANIFEST_TAG = "manifest";
    private static final String ORGANIZATIONS_TAG = "organizations";
    private static final String ORGANIZATION_TAG = "organization";
    private static final String ITEM_TAG = "item";
    private static final String TITLE_TAG = "title";
    private static final String IDENTIFIER_ATTRIBUTE = "identifier";
    private static final String IDENTIFIERREF_ATTRIBUTE = "identifierref";
    private static final String DEFAULT_ATTRIBUTE = "default";

    private final ManifestElementReader elementReader;

    public ManifestParser(ManifestElementReader elementReader) {
        this.elementReader = elementReader;
    }

    /**
     * Parses the manifest found directly under the extracted package directory.
     *
     * @param extractedDir root of the extracted package
     * @return parsed course model or a structured manifest error
     */
    public ManifestParseOutcome parse(Path extractedDir) {
        Objects.requireNonNull(extractedDir, "extractedDir");
        Path manifestPath = extractedDir.resolve(MANIFEST_FILE_NAME);
        if (!Files.isRegularFile(manifestPath)) {
            return failure(ManifestErrorCode.MANIFEST_NOT_FOUND,
                    "Manifest file (" + MANIFEST_FILE_NAME + ") not found in the package");
        }

        ManifestElement root;
        try {
            root = elementReader.read(manifestPath);
        } catch (MalformedManifestException malformedException) {
            return failure(ManifestErrorCode.MALFORMED_XML,
                    "Failed to parse manifest XML: " + malformedException.getMessage());
        } catch (IOException ioException) {
            return failure(ManifestErrorCode.MANIFEST_UNREADABLE,
                    "Could not read manifest: " + ioException.getMessage());
        }

        if (!MANIFEST_TAG.equals(root.tagName())) {
            return failure(ManifestErrorCode.INVALID_MANIFEST_ROOT,
                    "Expected <" + MANIFEST_TAG + "> root element but found <" + root.tagName() + ">");
        }

        CourseManifest courseManifest = toCourseManifest(root);
        log.debug("Parsed manifest '{}' with {} SCO(s)", courseManifest.courseTitle(), courseManifest.scos().size());
        return ManifestParseOutcome.parsed(courseManifest);
    }

    /**
     * Builds the course model from an already parsed manifest root.
     */
    CourseManifest toCourseManifest(ManifestElement manifestRoot) {
        Optional<ManifestElement> organization = selectOrganization(manifestRoot);
        String courseTitle = organization
                .flatMap(org -> org.firstChild(TITLE_TAG))
                .flatMap(ManifestElement::text)
                .orElse(CourseManifest.UNTITLED_COURSE);

        List<ManifestElement> items = organization.map(ManifestParser::collectItems).orElse(List.of());
        ResourceIndex resourceIndex = ResourceIndex.fromManifest(manifestRoot);

        List<Sco> scos = new ArrayList<>();
        for (ManifestElement item : items) {
            toSco(item, resourceIndex).ifPresent(scos::add);
        }
        return new CourseManifest(courseTitle, scos);
    }

    private static Optional<ManifestElement> selectOrganization(ManifestElement manifestRoot) {
        Optional<ManifestElement> organizations = manifestRoot.firstChild(ORGANIZATIONS_TAG);
        if (organizations.isEmpty()) {
            return Optional.empty();
        }
        List<ManifestElement> candidates = organizations.get().children(ORGANIZATION_TAG);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        String defaultIdentifier = organizations.get().attribute(DEFAULT_ATTRIBUTE);
        if (defaultIdentifier != null) {
            for (ManifestElement candidate : candidates) {
                if (defaultIdentifier.equals(candidate.attribute(IDENTIFIER_ATTRIBUTE))) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.of(candidates.get(0));
    }

    /**
     * Flattens the organization's item tree in depth-first document order.
     */
    static List<ManifestElement> collectItems(ManifestElement organization) {
        List<ManifestElement> collected = new ArrayList<>();
        Deque<ManifestElement> pending = new ArrayDeque<>();
        pushChildItems(organization, pending);
        while (!pending.isEmpty()) {
            ManifestElement item = pending.pop();
            collected.add(item);
            pushChildItems(item, pending);
        }
        return collected;
    }

    private static void pushChildItems(ManifestElement parent, Deque<ManifestElement> pending) {
        List<ManifestElement> childItems = parent.children(ITEM_TAG);
        for (int index = childItems.size() - 1; index >= 0; index--) {
            pending.push(childItems.get(index));
        }
    }

    private static Optional<Sco> toSco(ManifestElement item, ResourceIndex resourceIndex) {
        Optional<ResourceIndex.Entry> resource = resourceIndex.find(item.attribute(IDENTIFIERREF_ATTRIBUTE));
        if (resource.isEmpty() || !resource.get().isSco()) {
            return Optional.empty();
        }
        String itemIdentifier = item.attribute(IDENTIFIER_ATTRIBUTE);
        String identifier = itemIdentifier == null ? "" : itemIdentifier;
        String title = item.firstChild(TITLE_TAG)
                .flatMap(ManifestElement::text)
                .orElse(identifier.isBlank() ? UNTITLED_SCO : identifier);
        String href = resource.get().href();
        return Optional.of(new Sco(identifier, title, href == null ? null : href.trim()));
    }

    private static ManifestParseOutcome failure(ManifestErrorCode code, String message) {
        log.info("Manifest parsing failed ({}): {}", code, message);
        return ManifestParseOutcome.failed(new ManifestError(code, message));
    }
}
