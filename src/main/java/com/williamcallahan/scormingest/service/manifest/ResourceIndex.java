package com.williamcallahan.scormingest.service.manifest;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of manifest resources by identifier, built once per parse from {@code <resources>}.
 *
 * <p>The scorm type is accepted as {@code adlcp:scormType}, under any other prefix, or
 * unprefixed, and the attribute name is matched case-insensitively so SCORM 1.2's
 * {@code adlcp:scormtype} also resolves. The content packaging schema only defines the
 * prefixed form; the other spellings come from real-world packages.</p>
 */
final class ResourceIndex {

    private static final String RESOURCES_TAG = "resources";
    private static final String RESOURCE_TAG = "resource";
    private static final String IDENTIFIER_ATTRIBUTE = "identifier";
    private static final String HREF_ATTRIBUTE = "href";
    private static final String PREFERRED_SCORM_TYPE_ATTRIBUTE = "adlcp:scormType";
    private static final String SCORM_TYPE_LOCAL_NAME = "scormtype";
    private static final String SCO_TYPE = "sco";

    private final Map<String, Entry> entriesByIdentifier;

    private ResourceIndex(Map<String, Entry> entriesByIdentifier) {
        this.entriesByIdentifier = entriesByIdentifier;
    }

    /**
     * Indexes every {@code resources/resource} under the manifest root. Resources without an
     * identifier are skipped; the first resource wins when identifiers repeat.
     */
    static ResourceIndex fromManifest(ManifestElement manifestRoot) {
        Map<String, Entry> entries = new HashMap<>();
        for (ManifestElement resources : manifestRoot.children(RESOURCES_TAG)) {
            for (ManifestElement resource : resources.children(RESOURCE_TAG)) {
                String identifier = resource.attribute(IDENTIFIER_ATTRIBUTE);
                if (identifier == null || identifier.isBlank()) {
                    continue;
                }
                entries.putIfAbsent(identifier, new Entry(resource.attribute(HREF_ATTRIBUTE), scormTypeOf(resource)));
            }
        }
        return new ResourceIndex(entries);
    }

    Optional<Entry> find(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entriesByIdentifier.get(identifier));
    }

    private static String scormTypeOf(ManifestElement resource) {
        String preferred = resource.attribute(PREFERRED_SCORM_TYPE_ATTRIBUTE);
        if (preferred != null) {
            return preferred;
        }
        String unprefixed = null;
        for (Map.Entry<String, String> attribute : resource.attributes().entrySet()) {
            String name = attribute.getKey().toLowerCase(Locale.ROOT);
            if (name.endsWith(":" + SCORM_TYPE_LOCAL_NAME)) {
                return attribute.getValue();
            }
            if (name.equals(SCORM_TYPE_LOCAL_NAME) && unprefixed == null) {
                unprefixed = attribute.getValue();
            }
        }
        return unprefixed;
    }

    /**
     * Resource attributes needed to derive SCOs.
     *
     * @param href launch path, may be null for resources that only list files
     * @param scormType declared scorm type, null when the resource declares none
     */
    record Entry(String href, String scormType) {

        boolean isSco() {
            return scormType != null && SCO_TYPE.equalsIgnoreCase(scormType.trim());
        }
    }
}
