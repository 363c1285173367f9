package com.williamcallahan.scormingest.service.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only XML element node used while interpreting {@code imsmanifest.xml}.
 *
 * <p>Attributes live on the node keyed by their qualified name ({@code adlcp:scormType} when the
 * attribute carries a prefix). Children are grouped by local tag name; a group keeps every
 * occurrence of the tag in document order, and groups keep the order in which their tag first
 * appeared.</p>
 */
public final class ManifestElement {

    private final String tagName;
    private final Map<String, String> attributes;
    private final Map<String, List<ManifestElement>> children;
    private final String text;

    private ManifestElement(Builder builder) {
        this.tagName = builder.tagName;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        Map<String, List<ManifestElement>> frozenChildren = new LinkedHashMap<>();
        builder.children.forEach((name, group) -> frozenChildren.put(name, List.copyOf(group)));
        this.children = Collections.unmodifiableMap(frozenChildren);
        String collectedText = builder.text.toString().trim();
        this.text = collectedText.isEmpty() ? null : collectedText;
    }

    /**
     * Starts a builder for an element with the given local tag name.
     *
     * @param tagName local tag name without namespace prefix
     * @return element builder
     */
    public static Builder builder(String tagName) {
        return new Builder(tagName);
    }

    public String tagName() {
        return tagName;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    /**
     * Returns the attribute value for the qualified name, or null when absent.
     */
    public String attribute(String qualifiedName) {
        return attributes.get(qualifiedName);
    }

    /**
     * Returns the child groups keyed by tag name.
     */
    public Map<String, List<ManifestElement>> children() {
        return children;
    }

    /**
     * Returns every child with the given tag name in document order, or an empty list.
     */
    public List<ManifestElement> children(String childTagName) {
        return children.getOrDefault(childTagName, List.of());
    }

    /**
     * Returns the first child with the given tag name.
     */
    public Optional<ManifestElement> firstChild(String childTagName) {
        List<ManifestElement> group = children(childTagName);
        return group.isEmpty() ? Optional.empty() : Optional.of(group.get(0));
    }

    /**
     * Returns the trimmed text content directly under this element, when not blank.
     */
    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ManifestElement element)) {
            return false;
        }
        return tagName.equals(element.tagName)
                && attributes.equals(element.attributes)
                && children.equals(element.children)
                && Objects.equals(text, element.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tagName, attributes, children, text);
    }

    @Override
    public String toString() {
        return "ManifestElement{" + tagName + ", attributes=" + attributes + ", childGroups=" + children.keySet() + "}";
    }

    /**
     * Mutable accumulator used by the reader while an element is still open.
     */
    public static final class Builder {
        private final String tagName;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final Map<String, List<ManifestElement>> children = new LinkedHashMap<>();
        private final StringBuilder text = new StringBuilder();

        private Builder(String tagName) {
            if (tagName == null || tagName.isBlank()) {
                throw new IllegalArgumentException("Element tag name is required");
            }
            this.tagName = tagName;
        }

        public Builder attribute(String qualifiedName, String value) {
            attributes.put(Objects.requireNonNull(qualifiedName, "qualifiedName"), value == null ? "" : value);
            return this;
        }

        public Builder child(ManifestElement child) {
            Objects.requireNonNull(child, "child");
            children.computeIfAbsent(child.tagName(), name -> new ArrayList<>()).add(child);
            return this;
        }

        public Builder appendText(String fragment) {
            if (fragment != null) {
                text.append(fragment);
            }
            return this;
        }

        public ManifestElement build() {
            return new ManifestElement(this);
        }
    }
}
