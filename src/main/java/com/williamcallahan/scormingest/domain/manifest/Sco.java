package com.williamcallahan.scormingest.domain.manifest;

import java.util.Objects;

/**
 * A launchable Shareable Content Object resolved from an organization item.
 *
 * @param identifier identifier of the organization item (not of the resource), empty when the item has none
 * @param title item title, falling back to the item identifier
 * @param href launch path relative to the package root; may carry a query string, null when the
 *     resource declares none
 */
public record Sco(String identifier, String title, String href) {

    public Sco {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(title, "title");
    }

    /**
     * Returns true when the resource declared a non-blank launch path.
     */
    public boolean hasHref() {
        return href != null && !href.isBlank();
    }

    /**
     * Returns the href without query string or fragment, suitable for filesystem resolution.
     */
    public String contentPath() {
        if (!hasHref()) {
            return "";
        }
        int cut = href.length();
        int queryStart = href.indexOf('?');
        if (queryStart >= 0) {
            cut = queryStart;
        }
        int fragmentStart = href.indexOf('#');
        if (fragmentStart >= 0 && fragmentStart < cut) {
            cut = fragmentStart;
        }
        return href.substring(0, cut);
    }
}
