package com.williamcallahan.scormingest.domain.manifest;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Normalized view of a package manifest: the course title and its SCOs in document order.
 *
 * @param courseTitle title of the default organization
 * @param scos SCOs in item traversal order; the first one is the package entry point
 */
public record CourseManifest(
        @JsonProperty("course_title") String courseTitle,
        @JsonProperty("scos") List<Sco> scos) {

    public static final String UNTITLED_COURSE = "Untitled Course";

    public CourseManifest {
        courseTitle = courseTitle == null || courseTitle.isBlank() ? UNTITLED_COURSE : courseTitle;
        scos = scos == null ? List.of() : List.copyOf(scos);
    }

    /**
     * Returns the entry-point SCO when the manifest declares any.
     */
    public Optional<Sco> firstSco() {
        return scos.isEmpty() ? Optional.empty() : Optional.of(scos.get(0));
    }
}
