package com.williamcallahan.scormingest.service.manifest;

import com.williamcallahan.scormingest.domain.manifest.CourseManifest;
import com.williamcallahan.scormingest.domain.manifest.ManifestError;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing a package manifest: either a course model or a structured error.
 */
public sealed interface ManifestParseOutcome permits ManifestParseOutcome.Parsed, ManifestParseOutcome.Failed {

    /**
     * Returns the parsed course when parsing succeeded.
     */
    Optional<CourseManifest> manifest();

    /**
     * Returns the failure when parsing did not succeed.
     */
    Optional<ManifestError> error();

    static ManifestParseOutcome parsed(CourseManifest courseManifest) {
        return new Parsed(courseManifest);
    }

    static ManifestParseOutcome failed(ManifestError error) {
        return new Failed(error);
    }

    record Parsed(CourseManifest courseManifest) implements ManifestParseOutcome {
        public Parsed {
            Objects.requireNonNull(courseManifest, "courseManifest");
        }

        @Override
        public Optional<CourseManifest> manifest() {
            return Optional.of(courseManifest);
        }

        @Override
        public Optional<ManifestError> error() {
            return Optional.empty();
        }
    }

    record Failed(ManifestError detail) implements ManifestParseOutcome {
        public Failed {
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public Optional<CourseManifest> manifest() {
            return Optional.empty();
        }

        @Override
        public Optional<ManifestError> error() {
            return Optional.of(detail);
        }
    }
}
