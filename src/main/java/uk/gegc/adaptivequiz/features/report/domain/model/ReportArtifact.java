package uk.gegc.adaptivequiz.features.report.domain.model;

import java.nio.file.Path;

/**
 * A rendered report file.
 *
 * @param filename name of the file inside the reports directory
 * @param location absolute path the file was written to
 */
public record ReportArtifact(String filename, Path location) {
}
