package im.arun.genreport.service;

import java.nio.file.Path;

/**
 * Where a report was written and how many individuals it holds.
 */
public record ExportResult(Path path, int count) {
}
