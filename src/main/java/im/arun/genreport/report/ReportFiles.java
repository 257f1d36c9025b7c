package im.arun.genreport.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Output file naming. Reports never overwrite an earlier run.
 */
public final class ReportFiles {

    private ReportFiles() {
    }

    /**
     * {@code <base>.<ext>} in {@code outdir}, or {@code <base>-2.<ext>}, {@code <base>-3.<ext>}, ...
     * when taken. Creates {@code outdir} if needed.
     */
    public static Path uniquePath(Path outdir, ReportType type) throws IOException {
        Files.createDirectories(outdir);
        Path candidate = outdir.resolve(type.getBaseName() + "." + type.getExtension());
        int suffix = 2;
        while (Files.exists(candidate)) {
            candidate = outdir.resolve(type.getBaseName() + "-" + suffix + "." + type.getExtension());
            suffix++;
        }
        return candidate;
    }
}
