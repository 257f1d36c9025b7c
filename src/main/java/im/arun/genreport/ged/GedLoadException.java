package im.arun.genreport.ged;

import java.io.IOException;

/**
 * A GEDCOM file could not be read at all. No partial document is produced.
 */
public class GedLoadException extends IOException {

    public GedLoadException(String message) {
        super(message);
    }

    public GedLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
