package im.arun.genreport.service;

/**
 * The requested root individual does not exist, or the document has no individuals at all.
 */
public class RootResolutionException extends RuntimeException {

    public RootResolutionException(String message) {
        super(message);
    }
}
