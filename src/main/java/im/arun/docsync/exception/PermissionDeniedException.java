package im.arun.docsync.exception;

/**
 * The server refused one request (HTTP 403), e.g. a topic the API user may not see or edit.
 * Fails only the document concerned.
 */
public class PermissionDeniedException extends DiscourseException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
