package im.arun.docsync.exception;

public class AuthenticationException extends FatalRemoteException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
