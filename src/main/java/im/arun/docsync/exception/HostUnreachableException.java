package im.arun.docsync.exception;

public class HostUnreachableException extends FatalRemoteException {

    public HostUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
