package com.anthem.acctctl.core.exception;

/**
 * Typed failure raised by the account control plane. Callers branch on
 * {@link #getKind()} rather than on message text.
 */
public class AcctCtlException extends RuntimeException {

    private final ErrorKind kind;

    public AcctCtlException(ErrorKind kind) {
        this(kind, kind.getDefaultMessage());
    }

    public AcctCtlException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AcctCtlException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static AcctCtlException noAccess() {
        return new AcctCtlException(ErrorKind.NO_ACCESS);
    }

    public static AcctCtlException noCtl() {
        return new AcctCtlException(ErrorKind.NO_CTL);
    }

    public static AcctCtlException ctlUpdate() {
        return new AcctCtlException(ErrorKind.CTL_UPDATE);
    }

    public static AcctCtlException unable() {
        return new AcctCtlException(ErrorKind.UNABLE);
    }

    /**
     * Returns true if {@code t} is an {@link AcctCtlException} of the given kind.
     */
    public static boolean is(Throwable t, ErrorKind kind) {
        return t instanceof AcctCtlException && ((AcctCtlException) t).kind == kind;
    }
}
