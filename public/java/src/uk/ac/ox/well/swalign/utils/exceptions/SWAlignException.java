package uk.ac.ox.well.swalign.utils.exceptions;

public class SWAlignException extends RuntimeException {
    public SWAlignException(final String message) {
        super(message);
    }

    public SWAlignException(final String message, final Throwable throwable) {
        super(message, throwable);
    }
}
