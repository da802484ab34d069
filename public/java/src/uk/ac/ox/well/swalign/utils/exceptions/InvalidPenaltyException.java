package uk.ac.ox.well.swalign.utils.exceptions;

public class InvalidPenaltyException extends SWAlignException {
    public InvalidPenaltyException(String msg) {
        super(msg);
    }
}
