package uk.ac.ox.well.swalign.utils.exceptions;

/**
 * Thrown when a similarity table is malformed or lacks an entry for a symbol pair that has to be scored.
 */
public class ScoringConfigurationException extends SWAlignException {
    public ScoringConfigurationException(String msg) {
        super(msg);
    }

    public ScoringConfigurationException(String msg, Throwable e) {
        super(msg, e);
    }
}
