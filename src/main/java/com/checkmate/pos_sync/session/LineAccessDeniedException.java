package com.checkmate.pos_sync.session;

/**
 * The session has no ability covering the requested line.
 */
public class LineAccessDeniedException extends RuntimeException {

    public static final String MESSAGE = "Not permitted for this line";

    private final String lineCode;

    public LineAccessDeniedException(String lineCode) {
        super(MESSAGE);
        this.lineCode = lineCode;
    }

    /**
     * For logs only. Never sent to the station.
     */
    public String getLineCode() {
        return lineCode;
    }
}
