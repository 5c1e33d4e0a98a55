package com.amannm.pdftk.range;

import com.amannm.pdftk.PdftkException;

/**
 * Raised when the page part of a range token is neither a number nor one of
 * {@code end}, {@code rend} or {@code r<N>}.
 */
public class InvalidPageTokenException extends PdftkException {

    private final String reference;

    public InvalidPageTokenException(String reference) {
        super("Invalid page reference '" + reference + "'");
        this.reference = reference;
    }

    private InvalidPageTokenException(String token, InvalidPageTokenException cause) {
        super("Invalid page reference '" + cause.reference + "' in range '" + token + "'", cause);
        this.reference = cause.reference;
    }

    /**
     * Returns a copy of this exception whose message also names the full range token.
     */
    public InvalidPageTokenException inToken(String token) {
        return new InvalidPageTokenException(token, this);
    }
}
