package com.example.namingexif.domain.exception;

/**
 * Raised when a caller asks for details about a filename that does not follow the
 * {@code YYYY.MM.DD.HH.NN.SS.X.GGG.SSS.NNNNNN.ext} grammar.
 */
public class UnparseableFilenameException extends DomainException {

    private final String filename;

	/**
	 * Creates the exception and records the rejected name as part of the message.
	 *
	 * @param filename name that failed the grammar
	 */
    public UnparseableFilenameException(String filename) {
        super("Filename does not match YYYY.MM.DD.HH.NN.SS.X.GGG.SSS.NNNNNN.ext: " + filename);
        this.filename = filename;
    }

    /**
     * @return the rejected filename
     */
    public String getFilename() {
        return filename;
    }
}
