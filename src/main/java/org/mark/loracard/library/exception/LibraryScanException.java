package org.mark.loracard.library.exception;




/**
 * 	A model folder could not be scanned.
 */
public class LibraryScanException extends Exception {

	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
	
	
	public LibraryScanException(String message) {
		super(message);
	}
	
	public LibraryScanException(String message, Throwable cause) {
		super(message, cause);
	}
}
