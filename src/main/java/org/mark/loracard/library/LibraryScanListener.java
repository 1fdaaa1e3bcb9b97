package org.mark.loracard.library;

import java.util.List;

import org.mark.loracard.variant.CardEntry;

/**
 * 	Receives the outcome of {@link LoraLibraryManager#rescanAsync(LibraryScanListener)}.
 * 	Called on the scan thread.
 */
public interface LibraryScanListener {
	
	/**
	 * 	The scan finished and the card list has been replaced.
	 * @param cards the new card list
	 */
	void onScanCompleted(List<CardEntry> cards);
	
	/**
	 * 	The scan failed; the previous card list is kept.
	 * @param error
	 */
	void onScanFailed(Exception error);
}
