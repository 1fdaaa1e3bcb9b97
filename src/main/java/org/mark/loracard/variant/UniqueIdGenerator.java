package org.mark.loracard.variant;

import java.util.UUID;

/**
 * 	Source of keys for models that carry no usable identity at all.
 */
public interface UniqueIdGenerator {

	/**
	 * 	Every call must return a non-empty value that was never returned before.
	 * @return
	 */
	String nextId();

	/**
	 * 	Random 128-bit UUID as 32 lowercase hex characters.
	 * @return
	 */
	static UniqueIdGenerator randomUuid() {
		return () -> UUID.randomUUID().toString().replace("-", "");
	}
}
