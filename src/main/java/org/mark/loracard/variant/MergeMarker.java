package org.mark.loracard.variant;

/**
 * 	Slot in the merge output: a finished standalone card, or a handle to a group that is finalised at the end.
 */
final class MergeMarker {

	enum Kind {
		STANDALONE,
		GROUP
	}

	private final Kind kind;

	private final CardEntry entry;

	private final int groupHandle;


	private MergeMarker(Kind kind, CardEntry entry, int groupHandle) {
		this.kind = kind;
		this.entry = entry;
		this.groupHandle = groupHandle;
	}

	static MergeMarker standalone(CardEntry entry) {
		return new MergeMarker(Kind.STANDALONE, entry, -1);
	}

	static MergeMarker group(int handle) {
		return new MergeMarker(Kind.GROUP, null, handle);
	}

	Kind getKind() {
		return this.kind;
	}

	CardEntry getEntry() {
		return this.entry;
	}

	int getGroupHandle() {
		return this.groupHandle;
	}
}
