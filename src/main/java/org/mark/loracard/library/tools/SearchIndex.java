package org.mark.loracard.library.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 	In-memory inverted index over a list of names, used by the card filter and for suggestions.
 * 	<p>
 * 	Tokens are case-insensitive. {@link #build(List)} replaces the whole index at once, so readers
 * 	always see either the old or the new index.
 */
public class SearchIndex {
	
	private static final Pattern SEPARATORS = Pattern.compile("[ _\\-.,\\[\\]()]+");
	
	/**
	 * 	token -> ascending item indexes
	 */
	private volatile NavigableMap<String, List<Integer>> index = Collections.emptyNavigableMap();
	
	private volatile boolean ready = false;
	
	
	public SearchIndex() {
		
	}
	
	public void build(List<String> items) {
		if (items == null) {
			throw new IllegalArgumentException("items cannot be null");
		}
		NavigableMap<String, List<Integer>> local = new TreeMap<>();
		for (int i = 0; i < items.size(); i++) {
			for (String token : tokenize(items.get(i))) {
				List<Integer> list = local.computeIfAbsent(token, k -> new ArrayList<>());
				if (list.isEmpty() || list.get(list.size() - 1) != i) {
					list.add(i);
				}
			}
		}
		synchronized (this) {
			this.index = Collections.unmodifiableNavigableMap(local);
			this.ready = true;
		}
	}
	
	public boolean isReady() {
		return this.ready;
	}
	
	/**
	 * 	Items that contain every query token.
	 * @param query
	 * @return ascending item indexes
	 */
	public List<Integer> search(String query) {
		NavigableMap<String, List<Integer>> snapshot = this.index;
		TreeSet<Integer> result = null;
		for (String token : tokenize(query)) {
			List<Integer> list = snapshot.get(token);
			if (list == null) {
				return Collections.emptyList();
			}
			result = intersect(result, list);
		}
		return result == null ? Collections.emptyList() : new ArrayList<>(result);
	}
	
	/**
	 * 	Items that have, for every query token, a token starting with it.
	 * @param query
	 * @return ascending item indexes
	 */
	public List<Integer> searchPrefix(String query) {
		NavigableMap<String, List<Integer>> snapshot = this.index;
		TreeSet<Integer> result = null;
		for (String token : tokenize(query)) {
			List<Integer> matches = new ArrayList<>();
			for (List<Integer> list : prefixRange(snapshot, token).values()) {
				matches.addAll(list);
			}
			if (matches.isEmpty()) {
				return Collections.emptyList();
			}
			result = intersect(result, matches);
		}
		return result == null ? Collections.emptyList() : new ArrayList<>(result);
	}
	
	/**
	 * 	Indexed tokens starting with the prefix, sorted, at most {@code limit} of them.
	 * @param prefix
	 * @param limit
	 * @return
	 */
	public List<String> suggest(String prefix, int limit) {
		if (prefix == null || limit <= 0) {
			return Collections.emptyList();
		}
		String lower = prefix.trim().toLowerCase(Locale.ROOT);
		List<String> out = new ArrayList<>();
		for (String token : prefixRange(this.index, lower).keySet()) {
			if (out.size() >= limit) {
				break;
			}
			out.add(token);
		}
		return out;
	}
	
	static List<String> tokenize(String text) {
		if (text == null || text.isBlank()) {
			return Collections.emptyList();
		}
		List<String> tokens = new ArrayList<>();
		for (String part : SEPARATORS.split(text.trim())) {
			String token = part.trim();
			if (!token.isEmpty()) {
				tokens.add(token.toLowerCase(Locale.ROOT));
			}
		}
		return tokens;
	}
	
	private static SortedMap<String, List<Integer>> prefixRange(NavigableMap<String, List<Integer>> map, String prefix) {
		if (prefix.isEmpty()) {
			return map;
		}
		return map.subMap(prefix, true, prefix + Character.MAX_VALUE, false);
	}
	
	private static TreeSet<Integer> intersect(TreeSet<Integer> current, List<Integer> next) {
		if (current == null) {
			return new TreeSet<>(next);
		}
		current.retainAll(new TreeSet<>(next));
		return current;
	}
}
