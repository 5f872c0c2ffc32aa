// Part of Watchdigest
package com.machinezoo.watchdigest.playback;

import java.util.*;
import com.fasterxml.jackson.core.*;
import com.fasterxml.jackson.databind.*;
import com.machinezoo.stagean.*;

/*
 * Collects request/response pairs observed in a live session and renders them as a Dart library
 * that the playback service loads to replay the session offline.
 *
 * Keys and data are rendered as JSON string literals, which are also valid Dart string literals
 * except for '$', which starts interpolation in Dart. Every '$' is therefore escaped.
 */
/**
 * Records key/data pairs and generates playback data document from them.
 * First recorded data for every key wins.
 */
@StubDocs
@DraftApi("configurable template")
public class PlaybackRecorder {
	private static final List<String> HEADER = Arrays.asList(
		"library angular.core.service.playback_data;",
		"",
		"import \"dart:json\" as json;",
		"",
		"// Auto-generated by record-playback",
		"",
		"Map<String, String> playbackData = {");
	private static final String FOOTER = "};";
	private final ObjectMapper mapper;
	private final Map<String, Object> records = new LinkedHashMap<>();
	public PlaybackRecorder() {
		this(new ObjectMapper());
	}
	public PlaybackRecorder(ObjectMapper mapper) {
		Objects.requireNonNull(mapper);
		this.mapper = mapper;
	}
	/**
	 * Records data under the key unless the key was already recorded.
	 *
	 * @param key
	 *            identifier of the recorded interaction, usually request URL
	 * @param data
	 *            recorded data, usually response body
	 * @return {@code true} if the pair was stored, {@code false} if the key was seen before
	 */
	public boolean record(String key, Object data) {
		Objects.requireNonNull(key);
		if (records.containsKey(key))
			return false;
		records.put(key, data);
		return true;
	}
	public int size() {
		return records.size();
	}
	/**
	 * @return recorded keys in first-seen order
	 */
	public Set<String> keys() {
		return Collections.unmodifiableSet(records.keySet());
	}
	public Object get(String key) {
		return records.get(key);
	}
	/**
	 * Renders recorded pairs in first-seen order.
	 *
	 * @return complete playback data document with lines separated by {@code '\n'}
	 * @throws IllegalArgumentException
	 *             if some recorded data cannot be serialized
	 */
	public String generate() {
		List<String> lines = new ArrayList<>(HEADER);
		for (Map.Entry<String, Object> entry : records.entrySet())
			lines.add("  " + literal(entry.getKey()) + ": json.parse(" + literal(entry.getValue()) + "),");
		lines.add(FOOTER);
		return String.join("\n", lines);
	}
	private String literal(Object value) {
		try {
			return escape(mapper.writeValueAsString(value));
		} catch (JsonProcessingException ex) {
			throw new IllegalArgumentException("Cannot serialize recorded value: " + value, ex);
		}
	}
	static String escape(String literal) {
		return literal.replace("$", "\\$");
	}
	@Override
	public String toString() {
		return "PlaybackRecorder: " + records.keySet();
	}
}
