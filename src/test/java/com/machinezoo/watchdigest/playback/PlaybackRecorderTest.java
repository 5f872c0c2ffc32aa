// Part of Watchdigest
package com.machinezoo.watchdigest.playback;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class PlaybackRecorderTest {
	private final PlaybackRecorder recorder = new PlaybackRecorder();
	private static final String HEADER = String.join("\n",
		"library angular.core.service.playback_data;",
		"",
		"import \"dart:json\" as json;",
		"",
		"// Auto-generated by record-playback",
		"",
		"Map<String, String> playbackData = {");
	private static List<String> lines(String document) {
		return Arrays.asList(document.split("\n", -1));
	}
	@Test
	public void empty() {
		assertEquals(HEADER + "\n};", recorder.generate());
		assertEquals(0, recorder.size());
	}
	@Test
	public void firstRecordWins() {
		assertTrue(recorder.record("/a", "first"));
		assertFalse(recorder.record("/a", "second"));
		assertEquals("first", recorder.get("/a"));
		assertEquals(1, recorder.size());
	}
	@Test
	public void format() {
		recorder.record("/a", "{\"x\":1}");
		List<String> lines = lines(recorder.generate());
		assertEquals(9, lines.size());
		assertEquals("  \"/a\": json.parse(\"{\\\"x\\\":1}\"),", lines.get(7));
		assertEquals("};", lines.get(8));
	}
	@Test
	public void order() {
		recorder.record("/z", "1");
		recorder.record("/a", "2");
		recorder.record("/z", "3");
		recorder.record("/m", "4");
		assertThat(recorder.keys(), contains("/z", "/a", "/m"));
		List<String> lines = lines(recorder.generate());
		assertThat(lines.subList(7, 10), contains(
			"  \"/z\": json.parse(\"1\"),",
			"  \"/a\": json.parse(\"2\"),",
			"  \"/m\": json.parse(\"4\"),"));
	}
	@Test
	public void escapeInterpolation() {
		recorder.record("/$key", "price: $5");
		assertThat(recorder.generate(), containsString("  \"/\\$key\": json.parse(\"price: \\$5\"),"));
		assertEquals("\\$\\$", PlaybackRecorder.escape("$$"));
	}
	@Test
	public void structuredData() {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("id", 7);
		data.put("tags", Arrays.asList("a", "b"));
		recorder.record("/items/7", data);
		assertThat(recorder.generate(), containsString("  \"/items/7\": json.parse({\"id\":7,\"tags\":[\"a\",\"b\"]}),"));
	}
	@Test
	public void nullData() {
		recorder.record("/none", null);
		assertThat(recorder.generate(), containsString("  \"/none\": json.parse(null),"));
	}
	@Test
	public void rejectNullKey() {
		assertThrows(NullPointerException.class, () -> recorder.record(null, "data"));
	}
}
