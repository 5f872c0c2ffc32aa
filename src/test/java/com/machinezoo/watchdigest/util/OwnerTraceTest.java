// Part of Watchdigest
package com.machinezoo.watchdigest.util;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.*;

public class OwnerTraceTest {
	@Test
	public void chain() {
		Object root = new Object();
		Object child = new Object();
		Object grandchild = new Object();
		OwnerTrace.of(root).alias("root").tag("name", "main");
		OwnerTrace.of(child).alias("node").parent(root).tag("depth", 1);
		OwnerTrace.of(grandchild).alias("node").parent(child).tag("depth", 2);
		// Repeated aliases are numbered, tags are namespaced and sorted.
		assertEquals("root.node.node2{node.depth=1, node2.depth=2, root.name=main}", OwnerTrace.of(grandchild).toString());
		assertEquals("root{root.name=main}", OwnerTrace.of(root).toString());
	}
	@Test
	public void defaults() {
		// Untagged object is named after its class.
		assertEquals("Object{}", OwnerTrace.of(new Object()).toString());
	}
	@Test
	public void ignoreNullTags() {
		Object target = new Object();
		OwnerTrace.of(target).alias("x").tag("missing", null).tag("kept", true);
		assertEquals("x{x.kept=true}", OwnerTrace.of(target).toString());
	}
}
