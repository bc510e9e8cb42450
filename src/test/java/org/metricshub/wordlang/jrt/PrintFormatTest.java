package org.metricshub.wordlang.jrt;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class PrintFormatTest {

	@Test
	public void testLegacyFormat() {
		assertEquals("[,cat,dog ]", PrintFormat.LEGACY.format(Arrays.asList("cat", "dog")));
		assertEquals("[,z ]", PrintFormat.LEGACY.format(Collections.singleton("z")));
		assertEquals("[ ]", PrintFormat.LEGACY.format(Collections.<String>emptyList()));
	}

	@Test
	public void testCompactFormat() {
		assertEquals("[cat,dog]", PrintFormat.COMPACT.format(Arrays.asList("cat", "dog")));
		assertEquals("[]", PrintFormat.COMPACT.format(Collections.<String>emptyList()));
	}

	@Test
	public void testWordsArePrintedAsIs() {
		assertEquals("[a b,c\\d]", PrintFormat.COMPACT.format(Arrays.asList("a b", "c\\d")));
	}
}
