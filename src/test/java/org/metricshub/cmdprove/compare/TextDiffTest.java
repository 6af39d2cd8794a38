package org.metricshub.cmdprove.compare;

import static org.junit.Assert.*;

import org.junit.Test;

public class TextDiffTest {

	@Test
	public void testChangedLine() {
		String diff = TextDiff.unifiedDiff("a\nb\nc", "a\nx\nc", "expected", "actual");
		assertTrue(diff, diff.startsWith("--- expected\n+++ actual\n@@ "));
		assertTrue(diff, diff.contains("\n-b\n+x\n"));
		assertTrue(diff, diff.contains("\n a\n"));
	}

	@Test
	public void testFinalNewlineIsSignificant() {
		String diff = TextDiff.unifiedDiff("foo", "foo\n", "expected", "actual");
		assertFalse(diff.isEmpty());
		assertTrue(diff, diff.endsWith("\n+"));
	}

	@Test
	public void testEqualTexts() {
		assertEquals("", TextDiff.unifiedDiff("same\ntext", "same\ntext", "expected", "actual"));
	}

	@Test
	public void testContextIsLimited() {
		StringBuilder expected = new StringBuilder();
		for (int i = 1; i <= 20; i++) {
			expected.append("line").append(i).append('\n');
		}
		String actual = expected.toString().replace("line10\n", "LINE10\n");
		String diff = TextDiff.unifiedDiff(expected.toString(), actual, "expected", "actual");
		assertTrue(diff, diff.contains("-line10"));
		assertTrue(diff, diff.contains("+LINE10"));
		assertTrue(diff, diff.contains(" line7"));
		assertFalse(diff, diff.contains(" line6\n"));
		assertFalse(diff, diff.contains(" line14"));
	}
}
