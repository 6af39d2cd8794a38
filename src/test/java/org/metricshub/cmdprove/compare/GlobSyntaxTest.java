package org.metricshub.cmdprove.compare;

import static org.junit.Assert.*;

import org.junit.Test;

public class GlobSyntaxTest {

	@Test
	public void testUnterminatedGroup() {
		try {
			GlobPattern.compile("abc@(foo|bar");
			fail("An unterminated group must be rejected");
		} catch (GlobSyntaxException e) {
			assertEquals("abc@(foo|bar", e.getPattern());
			assertEquals(3, e.getIndex());
		}
	}

	@Test(expected = GlobSyntaxException.class)
	public void testUnterminatedNestedGroup() {
		GlobPattern.compile("+(a|*(b)");
	}

	@Test
	public void testPlainParenthesesAreLiterals() {
		assertTrue(GlobPattern.matches("f(x)|y", "f(x)|y"));
	}

	@Test
	public void testTrailingBackslash() {
		assertTrue(GlobPattern.matches("a\\", "a\\"));
	}

	@Test
	public void testPatternSource() {
		GlobPattern glob = GlobPattern.compile("test_*");
		assertEquals("test_*", glob.pattern());
		assertEquals("test_*", glob.toString());
	}

	@Test
	public void testLongSubjectDoesNotExplode() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < 500; i++) {
			sb.append('a');
		}
		assertFalse(GlobPattern.matches("*a*a*a*a*a*b", sb.toString()));
		assertTrue(GlobPattern.matches("+(a|aa)", sb.toString()));
	}

	@Test
	public void testLargeOutputWithRepetition() {
		String digits = repeat('7', 50000);
		assertTrue(GlobPattern.matches("+([0-9])", digits));
		assertTrue(GlobPattern.matches("*([0-9])", digits));
		assertFalse(GlobPattern.matches("+([0-9])", digits + "x"));
		assertTrue(GlobPattern.matches("+([0-9]|x)", digits + "x"));
	}

	@Test
	public void testLargeOutputWithStar() {
		String output = repeat('.', 20000);
		assertTrue(GlobPattern.matches("*done", output + "done"));
		assertFalse(GlobPattern.matches("*done", output + "done\n"));
		assertTrue(GlobPattern.matches("*!(fail)", output));
	}

	@Test
	public void testLargeLiteralPattern() {
		String expected = repeat('y', 60000);
		assertTrue(GlobPattern.matches(expected, expected));
		assertFalse(GlobPattern.matches(expected + "?", expected));
	}

	private static String repeat(char c, int count) {
		StringBuilder sb = new StringBuilder(count);
		for (int i = 0; i < count; i++) {
			sb.append(c);
		}
		return sb.toString();
	}
}
