package org.metricshub.cmdprove.compare;

import static org.junit.Assert.*;

import org.junit.Test;

public class OutputComparatorTest {

	private static final String[] SAMPLES = { "", "a", "foo\n", "foo\nbar", "  spaced  ", "\n\n", "ünï" };

	@Test
	public void testExactEqualValuesMatch() {
		for (String x : SAMPLES) {
			assertNull("'" + x + "'", OutputComparator.compare(ComparisonMode.EXACT, x, x));
		}
	}

	@Test
	public void testExactDifferentValuesDiffer() {
		for (String x : SAMPLES) {
			for (String y : SAMPLES) {
				if (!x.equals(y)) {
					String diff = OutputComparator.compare(ComparisonMode.EXACT, x, y);
					assertNotNull("'" + x + "' vs '" + y + "'", diff);
					assertFalse(diff.isEmpty());
				}
			}
		}
	}

	@Test
	public void testExactMismatchShowsDiff() {
		String diff = OutputComparator.compare(ComparisonMode.EXACT, "hello", "world");
		assertTrue(diff, diff.contains("-hello"));
		assertTrue(diff, diff.contains("+world"));
		assertTrue(diff, diff.startsWith("--- " + OutputComparator.EXPECTED_LABEL));
	}

	@Test
	public void testTrailingNewlinesTrimmedByDefault() {
		assertNull(OutputComparator.compare(ComparisonMode.EXACT, "foo", "foo\n", false));
		assertNull(OutputComparator.compare(ComparisonMode.EXACT, "foo\n\n", "foo", false));
		assertNotNull(OutputComparator.compare(ComparisonMode.EXACT, "foo", "foo\n", true));
		assertNull(OutputComparator.compare(ComparisonMode.EXACT, "foo\n", "foo\n", true));
	}

	@Test
	public void testPattern() {
		assertNull(OutputComparator.compare(ComparisonMode.PATTERN, "+([0-9])", "12345"));
		String message = OutputComparator.compare(ComparisonMode.PATTERN, "+([0-9])", "12a45");
		assertEquals("Pattern not matched: '+([0-9])'.\nOutput was: '12a45'.", message);
	}

	@Test
	public void testPatternMatchesWholeOutput() {
		assertNotNull(OutputComparator.compare(ComparisonMode.PATTERN, "foo", "foo\nbar"));
		assertNull(OutputComparator.compare(ComparisonMode.PATTERN, "foo*", "foo\nbar"));
	}

	@Test(expected = GlobSyntaxException.class)
	public void testInvalidPattern() {
		OutputComparator.compare(ComparisonMode.PATTERN, "@(oops", "oops");
	}

	@Test
	public void testIgnoreAlwaysMatches() {
		assertNull(OutputComparator.compare(ComparisonMode.IGNORE, "", "unexpected output"));
		assertNull(OutputComparator.compare(ComparisonMode.IGNORE, "x", "y", true));
	}

	@Test
	public void testChomp() {
		assertEquals("a", OutputComparator.chomp("a\n\n"));
		assertEquals("a\nb", OutputComparator.chomp("a\nb"));
		assertEquals("a\n\nb", OutputComparator.chomp("a\n\nb\n"));
		assertEquals("", OutputComparator.chomp("\n"));
		assertEquals("", OutputComparator.chomp(""));
	}
}
