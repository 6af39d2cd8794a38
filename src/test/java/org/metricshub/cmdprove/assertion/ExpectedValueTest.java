package org.metricshub.cmdprove.assertion;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.cmdprove.TestUsageException;
import org.metricshub.cmdprove.compare.ComparisonMode;

public class ExpectedValueTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@Test
	public void testLiteral() {
		ExpectedValue value = new ExpectedValue(Channel.OUT, ComparisonMode.EXACT, ExpectedValue.Source.LITERAL, "foo\n\n");
		assertEquals("foo", value.resolve(false));
		assertEquals("foo\n\n", value.resolve(true));
	}

	@Test
	public void testFile() throws Exception {
		File file = tmp.newFile("expected.out");
		Files.write(file.toPath(), "line 1\nline 2\n".getBytes(StandardCharsets.UTF_8));
		ExpectedValue value = new ExpectedValue(Channel.OUT, ComparisonMode.EXACT, ExpectedValue.Source.FILE, file.getPath());
		assertEquals("line 1\nline 2", value.resolve(false));
		assertEquals("line 1\nline 2\n", value.resolve(true));
	}

	@Test
	public void testMissingFile() {
		String missing = new File(tmp.getRoot(), "missing.err").getPath();
		ExpectedValue value = new ExpectedValue(Channel.ERR, ComparisonMode.EXACT, ExpectedValue.Source.FILE, missing);
		try {
			value.resolve(false);
			fail("An unreadable file is a usage error");
		} catch (TestUsageException e) {
			assertTrue(e.getMessage(), e.getMessage().startsWith("Failed to read masterfile (type stderr) '" + missing + "'"));
		}
	}

	@Test
	public void testDefaults() {
		assertEquals("0", ExpectedValue.defaultFor(Channel.RET, false).resolve(false));
		assertEquals("", ExpectedValue.defaultFor(Channel.OUT, false).resolve(false));
		assertEquals(ComparisonMode.IGNORE, ExpectedValue.defaultFor(Channel.OUT, true).getMode());
	}
}
