package org.metricshub.cmdprove.util;

import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.cmdprove.assertion.Channel;

public class ProveSettingsTest {

	@Test
	public void testDefaults() {
		ProveSettings settings = ProveSettings.fromEnvironment(Collections.<String, String>emptyMap());
		assertFalse(settings.isDebug());
		assertNull(settings.getOutputDirectory());
		assertEquals("test", settings.getTestName());
		assertEquals("test_*", settings.getFunctionPattern());
		assertTrue(settings.getIncludedFunctions().isEmpty());
		for (Channel channel : Channel.values()) {
			assertFalse(settings.isIgnoredByDefault(channel));
		}
	}

	@Test
	public void testFromEnvironment() {
		Map<String, String> env = new HashMap<String, String>();
		env.put("TEST_DEBUG", "1");
		env.put("TEST_OUT_DIR", "/var/tmp/out");
		env.put("TEST_NAME", "smoke");
		env.put("TEST_FUNC_PATTERN", "check_*");
		env.put("TEST_IGNORE_ERR", "yes");
		env.put("TEST_IGNORE_OUT", "0");
		env.put("TEST_INCLUDE_SUBTESTS", " check_a  check_b ");
		env.put("TEST_SOURCE_PATH", "my.Script");

		ProveSettings settings = ProveSettings.fromEnvironment(env);
		assertTrue(settings.isDebug());
		assertEquals(Paths.get("/var/tmp/out"), settings.getOutputDirectory());
		assertEquals("smoke", settings.getTestName());
		assertEquals("check_*", settings.getFunctionPattern());
		assertTrue(settings.isIgnoredByDefault(Channel.ERR));
		assertFalse(settings.isIgnoredByDefault(Channel.OUT));
		assertEquals(Arrays.asList("check_a", "check_b"), settings.getIncludedFunctions());
		assertEquals("my.Script", settings.getSourcePath());
	}

	@Test
	public void testEnvironmentRoundTrip() {
		ProveSettings settings = new ProveSettings();
		settings.setDebug(true);
		settings.setOutputDirectory(Paths.get("/tmp/x"));
		settings.setTestName("run");
		settings.ignoreByDefault(Channel.RET);
		settings.addIncludedFunction("test_a");
		settings.addIncludedFunction("test_b");
		settings.addIncludedFunction("test_a");

		Map<String, String> env = settings.toEnvironment();
		assertEquals("test_a test_b", env.get("TEST_INCLUDE_SUBTESTS"));
		assertEquals("1", env.get("TEST_IGNORE_RET"));
		assertFalse(env.containsKey("TEST_IGNORE_OUT"));
		assertFalse(env.containsKey("TEST_SOURCE_PATH"));

		ProveSettings copy = ProveSettings.fromEnvironment(env);
		assertEquals(settings.toDescriptionString(), copy.toDescriptionString());
	}

	@Test
	public void testCopyIsIndependent() {
		ProveSettings settings = new ProveSettings();
		settings.addIncludedFunction("test_a");
		ProveSettings copy = settings.copy();
		copy.clearIncludedFunctions();
		copy.ignoreByDefault(Channel.OUT);
		assertEquals(Collections.singletonList("test_a"), settings.getIncludedFunctions());
		assertFalse(settings.isIgnoredByDefault(Channel.OUT));
	}

	@Test
	public void testInvalidValues() {
		ProveSettings settings = new ProveSettings();
		for (String name : new String[] { "", "a/b", "a\\b" }) {
			try {
				settings.setTestName(name);
				fail("'" + name + "' must be rejected");
			} catch (IllegalArgumentException e) {
				assertEquals("test", settings.getTestName());
			}
		}
		try {
			settings.setFunctionPattern("");
			fail("An empty pattern must be rejected");
		} catch (IllegalArgumentException e) {
			assertEquals("test_*", settings.getFunctionPattern());
		}
	}
}
