package org.metricshub.cmdprove.driver;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class JvmScriptLauncherTest {

	@Test
	public void testCommand() {
		JvmScriptLauncher launcher = new JvmScriptLauncher("/opt/jdk/bin/java", "a.jar:b.jar", Arrays.asList("-Xmx64m"));
		assertEquals(
				Arrays.asList("/opt/jdk/bin/java", "-Xmx64m", "-cp", "a.jar:b.jar", ScriptMain.class.getName(), "my.Script"),
				launcher.buildCommand("my.Script"));
	}

	@Test
	public void testDefaultsToCurrentJvm() {
		List<String> command = new JvmScriptLauncher().buildCommand("my.Script");
		assertTrue(command.get(0).startsWith(System.getProperty("java.home")));
		assertEquals(System.getProperty("java.class.path"), command.get(2));
		assertEquals("my.Script", command.get(command.size() - 1));
	}
}
