package org.metricshub.cmdprove.scripts;

import org.metricshub.cmdprove.TestRegistry;
import org.metricshub.cmdprove.TestScript;

public class CrashingScript implements TestScript {

	@Override
	public void register(TestRegistry registry) {
		registry.add("test_crash", t -> {
			t.assertCommand("leaves an error", "-ei", "--", "sh", "-c", "echo 'last words' >&2");
			throw new Error("simulated crash");
		});
	}
}
