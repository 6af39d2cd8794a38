package org.metricshub.cmdprove.scripts;

import org.metricshub.cmdprove.TestRegistry;
import org.metricshub.cmdprove.TestScript;

public class FailingScript implements TestScript {

	@Override
	public void register(TestRegistry registry) {
		registry.add("test_pass", t -> t.assertCommand("passes", "--", "true"));

		registry.add("test_fail", t -> t.assertCommand("complains on stderr", "--", "sh", "-c", "echo 'disk is full' >&2"));

		registry.add("test_throws", t -> {
			throw new IllegalStateException("broken fixture");
		});
	}
}
