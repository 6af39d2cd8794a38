package org.metricshub.cmdprove.capture;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class DataPumpTest {

	private static byte[] sample() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < 5000; i++) {
			sb.append("line ").append(i).append('\n');
		}
		return sb.toString().getBytes(StandardCharsets.UTF_8);
	}

	@Test
	public void testFanOut() throws Exception {
		byte[] data = sample();
		ByteArrayOutputStream live = new ByteArrayOutputStream();
		ByteArrayOutputStream kept = new ByteArrayOutputStream();
		DataPump pump = DataPump.dump("test", new ByteArrayInputStream(data), live, kept);
		pump.await();
		assertArrayEquals(data, live.toByteArray());
		assertArrayEquals(data, kept.toByteArray());
		assertNull(pump.getError());
	}

	@Test
	public void testDumpAndClose() throws Exception {
		final boolean[] closed = new boolean[1];
		ByteArrayOutputStream sink = new ByteArrayOutputStream() {
			@Override
			public void close() throws IOException {
				closed[0] = true;
				super.close();
			}
		};
		DataPump.dumpAndClose("test", new ByteArrayInputStream("abc".getBytes(StandardCharsets.UTF_8)), sink).await();
		assertTrue(closed[0]);
		assertEquals("abc", sink.toString("UTF-8"));
	}

	@Test
	public void testBrokenSinkDoesNotStopOthers() throws Exception {
		byte[] data = sample();
		OutputStream broken = new OutputStream() {
			@Override
			public void write(int b) throws IOException {
				throw new IOException("Broken pipe");
			}
		};
		ByteArrayOutputStream kept = new ByteArrayOutputStream();
		DataPump pump = DataPump.dump("test", new ByteArrayInputStream(data), broken, kept);
		pump.await();
		assertArrayEquals(data, kept.toByteArray());
		assertNotNull(pump.getError());
		assertEquals("Broken pipe", pump.getError().getMessage());
	}
}
