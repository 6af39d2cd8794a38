package org.metricshub.cmdprove.capture;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class ChompingOutputStreamTest {

	private static String chomp(String... chunks) throws IOException {
		ByteArrayOutputStream sink = new ByteArrayOutputStream();
		try (ChompingOutputStream out = new ChompingOutputStream(sink)) {
			for (String chunk : chunks) {
				out.write(chunk.getBytes(StandardCharsets.UTF_8));
			}
		}
		return new String(sink.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testTrailingNewlinesDropped() throws IOException {
		assertEquals("foo", chomp("foo\n"));
		assertEquals("foo", chomp("foo\n\n\n"));
		assertEquals("", chomp("\n\n"));
		assertEquals("", chomp());
	}

	@Test
	public void testInnerBlankLinesKept() throws IOException {
		assertEquals("a\n\nb", chomp("a\n\nb\n"));
		assertEquals("\nb", chomp("\nb"));
	}

	@Test
	public void testNewlinesAcrossChunks() throws IOException {
		assertEquals("a\n\nb", chomp("a\n", "\n", "b\n\n"));
		assertEquals("a\nb", chomp("a", "\n", "b"));
	}

	@Test
	public void testSingleBytes() throws IOException {
		ByteArrayOutputStream sink = new ByteArrayOutputStream();
		ChompingOutputStream out = new ChompingOutputStream(sink);
		out.write('x');
		out.write('\n');
		out.write('\n');
		assertEquals(2, out.getPendingNewlines());
		assertEquals("x", sink.toString("UTF-8"));
		out.write('y');
		assertEquals(0, out.getPendingNewlines());
		out.write('\n');
		out.close();
		assertEquals("x\n\ny", sink.toString("UTF-8"));
	}
}
