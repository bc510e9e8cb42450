package org.metricshub.wordlang.jrt;

import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class WordFileReaderTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path write(String name, String contents) throws Exception {
		Path path = folder.getRoot().toPath().resolve(name);
		Files.write(path, contents.getBytes(StandardCharsets.UTF_8));
		return path;
	}

	@Test
	public void testReadsAndDeduplicatesWords() throws Exception {
		write("f1.txt", "the cat\nthe dog\n");
		write("f2.txt", "dog   bird\n\n");
		WordFileReader reader = new WordFileReader(StandardCharsets.UTF_8, folder.getRoot().toPath());
		assertEquals(
				new TreeSet<String>(Arrays.asList("bird", "cat", "dog", "the")),
				reader.readWords(Arrays.asList("f1.txt", "f2.txt")));
	}

	@Test
	public void testAbsolutePathIgnoresBaseDirectory() throws Exception {
		Path file = write("abs.txt", "alone");
		WordFileReader reader = new WordFileReader(StandardCharsets.UTF_8, folder.newFolder("elsewhere").toPath());
		assertEquals(Collections.singleton("alone"), reader.readWords(Collections.singleton(file.toString())));
	}

	@Test
	public void testUnreadableFilesAreSkipped() throws Exception {
		write("ok.txt", "kept");
		folder.newFolder("adir");
		WordFileReader reader = new WordFileReader(StandardCharsets.UTF_8, folder.getRoot().toPath());
		assertEquals(
				Collections.singleton("kept"),
				reader.readWords(Arrays.asList("missing.txt", "ok.txt", "adir", "bad\u0000name")));
	}

	@Test
	public void testSplitsOnWhitespaceRuns() throws Exception {
		write("w.txt", "  the quick\t\t fox  \n\n \t \ndon't, stop.\r\n");
		WordFileReader reader = new WordFileReader(StandardCharsets.UTF_8, folder.getRoot().toPath());
		assertEquals(
				new TreeSet<String>(Arrays.asList("don't,", "fox", "quick", "stop.", "the")),
				reader.readWords(Collections.singleton("w.txt")));
	}

	@Test
	public void testMalformedBytesDoNotDropTheFile() throws Exception {
		Path file = folder.getRoot().toPath().resolve("latin1.txt");
		Files.write(file, "alpha café\nbeta gamma\n".getBytes(StandardCharsets.ISO_8859_1));
		WordFileReader reader = new WordFileReader(StandardCharsets.UTF_8, folder.getRoot().toPath());
		SortedSet<String> words = reader.readWords(Collections.singleton("latin1.txt"));
		assertEquals(4, words.size());
		assertTrue(words.containsAll(Arrays.asList("alpha", "beta", "gamma")));
		assertTrue("the malformed byte is replaced", words.contains("caf\uFFFD"));
	}

	@Test
	public void testCharset() throws Exception {
		Path file = folder.getRoot().toPath().resolve("latin1.txt");
		Files.write(file, "café".getBytes(StandardCharsets.ISO_8859_1));
		WordFileReader reader = new WordFileReader(StandardCharsets.ISO_8859_1, folder.getRoot().toPath());
		assertEquals(Collections.singleton("café"), reader.readWords(Collections.singleton("latin1.txt")));
	}

	@Test
	public void testNoFiles() {
		WordFileReader reader = new WordFileReader(StandardCharsets.UTF_8, null);
		assertTrue(reader.readWords(Collections.<String>emptySet()).isEmpty());
	}
}
