package org.metricshub.wordlang;

import static org.junit.Assert.*;
import static org.metricshub.wordlang.WordLangTestSupport.wordLangTest;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.Test;
import org.metricshub.wordlang.frontend.ast.ParserException;
import org.metricshub.wordlang.frontend.ast.Program;
import org.metricshub.wordlang.frontend.ast.StatementBlockAst;
import org.metricshub.wordlang.jrt.PrintFormat;
import org.metricshub.wordlang.util.ScriptSource;
import org.metricshub.wordlang.util.WordLangSettings;

public class WordLangTest {

	private static ScriptSource scriptResource(String resource) throws Exception {
		InputStream stream = WordLangTest.class.getResourceAsStream(resource);
		assertNotNull("Resource not found: " + resource, stream);
		return new ScriptSource(resource, new InputStreamReader(stream, StandardCharsets.UTF_8));
	}

	@Test
	public void testUnionIsPrintedInLegacyFormat() throws Exception {
		wordLangTest("union of literals")
				.script("List a = \"cat\" + \"dog\"; print(a);")
				.expectLines("[,cat,dog ]")
				.runAndAssert();
	}

	@Test
	public void testFilter() throws Exception {
		wordLangTest("filter keeps words containing a filter")
				.script("List a = \"apple\" + \"banana\"; List b = a | filter(\"an\"); print(b);")
				.expectLines("[,banana ]")
				.runAndAssert();
	}

	@Test
	public void testLoad() throws Exception {
		wordLangTest("load reads the union of the words of the files")
				.file("f1.txt", "the cat\nsat on the mat\n")
				.file("f2.txt", "the dog\n")
				.script("List a = load(\"f1.txt\" + \"f2.txt\"); print(a);")
				.expectLines("[,cat,dog,mat,on,sat,the ]")
				.runAndAssert();
	}

	@Test
	public void testLoadSkipsUnreadableFiles() throws Exception {
		wordLangTest("load skips missing files")
				.file("f1.txt", "kept")
				.script("print(load(\"f1.txt\" + \"missing.txt\"), load(\"missing.txt\"));")
				.expectLines("[,kept ]", "[ ]")
				.runAndAssert();
	}

	@Test
	public void testLoadWithAbsolutePath() throws Exception {
		wordLangTest("load accepts absolute paths")
				.file("sub/words.txt", "deep")
				.script("print(load(\"{{sub/words.txt}}\"));")
				.expectLines("[,deep ]")
				.runAndAssert();
	}

	@Test
	public void testFileNamesCanBeComputed() throws Exception {
		wordLangTest("file names are a word set like any other")
				.file("a.txt", "alpha")
				.file("b.txt", "beta")
				.script("List names = \"a.txt\" + \"b.txt\" + \"c.txt\";\nprint(load(names | filter_out(\"b\")));")
				.expectLines("[,alpha ]")
				.runAndAssert();
	}

	@Test
	public void testChainedAssignmentPrintsOnce() throws Exception {
		wordLangTest("chained assignment")
				.script("List a; List b; print(a = b = \"z\");\nprint(a, b);")
				.expectLines("[,z ]", "[,z ]", "[,z ]")
				.runAndAssert();
	}

	@Test
	public void testShadowing() throws Exception {
		wordLangTest("inner declaration shadows the outer one until the block closes")
				.script("List a = \"outer\";\n{\n  List a = \"inner\";\n  print(a);\n  {\n    a = a + \"more\";\n    print(a);\n  }\n}\nprint(a);")
				.expectLines("[,inner ]", "[,inner,more ]", "[,outer ]")
				.runAndAssert();
	}

	@Test
	public void testOuterVariableAssignedInBlock() throws Exception {
		wordLangTest("assignment in a block reaches the outer variable")
				.script("List a;\n{\n  a = \"set\";\n}\nprint(a);")
				.expectLines("[,set ]")
				.runAndAssert();
	}

	@Test
	public void testUninitializedVariableIsEmpty() throws Exception {
		wordLangTest("declared variables start empty")
				.script("List a; print(a);")
				.expectLines("[ ]")
				.runAndAssert();
	}

	@Test
	public void testRedeclarationFails() throws Exception {
		wordLangTest("redeclaration in the same block")
				.script("List a;\nprint(a);\nList a;")
				.expectThrow(ParserException.class, 3)
				.expectMessage("Redeclaration of variable 'a' (first declared on line 1).")
				.runAndAssert();
	}

	@Test
	public void testSyntaxErrorPrintsNothing() throws Exception {
		wordLangTest("syntax error after a print")
				.script("List a = \"cat\";\nprint(a);\nList x = ;")
				.expectThrow(ParserException.class, 3)
				.expectMessage("Expected expression. Found ';'.")
				.runAndAssert();
	}

	@Test
	public void testCompactFormat() throws Exception {
		wordLangTest("compact print format")
				.compact()
				.script("print(\"cat\" + \"dog\", \"x\" - \"x\");")
				.expectLines("[cat,dog]", "[]")
				.runAndAssert();
	}

	@Test
	public void testEscapesAreKeptVerbatim() throws Exception {
		wordLangTest("escapes are verbatim by default")
				.script("print(\"a\\\"b\");")
				.expectLines("[,a\\\"b ]")
				.runAndAssert();
	}

	@Test
	public void testEscapeDecoding() throws Exception {
		wordLangTest("escape decoding")
				.decodeEscapes()
				.compact()
				.script("print(\"a\\\"b\" + \"x\\ty\");")
				.expectLines("[a\"b,x\ty]")
				.runAndAssert();
	}

	@Test
	public void testScriptFixture() throws Exception {
		Path words = Paths.get(WordLangTest.class.getResource("/words/f1.txt").toURI()).getParent();
		WordLangSettings settings = new WordLangSettings();
		settings.setBaseDirectory(words);
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		settings.setOutputStream(new PrintStream(bytes, true, StandardCharsets.UTF_8.name()));
		new WordLang().invoke(scriptResource("/scripts/animals.wl"), settings);
		assertEquals(
				"[,cat,dog,log,mat,on,sat,the ]\n"
						+ "[,cat,dog,mat,sat ]\n"
						+ "[,on,the ]\n"
						+ "[,shadow ]\n"
						+ "[,on,the ]\n",
				bytes.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n"));
	}

	@Test
	public void testRun() throws Exception {
		WordLang wordLang = new WordLang();
		assertEquals("[,a,b ]\n", wordLang.run("print(\"b\" + \"a\");").replace("\r\n", "\n"));
		WordLangSettings settings = new WordLangSettings();
		settings.setPrintFormat(PrintFormat.COMPACT);
		PrintStream original = settings.getOutputStream();
		assertEquals("[a]\n", wordLang.run("print(\"a\");", settings).replace("\r\n", "\n"));
		assertSame("run leaves the settings untouched", original, settings.getOutputStream());
	}

	@Test
	public void testCompileKeepsLastAst() throws Exception {
		WordLang wordLang = new WordLang();
		assertNull(wordLang.getLastAst());
		Program program = wordLang.compile(scriptResource("/scripts/animals.wl"));
		assertSame(program.getRoot(), wordLang.getLastAst());
		assertTrue(wordLang.getLastAst() instanceof StatementBlockAst);
		assertEquals(2, program.getRoot().getLineNumber());
		assertEquals(4, program.getSlotCount());
	}

	@Test
	public void testCompiledProgramCanRunTwice() throws Exception {
		WordLang wordLang = new WordLang();
		Program program = wordLang
				.compile(new ScriptSource("twice", new StringReader("List a; a = a + \"x\"; print(a);")));
		assertEquals("[,x ]\n", runProgram(wordLang, program));
		assertEquals("variables start afresh on every run", "[,x ]\n", runProgram(wordLang, program));
	}

	private static String runProgram(WordLang wordLang, Program program) throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		WordLangSettings settings = new WordLangSettings();
		settings.setOutputStream(new PrintStream(bytes, true, StandardCharsets.UTF_8.name()));
		wordLang.invoke(program, settings);
		return bytes.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n");
	}

	@Test
	public void testParseErrorCarriesSource() throws Exception {
		ParserException e = assertThrows(
				ParserException.class,
				() -> new WordLang().compile(scriptResource("/scripts/syntax-error.wl")));
		assertEquals("/scripts/syntax-error.wl", e.getSourceDescription());
		assertEquals(3, e.getLineNumber());
	}
}
