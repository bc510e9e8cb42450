package org.metricshub.wordlang;

import static org.junit.Assert.*;
import static org.metricshub.wordlang.WordLangTestSupport.cliTest;

import org.junit.Test;
import org.metricshub.wordlang.jrt.PrintFormat;

public class CliTest {

	@Test
	public void testRunsScriptFile() throws Exception {
		cliTest("script file with load")
				.file("f1.txt", "b a\n")
				.script("List a = load(\"{{f1.txt}}\");\nprint(a, a | filter(\"a\"));")
				.expectLines("[,a,b ]", "[,a ]")
				.runAndAssert();
	}

	@Test
	public void testCompactSwitch() throws Exception {
		cliTest("--compact")
				.compact()
				.script("print(\"b\" + \"a\");")
				.expectLines("[a,b]")
				.runAndAssert();
	}

	@Test
	public void testDecodeEscapesSwitch() throws Exception {
		cliTest("--decode-escapes")
				.decodeEscapes()
				.script("print(\"\\\"q\\\"\");")
				.expectLines("[,\"q\" ]")
				.runAndAssert();
	}

	@Test
	public void testDumpSyntax() throws Exception {
		cliTest("--dump-syntax")
				.argument("--dump-syntax")
				.script("List a = \"x\";\nprint(a);")
				.expectLines(
						"StatementBlock",
						"  Assign",
						"    VariableRef a (slot 0)",
						"    Literal: [x]",
						"  Print",
						"    VariableRef a (slot 0)",
						Cli.DUMP_SEPARATOR,
						"[,x ]")
				.runAndAssert();
	}

	@Test
	public void testSyntaxError() throws Exception {
		cliTest("syntax error")
				.script("List a = \"cat\";\nprint(a);\nList x = ;")
				.expectNoOutput()
				.expectExit(1)
				.expectError("ERROR (line 3): Expected expression. Found ';'.")
				.runAndAssert();
	}

	@Test
	public void testMissingScriptFile() throws Exception {
		cliTest("script file that does not exist")
				.withoutScriptFile()
				.argument("no-such-script.wl")
				.expectNoOutput()
				.expectExit(1)
				.expectError("ERROR: ")
				.runAndAssert();
	}

	@Test
	public void testNoScriptFile() throws Exception {
		cliTest("no script file")
				.withoutScriptFile()
				.argument("--compact")
				.expectExit(1)
				.expectError("WordLang script file not provided.")
				.runAndAssert();
	}

	@Test
	public void testTooManyScriptFiles() throws Exception {
		cliTest("two script files")
				.argument("--compact")
				.argument("first.wl")
				.script("print(\"x\");")
				.expectNoOutput()
				.expectExit(1)
				.expectError("Exactly one script file is expected.")
				.runAndAssert();
	}

	@Test
	public void testUnknownSwitch() throws Exception {
		cliTest("unknown switch")
				.argument("--verbose")
				.script("print(\"x\");")
				.expectNoOutput()
				.expectExit(1)
				.expectError("Unknown parameter: --verbose")
				.runAndAssert();
	}

	@Test
	public void testHelp() throws Exception {
		WordLangTestSupport.TestResult result = cliTest("help")
				.withoutScriptFile()
				.argument("-h")
				.run();
		assertEquals(0, result.exitCode());
		assertEquals("Usage:", result.lines().get(0));
		assertEquals("", result.errorOutput());
	}

	@Test
	public void testParse() {
		Cli cli = new Cli();
		cli.parse(new String[] { "--dump-syntax", "--compact", "--decode-escapes", "script.wl" });
		assertTrue(cli.isDumpSyntaxTree());
		assertEquals(PrintFormat.COMPACT, cli.getSettings().getPrintFormat());
		assertTrue(cli.getSettings().isDecodeEscapes());
		assertEquals("script.wl", cli.getScriptFile());

		Cli defaults = new Cli();
		defaults.parse(new String[] { "script.wl" });
		assertFalse(defaults.isDumpSyntaxTree());
		assertEquals(PrintFormat.LEGACY, defaults.getSettings().getPrintFormat());
		assertFalse(defaults.getSettings().isDecodeEscapes());
	}

	@Test
	public void testParseErrors() {
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[0]));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-h", "script.wl" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "a.wl", "--compact" }));
	}
}
