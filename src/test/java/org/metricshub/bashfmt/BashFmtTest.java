package org.metricshub.bashfmt;

import static org.junit.Assert.*;
import static org.metricshub.bashfmt.FormatTestSupport.formatTest;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.bashfmt.ast.FunctionStyle;
import org.metricshub.bashfmt.ast.Script;
import org.metricshub.bashfmt.backend.VariableStyle;
import org.metricshub.bashfmt.frontend.ParserException;
import org.metricshub.bashfmt.util.ScriptSource;

public class BashFmtTest {

	@Test
	public void testIfHeaderWithNarrowIndent() {
		formatTest("if header")
				.source("if true;then\necho \"test\"\nfi")
				.indent(2)
				.expect("if true; then\n  echo \"test\"\nfi")
				.runAndAssert();
	}

	@Test
	public void testIfElifElse() {
		formatTest("if elif else")
				.source("if a; then\nb\nelif c; then\nd\nelse\ne\nfi\n")
				.expect("if a; then\n    b\nelif c; then\n    d\nelse\n    e\nfi\n")
				.runAndAssert();
	}

	@Test
	public void testOneLineIf() {
		formatTest("one line if")
				.source("if [ -f x ]; then echo yes; else echo no; fi\n")
				.expect("if [ -f x ]; then\n    echo yes\nelse\n    echo no\nfi\n")
				.runAndAssert();
	}

	@Test
	public void testMissingFiLeavesInputUnchanged() {
		formatTest("missing fi").source("if true; then\necho x\n").expectError().runAndAssert();
	}

	@Test
	public void testUnbalancedQuoteLeavesInputUnchanged() {
		formatTest("unbalanced quote").source("echo \"oops\n").expectError().runAndAssert();
	}

	@Test
	public void testTabIndent() {
		formatTest("tab indent")
				.source("while true; do\nsleep 1\ndone\n")
				.tab()
				.expect("while true; do\n\tsleep 1\ndone\n")
				.runAndAssert();
	}

	@Test
	public void testLoops() {
		formatTest("for and while loops")
				.source("for i in 1 2 3\ndo\necho $i\ndone\nwhile read -r line; do echo \"$line\"; done < input.txt\n")
				.expect("for i in 1 2 3; do\n    echo $i\ndone\nwhile read -r line; do\n    echo \"$line\"\ndone <input.txt\n")
				.runAndAssert();
	}

	@Test
	public void testCaseStatement() {
		formatTest("case statement")
				.source("case \"$1\" in\nstart|go) run ;;\n*)\necho usage\nexit 1\n;;\nesac\n")
				.expect(
						"case \"$1\" in\n"
								+ "    start | go)\n"
								+ "        run\n"
								+ "        ;;\n"
								+ "    *)\n"
								+ "        echo usage\n"
								+ "        exit 1\n"
								+ "        ;;\n"
								+ "esac\n")
				.runAndAssert();
	}

	@Test
	public void testGroups() {
		formatTest("subshell and brace group")
				.source("( cd /tmp && ls )\n{ echo a; echo b; }\n{ echo c; }\n")
				.expect("(cd /tmp && ls)\n{\n    echo a\n    echo b\n}\n{ echo c; }\n")
				.runAndAssert();
	}

	@Test
	public void testHeredocBodyKeptVerbatim() {
		formatTest("heredoc body")
				.source("cat <<EOF\n  indented\n\n\tTabbed $x\nEOF\necho done\n")
				.expectUnchanged()
				.runAndAssert();
	}

	@Test
	public void testHeredocInsideFunction() {
		formatTest("heredoc inside function")
				.source("f() {\ncat <<EOF\n  keep\nEOF\n}\n")
				.expect("f() {\n    cat <<EOF\n  keep\nEOF\n}\n")
				.runAndAssert();
	}

	@Test
	public void testHeredocsWithSameDelimiter() {
		formatTest("two heredocs with the same delimiter")
				.source("cat <<EOF\none\nEOF\ncat <<EOF\ntwo\nEOF\n")
				.expectUnchanged()
				.runAndAssert();
	}

	@Test
	public void testHeredocInCommandSubstitution() {
		formatTest("heredoc in command substitution")
				.source("x=$(cat <<EOF\nhi\nEOF\n)\n")
				.expectUnchanged()
				.runAndAssert();
	}

	@Test
	public void testHeredocInQuotedCommandSubstitution() {
		formatTest("heredoc in quoted command substitution")
				.source("echo \"$(cat <<EOF\nhi\nEOF\n)\"\n")
				.expectUnchanged()
				.runAndAssert();
		formatTest("quoted delimiter in quoted command substitution")
				.source("x=\"$(cat <<'EOF'\n$y  \"z\"\nEOF\n)\"\necho \"$x\"\n")
				.expectUnchanged()
				.runAndAssert();
	}

	@Test
	public void testLongWords() {
		StringBuilder blob = new StringBuilder();
		for (int i = 0; i < 100000; i++) {
			blob.append((char) ('a' + i % 26));
		}
		formatTest("long bare word").source("echo " + blob + "\n").expectUnchanged().runAndAssert();
		formatTest("long double-quoted string")
				.source("echo \"" + blob + "\\\"x\"\n")
				.expectUnchanged()
				.runAndAssert();
		formatTest("long backquoted command")
				.source("x=`echo " + blob + "`\n")
				.expectUnchanged()
				.runAndAssert();
	}

	@Test
	public void testShiftIsNotAHeredoc() {
		formatTest("arithmetic shift").source("result=$(( x << 2 ))\n").expectUnchanged().runAndAssert();
	}

	@Test
	public void testHereString() {
		formatTest("here-string").source("cat <<<\"$x\"\n").expectUnchanged().runAndAssert();
	}

	@Test
	public void testBackgroundAndTrailingComment() {
		formatTest("background with comment")
				.source("sleep 1 & # wait\nwait\n")
				.expectUnchanged()
				.runAndAssert();
	}

	@Test
	public void testBackticksKeptRaw() {
		formatTest("backticks")
				.source("x=`ls -l | wc -l`\necho  `date`\n")
				.expect("x=`ls -l | wc -l`\necho `date`\n")
				.runAndAssert();
	}

	@Test
	public void testCommandSubstitution() {
		formatTest("inline command substitution")
				.source("x=$( date +%s )\n")
				.expect("x=$(date +%s)\n")
				.runAndAssert();
		formatTest("multi-line command substitution")
				.source("x=$(\nif a; then\nb\nfi\n)\n")
				.expect("x=$(\n    if a; then\n        b\n    fi\n)\n")
				.runAndAssert();
	}

	@Test
	public void testFunctionStyles() {
		String source = "function foo() { :; }\n";
		formatTest("preserved style").source(source).expect("function foo() {\n    :\n}\n").runAndAssert();
		formatTest("fnonly")
				.source(source)
				.functionStyle(FunctionStyle.FNONLY)
				.expect("function foo {\n    :\n}\n")
				.runAndAssert();
		formatTest("paronly")
				.source(source)
				.functionStyle(FunctionStyle.PARONLY)
				.expect("foo() {\n    :\n}\n")
				.runAndAssert();
	}

	@Test
	public void testFunctionStyleRoundTrip() {
		String original = "function foo() {\n    :\n}\n";
		for (FunctionStyle style : FunctionStyle.values()) {
			String converted = formatTest("to " + style).source(original).functionStyle(style).run().getFormatted();
			String back = formatTest("back from " + style)
					.source(converted)
					.functionStyle(FunctionStyle.FNPAR)
					.run()
					.getFormatted();
			assertEquals("Round trip through " + style, original, back);
		}
	}

	@Test
	public void testVariableStyleBraces() {
		formatTest("braces")
				.source("echo \"$HOME\" $PATH\n")
				.variableStyle(VariableStyle.BRACES)
				.expect("echo \"${HOME}\" ${PATH}\n")
				.runAndAssert();
	}

	@Test
	public void testVariableStyleLeavesSpecialParameters() {
		formatTest("special parameters")
				.source("echo \"$?\" \"$1\" \"$@\" \"$$\" ${x:-y} $(( x + 1 )) '$HOME'\n")
				.variableStyle(VariableStyle.BRACES)
				.expectUnchanged()
				.runAndAssert();
	}

	@Test
	public void testVariableStyleInHeredocs() {
		formatTest("braces in heredocs")
				.source("cat <<'EOF'\n$HOME\nEOF\ncat <<EOF\n$HOME \\$HOME $1\nEOF\n")
				.variableStyle(VariableStyle.BRACES)
				.expect("cat <<'EOF'\n$HOME\nEOF\ncat <<EOF\n${HOME} \\$HOME $1\nEOF\n")
				.runAndAssert();
	}

	@Test
	public void testFormatterOffRegion() {
		formatTest("formatter off region")
				.source(
						"if true; then\n"
								+ "# @formatter:off\n"
								+ "  x=1;   y=2\n"
								+ "\tweird   spacing\n"
								+ "# @formatter:on\n"
								+ "echo hi\n"
								+ "fi\n")
				.expect(
						"if true; then\n"
								+ "# @formatter:off\n"
								+ "  x=1;   y=2\n"
								+ "\tweird   spacing\n"
								+ "# @formatter:on\n"
								+ "    echo hi\n"
								+ "fi\n")
				.runAndAssert();
	}

	@Test
	public void testUnterminatedFormatterOffRegion() {
		formatTest("unterminated region")
				.source("echo   a\n# @formatter:off\nfoo   bar\n")
				.expect("echo a\n# @formatter:off\nfoo   bar\n")
				.runAndAssert();
	}

	@Test
	public void testTrailingNewlineFollowsInput() {
		formatTest("no final newline").source("echo   a").expect("echo a").runAndAssert();
		formatTest("final newline").source("echo   a\n").expect("echo a\n").runAndAssert();
	}

	@Test
	public void testFormatScriptSource() {
		ScriptSource source = new ScriptSource("inline.sh", new java.io.StringReader("echo   hi\n"));
		FormatResult result = new BashFmt().format(source);
		assertFalse(result.hasError());
		assertEquals("echo hi\n", result.getFormatted());
	}

	@Test
	public void testParseErrorReportsOriginalLine() throws Exception {
		ParserException e = assertThrows(
				"A stray parenthesis must be rejected",
				ParserException.class,
				() -> new BashFmt().parse("cat <<EOF\na\nb\nEOF\necho (\n", "broken.sh"));
		assertEquals(5, e.getLineNumber());
		assertEquals("broken.sh", e.getSourceDescription());
		assertTrue(e.getMessage(), e.getMessage().startsWith("broken.sh:5:"));
	}

	@Test
	public void testDumpSyntaxTree() throws Exception {
		Script script = new BashFmt().parse("echo hi | wc -l\n", "dump.sh");
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		script.dump(new PrintStream(bytes, true, "UTF-8"));
		String dump = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(dump, dump.contains("Pipeline"));
		assertTrue(dump, dump.contains("SimpleCommand"));
	}

	@Test
	public void testMatchTrailingNewline() {
		assertEquals("a\n", BashFmt.matchTrailingNewline("a\n", "a"));
		assertEquals("a", BashFmt.matchTrailingNewline("a", "a\n"));
		assertEquals("\n", BashFmt.matchTrailingNewline("\n", ""));
	}

	@Test
	public void testCrlfLineEndings() {
		formatTest("CRLF script")
				.source("if x;then\r\necho a\r\nfi\r\n")
				.expect("if x; then\r\n    echo a\r\nfi\r\n")
				.runAndAssert();
		formatTest("CRLF heredoc")
				.source("cat <<EOF\r\n  body\r\nEOF\r\n")
				.expectUnchanged()
				.runAndAssert();
	}

	@Test
	public void testHasCrlfLineEndings() {
		assertTrue(BashFmt.hasCrlfLineEndings("a\r\nb\r\n"));
		assertTrue(BashFmt.hasCrlfLineEndings("a\r\nb"));
		assertFalse(BashFmt.hasCrlfLineEndings("a\nb\n"));
		assertFalse(BashFmt.hasCrlfLineEndings("a\r\nb\n"));
		assertFalse(BashFmt.hasCrlfLineEndings(""));
	}
}
