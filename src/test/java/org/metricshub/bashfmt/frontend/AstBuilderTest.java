package org.metricshub.bashfmt.frontend;

import static org.junit.Assert.*;

import java.util.List;
import org.junit.Test;
import org.metricshub.bashfmt.ast.AndOrList;
import org.metricshub.bashfmt.ast.Assignment;
import org.metricshub.bashfmt.ast.BackgroundCommand;
import org.metricshub.bashfmt.ast.CaseStatement;
import org.metricshub.bashfmt.ast.Comment;
import org.metricshub.bashfmt.ast.CommandSubstitution;
import org.metricshub.bashfmt.ast.ConcatenatedWord;
import org.metricshub.bashfmt.ast.DoubleQuotedWord;
import org.metricshub.bashfmt.ast.FunctionDef;
import org.metricshub.bashfmt.ast.FunctionStyle;
import org.metricshub.bashfmt.ast.HereDoc;
import org.metricshub.bashfmt.ast.LiteralWord;
import org.metricshub.bashfmt.ast.ParameterExpansion;
import org.metricshub.bashfmt.ast.Pipeline;
import org.metricshub.bashfmt.ast.Redirect;
import org.metricshub.bashfmt.ast.Script;
import org.metricshub.bashfmt.ast.SimpleCommand;
import org.metricshub.bashfmt.ast.Statement;
import org.metricshub.bashfmt.ast.Word;

public class AstBuilderTest {

	private static Script build(String source) {
		HeredocPreprocessor.Result preprocessed = new HeredocPreprocessor().process(source);
		AstBuilder builder = new AstBuilder(preprocessed.getText());
		Script script = builder.build(new BashParser().parse(preprocessed, "test.sh"));
		HeredocPreprocessor.resolve(builder.getHereDocs(), preprocessed.getHeredocs());
		return script;
	}

	private static Statement single(String source) {
		List<Statement> statements = build(source).getStatements();
		assertEquals(source, 1, statements.size());
		return statements.get(0);
	}

	@Test
	public void testSingleCommandIsNotWrapped() {
		Statement statement = single("echo hi\n");
		assertEquals(Statement.Kind.SIMPLE_COMMAND, statement.getKind());
		SimpleCommand command = (SimpleCommand) statement;
		assertEquals("echo", ((LiteralWord) command.getName()).getText());
		assertEquals(1, command.getArguments().size());
	}

	@Test
	public void testAndOrPipelineBackground() {
		Statement statement = single("a && b | c &\n");
		assertEquals(Statement.Kind.BACKGROUND, statement.getKind());
		AndOrList list = (AndOrList) ((BackgroundCommand) statement).getCommand();
		assertEquals(Statement.Kind.SIMPLE_COMMAND, list.getFirst().getKind());
		assertEquals(1, list.getRest().size());
		assertEquals("&&", list.getRest().get(0).getOperator());
		Pipeline pipeline = (Pipeline) list.getRest().get(0).getPipeline();
		assertEquals(2, pipeline.getCommands().size());
		assertFalse(pipeline.isNegated());
	}

	@Test
	public void testNegatedSingleCommandKeepsPipeline() {
		Statement statement = single("! grep -q x file\n");
		assertEquals(Statement.Kind.PIPELINE, statement.getKind());
		assertTrue(((Pipeline) statement).isNegated());
	}

	@Test
	public void testAssignments() {
		SimpleCommand command = (SimpleCommand) single("x=1 y+=2 env\n");
		List<Assignment> assignments = command.getAssignments();
		assertEquals(2, assignments.size());
		assertEquals("x", assignments.get(0).getName());
		assertFalse(assignments.get(0).isAppend());
		assertEquals("y", assignments.get(1).getName());
		assertTrue(assignments.get(1).isAppend());
		assertEquals("env", ((LiteralWord) command.getName()).getText());
	}

	@Test
	public void testArrayArgument() {
		SimpleCommand command = (SimpleCommand) single("local a=(1 2)\n");
		Assignment array = (Assignment) command.getArguments().get(0);
		assertEquals("a", array.getName());
		assertEquals(2, array.getArrayValue().getElements().size());
	}

	@Test
	public void testAdjacentTextIsMerged() {
		SimpleCommand command = (SimpleCommand) single("echo \"a b c\" pre${x}post\n");
		DoubleQuotedWord quoted = (DoubleQuotedWord) command.getArguments().get(0);
		assertEquals(1, quoted.getParts().size());
		assertEquals("a b c", ((LiteralWord) quoted.getParts().get(0)).getText());
		ConcatenatedWord concatenated = (ConcatenatedWord) command.getArguments().get(1);
		assertEquals(3, concatenated.getParts().size());
	}

	@Test
	public void testParameterOperators() {
		AstBuilder builder = new AstBuilder("");
		ParameterExpansion defaulted = builder.parameter(null, "x:-def");
		assertEquals("x", defaulted.getName());
		assertEquals(":-", defaulted.getOperator());
		assertEquals("def", defaulted.getArgument());

		ParameterExpansion length = builder.parameter(null, "#arr[@]");
		assertEquals("#", length.getPrefix());
		assertEquals("arr[@]", length.getName());

		ParameterExpansion count = builder.parameter(null, "#");
		assertNull(count.getPrefix());
		assertEquals("#", count.getName());

		ParameterExpansion replace = builder.parameter(null, "x/#a/b");
		assertEquals("/#", replace.getOperator());
		assertEquals("a/b", replace.getArgument());

		ParameterExpansion kept = builder.parameter(null, "!prefix*");
		assertEquals("!prefix*", kept.getName());
		assertNull(kept.getOperator());
	}

	@Test
	public void testSpecialParameters() {
		SimpleCommand command = (SimpleCommand) single("echo $? $1 $HOME\n");
		assertTrue(((ParameterExpansion) command.getArguments().get(0)).isSpecial());
		assertTrue(((ParameterExpansion) command.getArguments().get(1)).isSpecial());
		assertFalse(((ParameterExpansion) command.getArguments().get(2)).isSpecial());
	}

	@Test
	public void testFunctionStyles() {
		assertEquals(FunctionStyle.FNPAR, ((FunctionDef) single("function f() { :; }\n")).getStyle());
		assertEquals(FunctionStyle.FNONLY, ((FunctionDef) single("function f { :; }\n")).getStyle());
		FunctionDef paronly = (FunctionDef) single("f() { :; }\n");
		assertEquals(FunctionStyle.PARONLY, paronly.getStyle());
		assertEquals("f", paronly.getName());
	}

	@Test
	public void testCaseWithoutFinalTerminator() {
		CaseStatement statement = (CaseStatement) single("case x in\na) echo a\nesac\n");
		assertEquals(1, statement.getClauses().size());
		assertEquals(";;", statement.getClauses().get(0).getTerminator());
	}

	@Test
	public void testCaseFallThroughTerminator() {
		CaseStatement statement = (CaseStatement) single("case x in\na) echo a ;&\nb) echo b ;;\nesac\n");
		assertEquals(";&", statement.getClauses().get(0).getTerminator());
		assertEquals(";;", statement.getClauses().get(1).getTerminator());
	}

	@Test
	public void testCommentsAndBlankLines() {
		List<Statement> statements = build("# head\n\necho a # tail\n").getStatements();
		assertEquals(4, statements.size());
		assertFalse(((Comment) statements.get(0)).isInline());
		assertEquals(Statement.Kind.BLANK_LINE, statements.get(1).getKind());
		assertTrue(((Comment) statements.get(3)).isInline());
		assertEquals("# tail", ((Comment) statements.get(3)).getText());
	}

	@Test
	public void testHeredocAttached() {
		SimpleCommand command = (SimpleCommand) single("cat <<-'END' >out\n\tbody\n\tEND\n");
		assertEquals(2, command.getRedirects().size());
		Redirect redirect = command.getRedirects().get(0);
		assertEquals("<<-", redirect.getOperator());
		HereDoc heredoc = redirect.getHeredoc();
		assertTrue(heredoc.isQuoted());
		assertTrue(heredoc.isStripTabs());
		assertEquals("\tbody\n", heredoc.getBody());
		assertEquals("\tEND", heredoc.getTerminatorLine());
		assertEquals(">", command.getRedirects().get(1).getOperator());
	}

	@Test
	public void testCommandSubstitutionStyles() {
		SimpleCommand command = (SimpleCommand) single("diff <(a) $(b) `c`\n");
		List<?> arguments = command.getArguments();
		assertEquals(CommandSubstitution.Style.PROCESS_INPUT, ((CommandSubstitution) arguments.get(0)).getStyle());
		assertEquals(CommandSubstitution.Style.DOLLAR, ((CommandSubstitution) arguments.get(1)).getStyle());
		CommandSubstitution backtick = (CommandSubstitution) arguments.get(2);
		assertEquals(CommandSubstitution.Style.BACKTICK, backtick.getStyle());
		assertEquals("c", backtick.getRawText());
	}

	@Test
	public void testLocations() {
		List<Statement> statements = build("echo a\n  echo b\n").getStatements();
		assertEquals(2, statements.get(1).getLocation().getLine());
		assertEquals(3, statements.get(1).getLocation().getColumn());
		Word name = ((SimpleCommand) statements.get(1)).getName();
		assertEquals(2, name.getLocation().getLine());
	}
}
