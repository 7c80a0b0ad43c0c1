package org.metricshub.bashfmt.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * BashFmt
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.List;
import org.metricshub.bashfmt.ast.AndOrList;
import org.metricshub.bashfmt.ast.ArithmeticCommand;
import org.metricshub.bashfmt.ast.ArithmeticExpansion;
import org.metricshub.bashfmt.ast.ArithmeticForLoop;
import org.metricshub.bashfmt.ast.Assignment;
import org.metricshub.bashfmt.ast.BackgroundCommand;
import org.metricshub.bashfmt.ast.BraceGroup;
import org.metricshub.bashfmt.ast.CaseClause;
import org.metricshub.bashfmt.ast.CaseStatement;
import org.metricshub.bashfmt.ast.CommandArgument;
import org.metricshub.bashfmt.ast.CommandSubstitution;
import org.metricshub.bashfmt.ast.Comment;
import org.metricshub.bashfmt.ast.CompoundCommand;
import org.metricshub.bashfmt.ast.CompoundList;
import org.metricshub.bashfmt.ast.ConcatenatedWord;
import org.metricshub.bashfmt.ast.ConditionalCommand;
import org.metricshub.bashfmt.ast.DoubleQuotedWord;
import org.metricshub.bashfmt.ast.ElifClause;
import org.metricshub.bashfmt.ast.ForLoop;
import org.metricshub.bashfmt.ast.FunctionDef;
import org.metricshub.bashfmt.ast.FunctionStyle;
import org.metricshub.bashfmt.ast.HereDoc;
import org.metricshub.bashfmt.ast.IfStatement;
import org.metricshub.bashfmt.ast.LiteralWord;
import org.metricshub.bashfmt.ast.ParameterExpansion;
import org.metricshub.bashfmt.ast.Pipeline;
import org.metricshub.bashfmt.ast.Redirect;
import org.metricshub.bashfmt.ast.Script;
import org.metricshub.bashfmt.ast.SimpleCommand;
import org.metricshub.bashfmt.ast.SingleQuotedWord;
import org.metricshub.bashfmt.ast.Statement;
import org.metricshub.bashfmt.ast.Subshell;
import org.metricshub.bashfmt.ast.UntilLoop;
import org.metricshub.bashfmt.ast.WhileLoop;
import org.metricshub.bashfmt.ast.Word;

/**
 * Renders a {@link Script} tree as formatted text.
 * <p>
 * Every statement of a block goes on its own line, indented one level per
 * enclosing compound command. Conditions, command substitutions and short
 * groups are written inline, joined with {@code "; "}.
 * <p>
 * A visitor holds the state of one rendering (the output, including the
 * queue of pending here-document bodies) and must not be reused.
 */
public final class FormatterVisitor {

	/** How an inline list ended, which decides how the next keyword is joined. */
	private enum Ending {
		NORMAL,
		BACKGROUND,
		COMMENT
	}

	private final OutputBuilder out;
	private final FunctionStyle functionStyle;
	private final VariableStyle variableStyle;

	/**
	 * @param indentUnit text of one indentation level
	 * @param functionStyle style forced on function headers, or {@code null}
	 *        to keep the style of each function
	 * @param variableStyle style of parameter expansions
	 */
	public FormatterVisitor(String indentUnit, FunctionStyle functionStyle, VariableStyle variableStyle) {
		this.out = new OutputBuilder(indentUnit);
		this.functionStyle = functionStyle;
		this.variableStyle = variableStyle == null ? VariableStyle.NONE : variableStyle;
	}

	/**
	 * Render the specified script.
	 *
	 * @param script the tree to render
	 * @return the formatted text, without final newline unless a
	 *         here-document body ends the script
	 */
	public String format(Script script) {
		block(script.getStatements(), 0);
		return out.finish();
	}

	// ==== LISTS ==============================================================

	/**
	 * One statement per line at the given depth.
	 */
	private void block(List<Statement> statements, int depth) {
		for (Statement statement : statements) {
			if (statement instanceof Comment && ((Comment) statement).isInline() && out.isStarted()) {
				out.append(" ").append(((Comment) statement).getText());
				continue;
			}
			if (statement.getKind() == Statement.Kind.BLANK_LINE) {
				out.startLine(0);
				continue;
			}
			out.startLine(depth);
			statement(statement, depth);
		}
	}

	/**
	 * Statements joined on the current line. Comments force the following
	 * statements onto a new line one level deeper.
	 */
	private Ending inlineList(List<Statement> statements, int depth) {
		Ending ending = null;
		for (Statement statement : statements) {
			switch (statement.getKind()) {
			case BLANK_LINE:
				continue;
			case COMMENT:
				Comment comment = (Comment) statement;
				if (comment.isInline()) {
					out.append(" ");
				} else {
					out.startLine(depth + 1);
				}
				out.append(comment.getText());
				ending = Ending.COMMENT;
				continue;
			default:
				break;
			}
			if (ending == Ending.COMMENT) {
				out.startLine(depth + 1);
			} else if (ending == Ending.BACKGROUND) {
				out.append(" ");
			} else if (ending == Ending.NORMAL) {
				out.append("; ");
			}
			statement(statement, depth);
			ending = statement.getKind() == Statement.Kind.BACKGROUND ? Ending.BACKGROUND : Ending.NORMAL;
		}
		return ending == null ? Ending.NORMAL : ending;
	}

	/**
	 * Write a keyword such as {@code then} or {@code do} after an inline list.
	 */
	private void closeInline(Ending ending, int depth, String keyword) {
		switch (ending) {
		case COMMENT:
			out.startLine(depth);
			out.append(keyword);
			break;
		case BACKGROUND:
			out.append(" ").append(keyword);
			break;
		default:
			out.append("; ").append(keyword);
		}
	}

	// ==== STATEMENTS =========================================================

	/**
	 * Render a statement from the current position. Multi-line statements end
	 * on their last line.
	 */
	private void statement(Statement statement, int depth) {
		switch (statement.getKind()) {
		case SIMPLE_COMMAND:
			simpleCommand((SimpleCommand) statement, depth);
			break;
		case PIPELINE:
			pipeline((Pipeline) statement, depth);
			break;
		case AND_OR_LIST:
			andOrList((AndOrList) statement, depth);
			break;
		case COMPOUND_LIST:
			inlineList(((CompoundList) statement).getStatements(), depth);
			break;
		case SUBSHELL:
			subshell((Subshell) statement, depth);
			break;
		case BRACE_GROUP:
			braceGroup((BraceGroup) statement, depth);
			break;
		case IF:
			ifStatement((IfStatement) statement, depth);
			break;
		case FOR:
			forLoop((ForLoop) statement, depth);
			break;
		case ARITHMETIC_FOR:
			arithmeticForLoop((ArithmeticForLoop) statement, depth);
			break;
		case WHILE:
			WhileLoop whileLoop = (WhileLoop) statement;
			loop("while ", whileLoop.getCondition(), whileLoop.getBody(), depth);
			break;
		case UNTIL:
			UntilLoop untilLoop = (UntilLoop) statement;
			loop("until ", untilLoop.getCondition(), untilLoop.getBody(), depth);
			break;
		case CASE:
			caseStatement((CaseStatement) statement, depth);
			break;
		case ARITHMETIC_COMMAND:
			out.append("((").append(((ArithmeticCommand) statement).getExpression()).append("))");
			break;
		case CONDITIONAL_COMMAND:
			out.append("[[");
			out.append(variableStyle.apply(((ConditionalCommand) statement).getExpression(), true));
			out.append("]]");
			break;
		case FUNCTION_DEF:
			functionDef((FunctionDef) statement, depth);
			break;
		case BACKGROUND:
			statement(((BackgroundCommand) statement).getCommand(), depth);
			out.append(" &");
			break;
		case COMMENT:
			out.append(((Comment) statement).getText());
			break;
		case BLANK_LINE:
		default:
			// nothing on the line
			break;
		}
		if (statement instanceof CompoundCommand) {
			redirects(((CompoundCommand) statement).getRedirects(), depth);
		}
	}

	private void simpleCommand(SimpleCommand command, int depth) {
		String separator = "";
		for (Assignment assignment : command.getAssignments()) {
			out.append(separator);
			assignment(assignment, depth);
			separator = " ";
		}
		if (command.getName() != null) {
			out.append(separator);
			word(command.getName(), depth);
			separator = " ";
		}
		for (CommandArgument argument : command.getArguments()) {
			out.append(separator);
			if (argument instanceof Assignment) {
				assignment((Assignment) argument, depth);
			} else {
				word((Word) argument, depth);
			}
			separator = " ";
		}
		for (Redirect redirect : command.getRedirects()) {
			out.append(separator);
			redirect(redirect, depth);
			separator = " ";
		}
	}

	private void assignment(Assignment assignment, int depth) {
		out.append(assignment.getName()).append(assignment.isAppend() ? "+=" : "=");
		if (assignment.getValue() != null) {
			word(assignment.getValue(), depth);
		} else if (assignment.getArrayValue() != null) {
			out.append("(");
			String separator = "";
			for (Word element : assignment.getArrayValue().getElements()) {
				out.append(separator);
				word(element, depth);
				separator = " ";
			}
			out.append(")");
		}
	}

	private void pipeline(Pipeline pipeline, int depth) {
		if (pipeline.isNegated()) {
			out.append("! ");
		}
		List<Statement> commands = pipeline.getCommands();
		for (int i = 0; i < commands.size(); i++) {
			if (i > 0) {
				out.append(" ").append(pipeline.getOperators().get(i - 1)).append(" ");
			}
			statement(commands.get(i), depth);
		}
	}

	private void andOrList(AndOrList list, int depth) {
		statement(list.getFirst(), depth);
		for (AndOrList.Link link : list.getRest()) {
			out.append(" ").append(link.getOperator()).append(" ");
			statement(link.getPipeline(), depth);
		}
	}

	private void subshell(Subshell subshell, int depth) {
		Statement single = singleInlineStatement(subshell.getBody());
		if (single != null) {
			boolean spaced = startsWithParenthesis(single);
			out.append(spaced ? "( " : "(");
			statement(single, depth);
			out.append(spaced ? " )" : ")");
			return;
		}
		out.append("(");
		block(subshell.getBody().getStatements(), depth + 1);
		out.startLine(depth);
		out.append(")");
	}

	private void braceGroup(BraceGroup group, int depth) {
		Statement single = singleInlineStatement(group.getBody());
		if (single != null) {
			out.append("{ ");
			statement(single, depth);
			out.append(single.getKind() == Statement.Kind.BACKGROUND ? " }" : "; }");
			return;
		}
		out.append("{");
		block(group.getBody().getStatements(), depth + 1);
		out.startLine(depth);
		out.append("}");
	}

	private void ifStatement(IfStatement statement, int depth) {
		out.append("if ");
		closeInline(inlineList(statement.getCondition().getStatements(), depth), depth, "then");
		block(statement.getThenBody().getStatements(), depth + 1);
		for (ElifClause elif : statement.getElifClauses()) {
			out.startLine(depth);
			out.append("elif ");
			closeInline(inlineList(elif.getCondition().getStatements(), depth), depth, "then");
			block(elif.getBody().getStatements(), depth + 1);
		}
		if (statement.getElseBody() != null) {
			out.startLine(depth);
			out.append("else");
			block(statement.getElseBody().getStatements(), depth + 1);
		}
		out.startLine(depth);
		out.append("fi");
	}

	private void forLoop(ForLoop loop, int depth) {
		out.append(loop.isSelect() ? "select " : "for ").append(loop.getVariable());
		if (loop.getWords() != null) {
			out.append(" in");
			for (Word word : loop.getWords()) {
				out.append(" ");
				word(word, depth);
			}
		}
		out.append("; do");
		loopBody(loop.getBody(), depth);
	}

	private void arithmeticForLoop(ArithmeticForLoop loop, int depth) {
		out.append("for ((").append(loop.getHeader()).append(")); do");
		loopBody(loop.getBody(), depth);
	}

	private void loop(String keyword, CompoundList condition, CompoundList body, int depth) {
		out.append(keyword);
		closeInline(inlineList(condition.getStatements(), depth), depth, "do");
		loopBody(body, depth);
	}

	private void loopBody(CompoundList body, int depth) {
		block(body.getStatements(), depth + 1);
		out.startLine(depth);
		out.append("done");
	}

	private void caseStatement(CaseStatement statement, int depth) {
		out.append("case ");
		word(statement.getWord(), depth);
		out.append(" in");
		for (CaseClause clause : statement.getClauses()) {
			for (Comment comment : clause.getLeadingComments()) {
				out.startLine(depth + 1);
				out.append(comment.getText());
			}
			out.startLine(depth + 1);
			String separator = "";
			for (Word pattern : clause.getPatterns()) {
				out.append(separator);
				word(pattern, depth + 1);
				separator = " | ";
			}
			out.append(")");
			block(clause.getBody().getStatements(), depth + 2);
			out.startLine(depth + 2);
			out.append(clause.getTerminator());
		}
		for (Comment comment : statement.getTrailingComments()) {
			out.startLine(depth + 1);
			out.append(comment.getText());
		}
		out.startLine(depth);
		out.append("esac");
	}

	private void functionDef(FunctionDef function, int depth) {
		CompoundCommand body = function.getBody();
		FunctionStyle style = functionStyle != null ? functionStyle : function.getStyle();
		if (style == FunctionStyle.FNONLY && body instanceof Subshell) {
			// "function name ( ... )" would read as the parenthesized form
			style = FunctionStyle.FNPAR;
		}
		switch (style) {
		case FNPAR:
			out.append("function ").append(function.getName()).append("() ");
			break;
		case FNONLY:
			out.append("function ").append(function.getName()).append(" ");
			break;
		case PARONLY:
		default:
			out.append(function.getName()).append("() ");
			break;
		}
		if (body instanceof BraceGroup) {
			out.append("{");
			block(((BraceGroup) body).getBody().getStatements(), depth + 1);
			out.startLine(depth);
			out.append("}");
			redirects(body.getRedirects(), depth);
		} else {
			statement(body, depth);
		}
	}

	/**
	 * @return the statement of a group short enough to be written inline, or
	 *         {@code null}
	 */
	private static Statement singleInlineStatement(CompoundList body) {
		Statement single = null;
		for (Statement statement : body.getStatements()) {
			if (statement.getKind() == Statement.Kind.BLANK_LINE) {
				continue;
			}
			if (single != null || !isSimple(statement)) {
				return null;
			}
			single = statement;
		}
		return single;
	}

	private static boolean isSimple(Statement statement) {
		switch (statement.getKind()) {
		case SIMPLE_COMMAND:
		case ARITHMETIC_COMMAND:
		case CONDITIONAL_COMMAND:
			return true;
		case PIPELINE:
			for (Statement command : ((Pipeline) statement).getCommands()) {
				if (!isSimple(command)) {
					return false;
				}
			}
			return true;
		case AND_OR_LIST:
			AndOrList list = (AndOrList) statement;
			if (!isSimple(list.getFirst())) {
				return false;
			}
			for (AndOrList.Link link : list.getRest()) {
				if (!isSimple(link.getPipeline())) {
					return false;
				}
			}
			return true;
		case BACKGROUND:
			return isSimple(((BackgroundCommand) statement).getCommand());
		default:
			return false;
		}
	}

	/**
	 * Whether the rendering of the statement starts with {@code (}, which
	 * must not be glued to an opening parenthesis.
	 */
	private static boolean startsWithParenthesis(Statement statement) {
		switch (statement.getKind()) {
		case SUBSHELL:
		case ARITHMETIC_COMMAND:
			return true;
		case PIPELINE:
			Pipeline pipeline = (Pipeline) statement;
			return !pipeline.isNegated() && startsWithParenthesis(pipeline.getCommands().get(0));
		case AND_OR_LIST:
			return startsWithParenthesis(((AndOrList) statement).getFirst());
		case BACKGROUND:
			return startsWithParenthesis(((BackgroundCommand) statement).getCommand());
		default:
			return false;
		}
	}

	// ==== REDIRECTIONS =======================================================

	private void redirects(List<Redirect> redirects, int depth) {
		for (Redirect redirect : redirects) {
			out.append(" ");
			redirect(redirect, depth);
		}
	}

	private void redirect(Redirect redirect, int depth) {
		if (redirect.getFd() != null) {
			out.append(redirect.getFd());
		}
		out.append(redirect.getOperator());
		if (redirect.getHereString() != null) {
			word(redirect.getHereString().getWord(), depth);
		} else if (redirect.getHeredoc() != null) {
			hereDoc(redirect.getHeredoc());
		} else {
			if (isProcessSubstitution(redirect.getTarget())) {
				// "< <(cmd)" is not "<<(cmd)"
				out.append(" ");
			}
			word(redirect.getTarget(), depth);
		}
	}

	private void hereDoc(HereDoc heredoc) {
		char quote = heredoc.getQuote();
		if (quote == '\\') {
			out.append("\\").append(heredoc.getDelimiter());
		} else if (quote != 0) {
			String q = String.valueOf(quote);
			out.append(q).append(heredoc.getDelimiter()).append(q);
		} else {
			out.append(heredoc.getDelimiter());
		}
		if (heredoc.isAttached()) {
			String body = heredoc.isQuoted() ? heredoc.getBody() : variableStyle.apply(heredoc.getBody(), false);
			out.queueHeredoc(body, heredoc.getTerminatorLine());
		}
	}

	private static boolean isProcessSubstitution(Word word) {
		Word first = word instanceof ConcatenatedWord ? ((ConcatenatedWord) word).getParts().get(0) : word;
		if (first instanceof CommandSubstitution) {
			CommandSubstitution.Style style = ((CommandSubstitution) first).getStyle();
			return style == CommandSubstitution.Style.PROCESS_INPUT || style == CommandSubstitution.Style.PROCESS_OUTPUT;
		}
		return false;
	}

	// ==== WORDS ==============================================================

	private void word(Word word, int depth) {
		switch (word.getKind()) {
		case LITERAL:
			out.append(((LiteralWord) word).getText());
			break;
		case SINGLE_QUOTED:
			SingleQuotedWord singleQuoted = (SingleQuotedWord) word;
			out.append(singleQuoted.isAnsiC() ? "$'" : "'").append(singleQuoted.getContent()).append("'");
			break;
		case DOUBLE_QUOTED:
			DoubleQuotedWord doubleQuoted = (DoubleQuotedWord) word;
			out.append(doubleQuoted.isLocale() ? "$\"" : "\"");
			for (Word part : doubleQuoted.getParts()) {
				word(part, depth);
			}
			out.append("\"");
			break;
		case PARAMETER:
			parameter((ParameterExpansion) word);
			break;
		case COMMAND_SUBSTITUTION:
			commandSubstitution((CommandSubstitution) word, depth);
			break;
		case ARITHMETIC:
			out.append("$((").append(((ArithmeticExpansion) word).getExpression()).append("))");
			break;
		case CONCATENATED:
			for (Word part : ((ConcatenatedWord) word).getParts()) {
				word(part, depth);
			}
			break;
		default:
			throw new IllegalStateException("Unknown word kind " + word.getKind());
		}
	}

	private void parameter(ParameterExpansion parameter) {
		if (!parameter.isBraced()) {
			if (!parameter.isSpecial() && variableStyle.bracesFor(parameter.getName())) {
				out.append("${").append(parameter.getName()).append("}");
			} else {
				out.append("$").append(parameter.getName());
			}
			return;
		}
		out.append("${");
		if (parameter.getPrefix() != null) {
			out.append(parameter.getPrefix());
		}
		out.append(parameter.getName());
		if (parameter.getOperator() != null) {
			out.append(parameter.getOperator()).append(parameter.getArgument());
		}
		out.append("}");
	}

	private void commandSubstitution(CommandSubstitution substitution, int depth) {
		if (substitution.getStyle() == CommandSubstitution.Style.BACKTICK) {
			out.append("`").append(substitution.getRawText()).append("`");
			return;
		}
		out.append(substitution.getStyle().getOpening());
		List<Statement> statements = substitution.getBody().getStatements();
		List<Statement> items = new ArrayList<Statement>();
		boolean inline = true;
		for (Statement statement : statements) {
			if (statement.getKind() == Statement.Kind.BLANK_LINE) {
				continue;
			}
			inline &= isSimple(statement);
			items.add(statement);
		}
		if (!inline) {
			block(statements, depth + 1);
			out.startLine(depth);
			out.append(")");
			return;
		}
		int pending = out.getPendingCount();
		boolean spaced = !items.isEmpty() && startsWithParenthesis(items.get(0));
		if (spaced) {
			out.append(" ");
		}
		inlineList(items, depth);
		if (out.getPendingCount() > pending) {
			out.startLine(depth);
		} else if (spaced) {
			out.append(" ");
		}
		out.append(")");
	}
}
