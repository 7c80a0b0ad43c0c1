package org.metricshub.bashfmt.frontend;

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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.bashfmt.ast.AndOrList;
import org.metricshub.bashfmt.ast.ArithmeticCommand;
import org.metricshub.bashfmt.ast.ArithmeticExpansion;
import org.metricshub.bashfmt.ast.ArithmeticForLoop;
import org.metricshub.bashfmt.ast.ArrayValue;
import org.metricshub.bashfmt.ast.Assignment;
import org.metricshub.bashfmt.ast.BackgroundCommand;
import org.metricshub.bashfmt.ast.BlankLine;
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
import org.metricshub.bashfmt.ast.HereString;
import org.metricshub.bashfmt.ast.IfStatement;
import org.metricshub.bashfmt.ast.LiteralWord;
import org.metricshub.bashfmt.ast.ParameterExpansion;
import org.metricshub.bashfmt.ast.Pipeline;
import org.metricshub.bashfmt.ast.Redirect;
import org.metricshub.bashfmt.ast.Script;
import org.metricshub.bashfmt.ast.SimpleCommand;
import org.metricshub.bashfmt.ast.SingleQuotedWord;
import org.metricshub.bashfmt.ast.SourceLocation;
import org.metricshub.bashfmt.ast.Statement;
import org.metricshub.bashfmt.ast.Subshell;
import org.metricshub.bashfmt.ast.UntilLoop;
import org.metricshub.bashfmt.ast.WhileLoop;
import org.metricshub.bashfmt.ast.Word;
import org.metricshub.bashfmt.frontend.peg.ParseNode;
import org.metricshub.bashfmt.util.BashFmtLogger;
import org.slf4j.Logger;

/**
 * Turns the generic parse tree of {@link BashGrammar} into the typed syntax
 * tree of the {@code ast} package.
 * <p>
 * The grammar has already validated the shape of the script, so the builder
 * does not reject anything: a construct it cannot break down (a parameter
 * expansion with an unknown operator, for instance) is kept as text in a
 * node that renders the same way.
 * <p>
 * A builder is used for a single tree. It records the {@link HereDoc} nodes
 * in the order it creates them, which is the order of their markers in the
 * source.
 */
public final class AstBuilder {

	private static final Logger LOG = BashFmtLogger.getLogger(AstBuilder.class);

	private static final Pattern PARAMETER_NAME = Pattern
			.compile("(?:" + BashGrammar.NAME_REGEX + "|[0-9]+|[@*#?$!\\-])(?:\\[[^\\]]*\\])?");

	/** Parameter expansion operators, longest first within each family. */
	private static final List<String> PARAMETER_OPERATORS = Collections
			.unmodifiableList(
					Arrays
							.asList(
									":-",
									":=",
									":+",
									":?",
									"##",
									"#",
									"%%",
									"%",
									"//",
									"/#",
									"/%",
									"/",
									"^^",
									"^",
									",,",
									",",
									":",
									"-",
									"=",
									"+",
									"?",
									"@"));

	private final String text;
	private final int[] lineStarts;
	private final List<HereDoc> hereDocs = new ArrayList<HereDoc>();

	/**
	 * @param text the text that was parsed
	 */
	public AstBuilder(String text) {
		this.text = text;
		List<Integer> starts = new ArrayList<Integer>();
		starts.add(0);
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}
		lineStarts = new int[starts.size()];
		for (int i = 0; i < lineStarts.length; i++) {
			lineStarts[i] = starts.get(i);
		}
	}

	/**
	 * @return the here-documents created so far, in creation order
	 */
	public List<HereDoc> getHereDocs() {
		return Collections.unmodifiableList(hereDocs);
	}

	/**
	 * Build the tree of a whole script.
	 *
	 * @param root the {@code script} node returned by the parser
	 * @return the typed tree
	 */
	public Script build(ParseNode root) {
		if (!root.is("script")) {
			throw new IllegalArgumentException("Expected a script node, got " + root.getName());
		}
		return new Script(location(root), statements(root.child("compound_list")));
	}

	// ==== LISTS ==============================================================

	private CompoundList compoundList(ParseNode node) {
		return new CompoundList(location(node), statements(node));
	}

	private List<Statement> statements(ParseNode list) {
		List<Statement> result = new ArrayList<Statement>();
		for (ParseNode child : list.getChildren()) {
			switch (child.getName()) {
			case "entry":
				result.add(andOr(child.child("and_or")));
				break;
			case "separator":
				if ("&".equals(child.getText()) && !result.isEmpty()) {
					Statement last = result.remove(result.size() - 1);
					result.add(new BackgroundCommand(last.getLocation(), last));
				}
				break;
			case "trailing_comment":
				result.add(new Comment(location(child), child.getText(), true));
				break;
			case "comment_line":
				result.add(new Comment(location(child), child.getText(), false));
				break;
			case "blank_line":
				result.add(new BlankLine(location(child)));
				break;
			default:
				throw unexpected(child);
			}
		}
		return result;
	}

	private Statement andOr(ParseNode node) {
		List<ParseNode> children = node.getChildren();
		Statement first = pipeline(children.get(0));
		if (children.size() == 1) {
			return first;
		}
		List<AndOrList.Link> links = new ArrayList<AndOrList.Link>();
		for (int i = 1; i + 1 < children.size(); i += 2) {
			links.add(new AndOrList.Link(children.get(i).getText(), pipeline(children.get(i + 1))));
		}
		return new AndOrList(location(node), first, links);
	}

	private Statement pipeline(ParseNode node) {
		boolean negated = false;
		List<Statement> commands = new ArrayList<Statement>();
		List<String> operators = new ArrayList<String>();
		for (ParseNode child : node.getChildren()) {
			switch (child.getName()) {
			case "bang":
				negated = true;
				break;
			case "pipe_op":
				operators.add(child.getText());
				break;
			case "command":
				commands.add(command(child));
				break;
			default:
				throw unexpected(child);
			}
		}
		if (!negated && commands.size() == 1) {
			return commands.get(0);
		}
		return new Pipeline(location(node), negated, commands, operators);
	}

	private Statement command(ParseNode node) {
		List<ParseNode> children = node.getChildren();
		ParseNode first = children.get(0);
		switch (first.getName()) {
		case "simple_command":
			return simpleCommand(first);
		case "function_fnpar":
			return functionDef(first, FunctionStyle.FNPAR);
		case "function_fnonly":
			return functionDef(first, FunctionStyle.FNONLY);
		case "function_paronly":
			return functionDef(first, FunctionStyle.PARONLY);
		default:
			return compound(first, redirects(children.subList(1, children.size())));
		}
	}

	private FunctionDef functionDef(ParseNode node, FunctionStyle style) {
		ParseNode body = node.child("function_body");
		List<ParseNode> bodyChildren = body.getChildren();
		CompoundCommand compound = compound(bodyChildren.get(0), redirects(bodyChildren.subList(1, bodyChildren.size())));
		return new FunctionDef(location(node), node.child("fname").getText(), compound, style);
	}

	// ==== COMPOUND COMMANDS ==================================================

	private CompoundCommand compound(ParseNode node, List<Redirect> redirects) {
		SourceLocation loc = location(node);
		switch (node.getName()) {
		case "brace_group":
			return new BraceGroup(loc, compoundList(node.child("compound_list")), redirects);
		case "subshell":
			return new Subshell(loc, compoundList(node.child("compound_list")), redirects);
		case "arith_command":
			return new ArithmeticCommand(loc, node.child("arith_text").getText(), redirects);
		case "cond_command":
			return new ConditionalCommand(loc, node.child("cond_text").getText(), redirects);
		case "if_clause":
			return ifStatement(node, redirects);
		case "for_clause":
			return forLoop(node, false, redirects);
		case "select_clause":
			return forLoop(node, true, redirects);
		case "arith_for_clause":
			return new ArithmeticForLoop(
					loc,
					node.child("arith_text").getText(),
					doGroup(node.child("do_group")),
					redirects);
		case "while_clause":
			return new WhileLoop(
					loc,
					compoundList(node.child("compound_list")),
					doGroup(node.child("do_group")),
					redirects);
		case "until_clause":
			return new UntilLoop(
					loc,
					compoundList(node.child("compound_list")),
					doGroup(node.child("do_group")),
					redirects);
		case "case_clause":
			return caseStatement(node, redirects);
		default:
			throw unexpected(node);
		}
	}

	private IfStatement ifStatement(ParseNode node, List<Redirect> redirects) {
		CompoundList condition = compoundList(node.child("compound_list"));
		CompoundList thenBody = compoundList(node.child("then_part").child("compound_list"));
		List<ElifClause> elifs = new ArrayList<ElifClause>();
		for (ParseNode elif : node.children("elif_part")) {
			elifs
					.add(
							new ElifClause(
									location(elif),
									compoundList(elif.child("compound_list")),
									compoundList(elif.child("then_part").child("compound_list"))));
		}
		ParseNode elsePart = node.child("else_part");
		CompoundList elseBody = elsePart == null ? null : compoundList(elsePart.child("compound_list"));
		return new IfStatement(location(node), condition, thenBody, elifs, elseBody, redirects);
	}

	private ForLoop forLoop(ParseNode node, boolean select, List<Redirect> redirects) {
		ParseNode inList = node.child("in_list");
		List<Word> words = null;
		if (inList != null) {
			words = new ArrayList<Word>();
			for (ParseNode w : inList.children("word")) {
				words.add(word(w));
			}
		}
		return new ForLoop(
				location(node),
				select,
				node.child("loop_var").getText(),
				words,
				doGroup(node.child("do_group")),
				redirects);
	}

	private CompoundList doGroup(ParseNode node) {
		return compoundList(node.child("compound_list"));
	}

	private CaseStatement caseStatement(ParseNode node, List<Redirect> redirects) {
		List<CaseClause> clauses = new ArrayList<CaseClause>();
		for (ParseNode item : node.children("case_item")) {
			List<Comment> comments = new ArrayList<Comment>();
			for (ParseNode c : item.children("comment_line")) {
				comments.add(new Comment(location(c), c.getText(), false));
			}
			List<Word> patterns = new ArrayList<Word>();
			for (ParseNode p : item.children("pattern")) {
				patterns.add(word(p.child("word")));
			}
			ParseNode terminator = item.child("case_terminator");
			clauses
					.add(
							new CaseClause(
									location(item),
									comments,
									patterns,
									compoundList(item.child("compound_list")),
									terminator == null ? ";;" : terminator.getText()));
		}
		List<Comment> trailing = new ArrayList<Comment>();
		for (ParseNode c : node.children("comment_line")) {
			trailing.add(new Comment(location(c), c.getText(), false));
		}
		return new CaseStatement(location(node), word(node.child("word")), clauses, trailing, redirects);
	}

	// ==== SIMPLE COMMANDS ====================================================

	private SimpleCommand simpleCommand(ParseNode node) {
		List<Assignment> assignments = new ArrayList<Assignment>();
		Word name = null;
		List<CommandArgument> arguments = new ArrayList<CommandArgument>();
		List<Redirect> redirects = new ArrayList<Redirect>();
		for (ParseNode child : node.getChildren()) {
			switch (child.getName()) {
			case "redirect":
				redirects.add(redirect(child));
				break;
			case "assignment":
				if (name == null) {
					assignments.add(assignment(child));
				} else {
					arguments.add(assignment(child));
				}
				break;
			case "cmd_name":
				name = word(child.child("word"));
				break;
			case "word":
				arguments.add(word(child));
				break;
			default:
				throw unexpected(child);
			}
		}
		return new SimpleCommand(location(node), assignments, name, arguments, redirects);
	}

	private Assignment assignment(ParseNode node) {
		boolean append = node.child("assign_op").getText().startsWith("+");
		ParseNode array = node.child("array_value");
		ParseNode value = node.child("word");
		ArrayValue arrayValue = null;
		if (array != null) {
			List<Word> elements = new ArrayList<Word>();
			for (ParseNode w : array.children("word")) {
				elements.add(word(w));
			}
			arrayValue = new ArrayValue(location(array), elements);
		}
		return new Assignment(
				location(node),
				node.child("assign_name").getText(),
				append,
				value == null ? null : word(value),
				arrayValue);
	}

	private List<Redirect> redirects(List<ParseNode> nodes) {
		List<Redirect> result = new ArrayList<Redirect>();
		for (ParseNode node : nodes) {
			result.add(redirect(node));
		}
		return result;
	}

	private Redirect redirect(ParseNode node) {
		if (!node.is("redirect")) {
			throw unexpected(node);
		}
		SourceLocation loc = location(node);
		ParseNode io = node.child("io_number");
		String fd = io == null ? null : io.getText();
		ParseNode hereString = node.child("here_string");
		if (hereString != null) {
			return Redirect.toHereString(loc, fd, new HereString(location(hereString), word(hereString.child("word"))));
		}
		ParseNode heredoc = node.child("heredoc");
		if (heredoc != null) {
			return Redirect.toHereDoc(loc, fd, hereDoc(heredoc));
		}
		return Redirect.toTarget(loc, fd, node.child("redirect_op").getText(), word(node.child("word")));
	}

	private HereDoc hereDoc(ParseNode node) {
		boolean stripTabs = node.child("heredoc_op").getText().endsWith("-");
		String delim = node.child("heredoc_delim").getText();
		char quote = 0;
		char first = delim.charAt(0);
		if (first == '\'' || first == '"') {
			quote = first;
			delim = delim.substring(1, delim.length() - 1);
		} else if (first == '\\') {
			quote = first;
			delim = delim.substring(1);
		}
		HereDoc result = new HereDoc(location(node), delim, stripTabs, quote);
		hereDocs.add(result);
		return result;
	}

	// ==== WORDS ==============================================================

	private Word word(ParseNode node) {
		List<Word> parts = wordParts(node.getChildren());
		if (parts.size() == 1) {
			return parts.get(0);
		}
		return new ConcatenatedWord(location(node), parts);
	}

	/**
	 * Build the parts of a word, merging adjacent literal text.
	 */
	private List<Word> wordParts(List<ParseNode> nodes) {
		List<Word> parts = new ArrayList<Word>();
		int literalStart = -1;
		int literalEnd = -1;
		for (ParseNode node : nodes) {
			boolean literal = node.is("literal") || node.is("dq_text");
			if (literal && literalStart >= 0 && literalEnd == node.getStart()) {
				literalEnd = node.getEnd();
				continue;
			}
			if (literalStart >= 0) {
				parts.add(literal(literalStart, literalEnd));
				literalStart = -1;
			}
			if (literal) {
				literalStart = node.getStart();
				literalEnd = node.getEnd();
			} else {
				parts.add(wordPart(node));
			}
		}
		if (literalStart >= 0) {
			parts.add(literal(literalStart, literalEnd));
		}
		return parts;
	}

	private LiteralWord literal(int start, int end) {
		return new LiteralWord(location(start, end), text.substring(start, end));
	}

	private Word wordPart(ParseNode node) {
		SourceLocation loc = location(node);
		String partText = node.getText();
		switch (node.getName()) {
		case "single_quoted":
			return new SingleQuotedWord(loc, partText.substring(1, partText.length() - 1), false);
		case "ansi_c_quoted":
			return new SingleQuotedWord(loc, partText.substring(2, partText.length() - 1), true);
		case "double_quoted":
			return new DoubleQuotedWord(loc, wordParts(node.getChildren()), false);
		case "locale_quoted":
			return new DoubleQuotedWord(loc, wordParts(node.getChildren()), true);
		case "param_simple":
			return ParameterExpansion.simple(loc, partText.substring(1));
		case "param_braced":
			return parameter(loc, node.child("param_text").getText());
		case "arith_expansion":
			return new ArithmeticExpansion(loc, node.child("arith_text").getText());
		case "command_sub":
			return CommandSubstitution
					.parsed(loc, CommandSubstitution.Style.DOLLAR, compoundList(node.child("compound_list")));
		case "process_sub":
			return CommandSubstitution
					.parsed(
							loc,
							partText.charAt(0) == '<' ? CommandSubstitution.Style.PROCESS_INPUT
									: CommandSubstitution.Style.PROCESS_OUTPUT,
							compoundList(node.child("compound_list")));
		case "backtick":
			return CommandSubstitution.backtick(loc, partText.substring(1, partText.length() - 1));
		default:
			throw unexpected(node);
		}
	}

	/**
	 * Break the inside of <code>${ }</code> into prefix, name, operator and
	 * argument. Falls back to the whole text as the name.
	 */
	ParameterExpansion parameter(SourceLocation loc, String inner) {
		if (inner.length() > 1 && (inner.charAt(0) == '#' || inner.charAt(0) == '!')) {
			ParameterExpansion withPrefix = parameter(loc, inner.substring(0, 1), inner.substring(1));
			if (withPrefix != null) {
				return withPrefix;
			}
		}
		ParameterExpansion plain = parameter(loc, null, inner);
		if (plain != null) {
			return plain;
		}
		LOG.debug("Keeping parameter expansion ${{}} as is", inner);
		return new ParameterExpansion(loc, inner, true, null, null, null);
	}

	private static ParameterExpansion parameter(SourceLocation loc, String prefix, String rest) {
		Matcher matcher = PARAMETER_NAME.matcher(rest);
		if (!matcher.lookingAt()) {
			return null;
		}
		String name = matcher.group();
		String tail = rest.substring(matcher.end());
		if (tail.isEmpty()) {
			return new ParameterExpansion(loc, name, true, prefix, null, null);
		}
		for (String operator : PARAMETER_OPERATORS) {
			if (tail.startsWith(operator)) {
				return new ParameterExpansion(loc, name, true, prefix, operator, tail.substring(operator.length()));
			}
		}
		return null;
	}

	// ==== LOCATIONS ==========================================================

	private SourceLocation location(ParseNode node) {
		return location(node.getStart(), node.getEnd());
	}

	private SourceLocation location(int start, int end) {
		int index = Arrays.binarySearch(lineStarts, start);
		int line = index >= 0 ? index : -index - 2;
		return new SourceLocation(line + 1, start - lineStarts[line] + 1, start, end - start);
	}

	private static IllegalStateException unexpected(ParseNode node) {
		return new IllegalStateException("Unexpected " + node.getName() + " node at offset " + node.getStart());
	}
}
