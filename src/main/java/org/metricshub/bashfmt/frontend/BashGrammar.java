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

import org.metricshub.bashfmt.frontend.peg.Grammar;
import org.metricshub.bashfmt.frontend.peg.NamedRule;
import org.metricshub.bashfmt.frontend.peg.Rule;

/**
 * Parsing expression grammar of the subset of Bash understood by the
 * formatter.
 * <p>
 * The rule names are the contract with {@link AstBuilder}: every named rule
 * produces a node of the same name in the generic parse tree. Here-document
 * bodies are not part of this grammar; they are removed from the text by
 * {@link HeredocPreprocessor} beforehand, so that only the
 * <code>&lt;&lt;DELIM</code> marker remains for the grammar to see.
 * <p>
 * The grammar holds no per-parse state and one instance can be shared by all
 * parses.
 */
public final class BashGrammar extends Grammar {

	/** Characters after which a keyword or reserved word ends. */
	private static final String DELIMITER_AHEAD = "(?![^\\s;&|()<>])";

	/** Name of a shell variable. */
	static final String NAME_REGEX = "[A-Za-z_][A-Za-z0-9_]*";

	// ==== LEXICAL ===========================================================

	/** Blanks, including escaped line continuations. */
	private final Rule ws = regex("(?:[ \\t]++|\\\\\\n)++");

	private final Rule sp = optional(ws);

	/** Blanks and newlines, without comments. */
	private final Rule gap = regex("(?:[ \\t\\n]++|\\\\\\n)*+");

	private final Rule reservedWord = regex("(?:then|else|elif|fi|done|do|esac|in|\\})" + DELIMITER_AHEAD);

	/** Words opening a compound command, never the name of a simple command. */
	private final Rule compoundStart = regex("(?:if|case|while|until|for|select|function|\\{)" + DELIMITER_AHEAD);

	public final NamedRule comment_line = rule("comment_line", regex("#[^\\n]*"));
	public final NamedRule trailing_comment = rule("trailing_comment", regex("#[^\\n]*"));
	public final NamedRule blank_line = rule("blank_line", "\n");

	// ==== WORDS =============================================================

	public final NamedRule word = declare("word");
	public final NamedRule compound_list = declare("compound_list");
	public final NamedRule body_list = declare("compound_list");

	public final NamedRule single_quoted = rule("single_quoted", regex("'[^']*'"));

	public final NamedRule ansi_c_quoted = rule("ansi_c_quoted", regex("\\$'(?:[^'\\\\]++|\\\\[\\s\\S])*+'"));

	public final NamedRule arith_text = rule("arith_text", scan("arithmetic expression", BashGrammar::scanArithmetic));

	public final NamedRule arith_expansion = rule("arith_expansion", seq("$((", arith_text, "))"));

	public final NamedRule command_sub = rule("command_sub", seq("$(", body_list, gap, ")"));

	public final NamedRule process_sub = rule(
			"process_sub",
			seq(regex("[<>]\\("), body_list, gap, ")"));

	public final NamedRule backtick = rule("backtick", regex("`(?:[^`\\\\]++|\\\\[\\s\\S])*+`"));

	public final NamedRule param_text = rule("param_text", scan("parameter expression", BashGrammar::scanBracedParameter));

	public final NamedRule param_braced = rule("param_braced", seq("${", param_text, "}"));

	public final NamedRule param_simple = rule("param_simple", regex("\\$(?:" + NAME_REGEX + "|[0-9]|[@*#?$!\\-])"));

	private final Rule expansion = choice(arith_expansion, command_sub, param_braced, param_simple);

	/** Literal text inside double quotes, including escapes and lone dollars. */
	public final NamedRule dq_text = rule(
			"dq_text",
			regex("(?:[^$`\"\\\\]++|\\\\[\\s\\S]|\\$(?![A-Za-z_0-9@*#?$!{(\\-]))++"));

	private final Rule dqPart = choice(expansion, backtick, dq_text);

	public final NamedRule double_quoted = rule("double_quoted", seq("\"", zeroOrMore(dqPart), "\""));

	public final NamedRule locale_quoted = rule("locale_quoted", seq("$\"", zeroOrMore(dqPart), "\""));

	public final NamedRule literal = rule(
			"literal",
			choice(
					regex("(?:[^\\s|&;()<>\\\\\"'`$]++|\\\\[\\s\\S])++"),
					regex("\\$(?![A-Za-z_0-9@*#?$!{(\\-'\"])")));

	/** First part of a word: a bare '#' would start a comment instead. */
	public final NamedRule literal_first = rule(
			"literal",
			choice(
					regex("(?:[^\\s|&;()<>\\\\\"'`$#]|\\\\[^\\n])(?:[^\\s|&;()<>\\\\\"'`$]++|\\\\[\\s\\S])*+"),
					regex("\\$(?![A-Za-z_0-9@*#?$!{(\\-'\"])")));

	private final Rule quotedOrExpansion = choice(
			ansi_c_quoted,
			locale_quoted,
			single_quoted,
			double_quoted,
			expansion,
			backtick,
			process_sub);

	{
		define(word, seq(choice(quotedOrExpansion, literal_first), zeroOrMore(choice(quotedOrExpansion, literal))));
	}

	// ==== REDIRECTIONS ======================================================

	public final NamedRule io_number = rule("io_number", regex("[0-9]+(?=[<>])"));

	public final NamedRule redirect_op = rule("redirect_op", regex("&>>|&>|>>|<>|<&|>&|>\\||<|>"));

	public final NamedRule here_string = rule("here_string", seq("<<<", sp, word));

	public final NamedRule heredoc_op = rule("heredoc_op", regex("(?:(?<=[\\s0-9])|^)<<-?(?!<)"));

	public final NamedRule heredoc_delim = rule(
			"heredoc_delim",
			regex(
					"'" + NAME_REGEX + "'|\"" + NAME_REGEX + "\"|\\\\" + NAME_REGEX + DELIMITER_AHEAD + "|" + NAME_REGEX
							+ DELIMITER_AHEAD));

	public final NamedRule heredoc = rule("heredoc", seq(heredoc_op, sp, heredoc_delim));

	public final NamedRule redirect = rule(
			"redirect",
			seq(optional(io_number), choice(here_string, heredoc, seq(redirect_op, sp, word))));

	private final Rule redirectList = oneOrMore(seq(sp, redirect));

	// ==== SIMPLE COMMANDS ===================================================

	public final NamedRule assign_name = rule("assign_name", regex(NAME_REGEX + "(?:\\[[^\\]\\n]*\\])?(?=\\+?=)"));

	public final NamedRule assign_op = rule("assign_op", regex("\\+?="));

	private final Rule arrayGap = regex("(?:[ \\t\\n]++|\\\\\\n)*+");

	public final NamedRule array_value = rule("array_value", seq("(", zeroOrMore(seq(arrayGap, word)), arrayGap, ")"));

	public final NamedRule assignment = rule("assignment", seq(assign_name, assign_op, optional(choice(array_value, word))));

	/** Array assignment given as a command argument, e.g. {@code local a=(1 2)}. */
	public final NamedRule array_argument = rule("assignment", seq(assign_name, assign_op, array_value));

	public final NamedRule cmd_name = rule("cmd_name", word);

	private final Rule suffixItem = choice(seq(sp, redirect), seq(ws, choice(array_argument, word)));

	private final Rule prefixItem = choice(redirect, assignment);

	public final NamedRule simple_command = rule(
			"simple_command",
			choice(
					seq(
							prefixItem,
							zeroOrMore(seq(sp, prefixItem)),
							optional(seq(ws, not(reservedWord), cmd_name, zeroOrMore(suffixItem)))),
					seq(cmd_name, zeroOrMore(suffixItem))));

	// ==== COMPOUND COMMANDS =================================================

	public final NamedRule command = declare("command");

	public final NamedRule brace_group = rule("brace_group", seq("{", and(regex("\\s")), body_list, sp, "}"));

	public final NamedRule subshell = rule("subshell", seq("(", body_list, gap, ")"));

	public final NamedRule arith_command = rule("arith_command", seq("((", arith_text, "))"));

	public final NamedRule cond_text = rule("cond_text", scan("conditional expression", BashGrammar::scanConditional));

	public final NamedRule cond_command = rule("cond_command", seq("[[", cond_text, "]]"));

	public final NamedRule then_part = rule("then_part", seq(kw("then"), body_list));

	public final NamedRule elif_part = rule("elif_part", seq(sp, kw("elif"), body_list, sp, then_part));

	public final NamedRule else_part = rule("else_part", seq(sp, kw("else"), body_list));

	public final NamedRule if_clause = rule(
			"if_clause",
			seq(kw("if"), body_list, sp, then_part, zeroOrMore(elif_part), optional(else_part), sp, kw("fi")));

	public final NamedRule do_group = rule("do_group", seq(sp, kw("do"), body_list, sp, kw("done")));

	public final NamedRule loop_var = rule("loop_var", regex(NAME_REGEX));

	public final NamedRule in_list = rule("in_list", seq(gap, kw("in"), zeroOrMore(seq(ws, not(reservedWord), word))));

	private final Rule loopSeparator = seq(sp, optional(";"), gap);

	public final NamedRule for_clause = rule(
			"for_clause",
			seq(kw("for"), ws, loop_var, optional(in_list), loopSeparator, do_group));

	public final NamedRule select_clause = rule(
			"select_clause",
			seq(kw("select"), ws, loop_var, optional(in_list), loopSeparator, do_group));

	public final NamedRule arith_for_clause = rule(
			"arith_for_clause",
			seq(kw("for"), sp, "((", arith_text, "))", loopSeparator, do_group));

	public final NamedRule while_clause = rule("while_clause", seq(kw("while"), body_list, do_group));

	public final NamedRule until_clause = rule("until_clause", seq(kw("until"), body_list, do_group));

	public final NamedRule pattern = rule("pattern", word);

	public final NamedRule case_terminator = rule("case_terminator", regex(";;&|;;|;&"));

	/** Blanks, newlines and whole-line comments between case items. */
	private final Rule caseGap = zeroOrMore(choice(regex("(?:[ \\t\\n]++|\\\\\\n)++"), comment_line));

	public final NamedRule case_item = rule(
			"case_item",
			seq(
					caseGap,
					not(kw("esac")),
					optional("("),
					sp,
					pattern,
					zeroOrMore(seq(sp, "|", sp, pattern)),
					sp,
					")",
					body_list,
					sp,
					optional(case_terminator)));

	public final NamedRule case_clause = rule(
			"case_clause",
			seq(kw("case"), ws, word, gap, kw("in"), zeroOrMore(case_item), caseGap, kw("esac")));

	private final Rule compoundCommand = choice(
			brace_group,
			arith_command,
			subshell,
			cond_command,
			arith_for_clause,
			for_clause,
			select_clause,
			case_clause,
			if_clause,
			while_clause,
			until_clause);

	// ==== FUNCTIONS =========================================================

	public final NamedRule fname = rule("fname", regex("[A-Za-z_][A-Za-z0-9_:@.\\-]*"));

	public final NamedRule function_body = rule("function_body", seq(compoundCommand, optional(redirectList)));

	public final NamedRule function_fnpar = rule(
			"function_fnpar",
			seq(kw("function"), ws, fname, sp, "(", sp, ")", gap, function_body));

	public final NamedRule function_fnonly = rule(
			"function_fnonly",
			seq(kw("function"), ws, fname, sp, not("("), gap, function_body));

	public final NamedRule function_paronly = rule(
			"function_paronly",
			seq(fname, sp, "(", sp, ")", gap, function_body));

	// ==== LISTS =============================================================

	public final NamedRule bang = rule("bang", seq("!", and(ws)));

	public final NamedRule pipe_op = rule("pipe_op", regex("\\|&|\\|(?!\\|)"));

	public final NamedRule pipeline = rule(
			"pipeline",
			seq(optional(seq(bang, ws)), command, zeroOrMore(seq(sp, pipe_op, gap, command))));

	public final NamedRule andor_op = rule("andor_op", regex("&&|\\|\\|"));

	public final NamedRule and_or = rule("and_or", seq(pipeline, zeroOrMore(seq(sp, andor_op, gap, pipeline))));

	public final NamedRule entry = rule("entry", seq(not(reservedWord), and_or));

	public final NamedRule separator = rule("separator", regex(";(?![;&])|&(?![&>])"));

	private final Rule closer = choice(")", ";;", ";&", reservedWord);

	private final Rule lineEnd = choice("\n", eof(), and(closer));

	private final Rule entries = seq(
			entry,
			zeroOrMore(seq(sp, separator, sp, entry)),
			optional(seq(sp, separator)),
			optional(seq(sp, trailing_comment)),
			sp,
			lineEnd);

	private final Rule listLine = seq(sp, choice(blank_line, seq(comment_line, optional("\n")), entries));

	public final NamedRule script = declare("script");

	{
		define(
				command,
				choice(
						seq(compoundCommand, optional(redirectList)),
						function_fnpar,
						function_fnonly,
						function_paronly,
						seq(not(reservedWord), not(compoundStart), simple_command)));
		define(compound_list, zeroOrMore(listLine));
		// bodies swallow the remainder of their header line first
		define(body_list, seq(optional(seq(sp, trailing_comment)), sp, optional("\n"), zeroOrMore(listLine)));
		define(script, seq(compound_list, sp, eof()));
	}

	@Override
	public Rule root() {
		return script;
	}

	/**
	 * Keyword, only when followed by a delimiter.
	 */
	private static Rule kw(String keyword) {
		return regex(keyword + DELIMITER_AHEAD);
	}

	// ==== SCANNERS ==========================================================

	/**
	 * Scan the body of {@code $(( ))} or {@code (( ))}: balanced parentheses up
	 * to the closing {@code ))} at depth zero, which is not consumed.
	 */
	static int scanArithmetic(String text, int pos) {
		int depth = 0;
		int i = pos;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			} else if (c == '\'' || c == '"') {
				int close = skipQuoted(text, i);
				if (close < 0) {
					return Rule.FAIL;
				}
				i = close;
				continue;
			} else if (c == '(') {
				depth++;
			} else if (c == ')') {
				if (depth == 0) {
					return i + 1 < text.length() && text.charAt(i + 1) == ')' ? i : Rule.FAIL;
				}
				depth--;
			}
			i++;
		}
		return Rule.FAIL;
	}

	/**
	 * Scan the inside of <code>${ }</code> up to the matching closing brace,
	 * which is not consumed. Nested braces and quoted text are skipped.
	 */
	static int scanBracedParameter(String text, int pos) {
		int depth = 0;
		int i = pos;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			} else if (c == '\'' || c == '"') {
				int close = skipQuoted(text, i);
				if (close < 0) {
					return Rule.FAIL;
				}
				i = close;
				continue;
			} else if (c == '{') {
				depth++;
			} else if (c == '}') {
				if (depth == 0) {
					return i > pos ? i : Rule.FAIL;
				}
				depth--;
			}
			i++;
		}
		return Rule.FAIL;
	}

	/**
	 * Scan the inside of {@code [[ ]]} up to the first {@code ]]} that follows a
	 * blank and is followed by a delimiter. The text must start with a blank.
	 */
	static int scanConditional(String text, int pos) {
		if (pos >= text.length() || !Character.isWhitespace(text.charAt(pos))) {
			return Rule.FAIL;
		}
		int i = pos;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			} else if (c == '\'' || c == '"') {
				int close = skipQuoted(text, i);
				if (close < 0) {
					return Rule.FAIL;
				}
				i = close;
				continue;
			} else if (c == ']' && text.startsWith("]]", i) && Character.isWhitespace(text.charAt(i - 1))) {
				int after = i + 2;
				if (after == text.length() || " \t\n;&|()<>".indexOf(text.charAt(after)) >= 0) {
					return i;
				}
			}
			i++;
		}
		return Rule.FAIL;
	}

	/**
	 * @return offset just past the closing quote, or -1 if it is missing
	 */
	private static int skipQuoted(String text, int open) {
		char quote = text.charAt(open);
		int i = open + 1;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (quote == '"' && c == '\\') {
				i += 2;
				continue;
			}
			if (c == quote) {
				return i + 1;
			}
			i++;
		}
		return -1;
	}
}
