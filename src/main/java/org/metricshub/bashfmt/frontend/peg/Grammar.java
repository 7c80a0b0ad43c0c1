package org.metricshub.bashfmt.frontend.peg;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class of parsing expression grammars.
 * <p>
 * Subclasses declare their rules as fields built with the combinators below,
 * for instance:
 *
 * <pre>
 * NamedRule assignment = rule("assignment", seq(name, choice("+=", "="), optional(word)));
 * </pre>
 *
 * Operands may be given either as {@link Rule} instances or as plain strings,
 * which are matched literally. Forward references are expressed by declaring
 * a rule first with {@link #declare(String)} and defining it later with
 * {@link #define(NamedRule, Object)}.
 * <p>
 * Choices are ordered: the first alternative that matches wins, and
 * repetitions are greedy, as usual with PEGs.
 */
public abstract class Grammar {

	private int nextRuleId;

	/**
	 * @return the start rule of this grammar
	 */
	public abstract Rule root();

	/**
	 * Parse the given text with the {@link #root()} rule.
	 *
	 * @param ctx context holding the text to parse
	 * @return the root node, or {@code null} if the text does not match
	 */
	public ParseNode parse(ParseContext ctx) {
		return ctx.parse(root());
	}

	// ==== RULE DECLARATION ===================================================

	protected final NamedRule declare(String name) {
		return new NamedRule(name, nextRuleId++);
	}

	protected final NamedRule define(NamedRule rule, Object expr) {
		rule.define(toRule(expr));
		return rule;
	}

	protected final NamedRule rule(String name, Object expr) {
		return define(declare(name), expr);
	}

	// ==== COMBINATORS ========================================================

	protected static Rule seq(Object... items) {
		return new Sequence(toRules(items));
	}

	protected static Rule choice(Object... alternatives) {
		return new Choice(toRules(alternatives));
	}

	protected static Rule zeroOrMore(Object item) {
		return new Repeat(toRule(item), 0);
	}

	protected static Rule oneOrMore(Object item) {
		return new Repeat(toRule(item), 1);
	}

	protected static Rule optional(Object item) {
		return new Optional(toRule(item));
	}

	protected static Rule not(Object item) {
		return new Lookahead(toRule(item), false);
	}

	protected static Rule and(Object item) {
		return new Lookahead(toRule(item), true);
	}

	protected static Rule literal(String text) {
		return new Literal(text);
	}

	/**
	 * Regex leaf. The pattern is matched at the current position with
	 * transparent bounds, so look-behind constructs may inspect the text
	 * before the position.
	 *
	 * @param regex regular expression
	 * @return the leaf rule
	 */
	protected static Rule regex(String regex) {
		return new RegexLeaf(Pattern.compile(regex));
	}

	/**
	 * Leaf matched by custom code, for tokens a regular expression cannot
	 * describe (balanced delimiters, for instance).
	 *
	 * @param description description used in error messages
	 * @param scanner code returning the end offset of the token, or
	 *        {@link Rule#FAIL}
	 * @return the leaf rule
	 */
	protected static Rule scan(String description, Scanner scanner) {
		return new ScanLeaf(description, scanner);
	}

	protected static Rule eof() {
		return EndOfInput.INSTANCE;
	}

	/**
	 * Custom leaf matcher used by {@link Grammar#scan(String, Scanner)}.
	 */
	@FunctionalInterface
	public interface Scanner {
		/**
		 * @param text whole input
		 * @param pos position where the token should start
		 * @return offset just past the token, or {@link Rule#FAIL}
		 */
		int scan(String text, int pos);
	}

	private static Rule toRule(Object item) {
		if (item instanceof Rule) {
			return (Rule) item;
		} else if (item instanceof String) {
			return new Literal((String) item);
		}
		throw new IllegalArgumentException("Not a rule: " + item);
	}

	private static Rule[] toRules(Object[] items) {
		Rule[] rules = new Rule[items.length];
		for (int i = 0; i < items.length; i++) {
			rules[i] = toRule(items[i]);
		}
		return rules;
	}

	private static void truncate(List<ParseNode> out, int size) {
		while (out.size() > size) {
			out.remove(out.size() - 1);
		}
	}

	// ==== IMPLEMENTATIONS ====================================================

	private static final class Sequence extends Rule {
		private final Rule[] items;

		private Sequence(Rule[] items) {
			this.items = items;
		}

		@Override
		protected int match(ParseContext ctx, int pos, List<ParseNode> out) {
			int mark = out.size();
			int current = pos;
			for (Rule item : items) {
				current = item.match(ctx, current, out);
				if (current == FAIL) {
					truncate(out, mark);
					return FAIL;
				}
			}
			return current;
		}

		@Override
		protected String describe() {
			return items.length > 0 ? items[0].describe() : "nothing";
		}
	}

	private static final class Choice extends Rule {
		private final Rule[] alternatives;

		private Choice(Rule[] alternatives) {
			this.alternatives = alternatives;
		}

		@Override
		protected int match(ParseContext ctx, int pos, List<ParseNode> out) {
			int mark = out.size();
			for (Rule alternative : alternatives) {
				int end = alternative.match(ctx, pos, out);
				if (end != FAIL) {
					return end;
				}
				truncate(out, mark);
			}
			return FAIL;
		}

		@Override
		protected String describe() {
			List<String> names = new ArrayList<String>();
			for (Rule alternative : alternatives) {
				names.add(alternative.describe());
			}
			return String.join(" or ", names);
		}
	}

	private static final class Repeat extends Rule {
		private final Rule item;
		private final int min;

		private Repeat(Rule item, int min) {
			this.item = item;
			this.min = min;
		}

		@Override
		protected int match(ParseContext ctx, int pos, List<ParseNode> out) {
			int mark = out.size();
			int count = 0;
			int current = pos;
			while (true) {
				int before = out.size();
				int end = item.match(ctx, current, out);
				if (end == FAIL) {
					truncate(out, before);
					break;
				}
				count++;
				if (end == current) {
					// empty match, stop to avoid looping forever
					break;
				}
				current = end;
			}
			if (count < min) {
				truncate(out, mark);
				return FAIL;
			}
			return current;
		}

		@Override
		protected String describe() {
			return item.describe();
		}
	}

	private static final class Optional extends Rule {
		private final Rule item;

		private Optional(Rule item) {
			this.item = item;
		}

		@Override
		protected int match(ParseContext ctx, int pos, List<ParseNode> out) {
			int mark = out.size();
			int end = item.match(ctx, pos, out);
			if (end == FAIL) {
				truncate(out, mark);
				return pos;
			}
			return end;
		}

		@Override
		protected String describe() {
			return item.describe();
		}
	}

	private static final class Lookahead extends Rule {
		private final Rule item;
		private final boolean positive;

		private Lookahead(Rule item, boolean positive) {
			this.item = item;
			this.positive = positive;
		}

		@Override
		protected int match(ParseContext ctx, int pos, List<ParseNode> out) {
			List<ParseNode> discarded = new ArrayList<ParseNode>();
			ctx.enterLookahead();
			int end;
			try {
				end = item.match(ctx, pos, discarded);
			} finally {
				ctx.exitLookahead();
			}
			boolean matched = end != FAIL;
			if (matched == positive) {
				return pos;
			}
			if (positive) {
				ctx.fail(pos, item.describe());
			}
			return FAIL;
		}

		@Override
		protected String describe() {
			return (positive ? "" : "not ") + item.describe();
		}
	}

	private static final class Literal extends Rule {
		private final String text;

		private Literal(String text) {
			this.text = text;
		}

		@Override
		protected int match(ParseContext ctx, int pos, List<ParseNode> out) {
			if (ctx.getText().startsWith(text, pos)) {
				return pos + text.length();
			}
			ctx.fail(pos, describe());
			return FAIL;
		}

		@Override
		protected String describe() {
			return "\"" + text.replace("\n", "\\n") + "\"";
		}
	}

	private static final class RegexLeaf extends Rule {
		private final Pattern pattern;

		private RegexLeaf(Pattern pattern) {
			this.pattern = pattern;
		}

		@Override
		protected int match(ParseContext ctx, int pos, List<ParseNode> out) {
			String text = ctx.getText();
			Matcher matcher = pattern.matcher(text);
			matcher.region(pos, text.length());
			matcher.useTransparentBounds(true);
			matcher.useAnchoringBounds(false);
			if (matcher.lookingAt()) {
				return matcher.end();
			}
			ctx.fail(pos, describe());
			return FAIL;
		}

		@Override
		protected String describe() {
			return "/" + pattern.pattern() + "/";
		}
	}

	private static final class ScanLeaf extends Rule {
		private final String description;
		private final Scanner scanner;

		private ScanLeaf(String description, Scanner scanner) {
			this.description = description;
			this.scanner = scanner;
		}

		@Override
		protected int match(ParseContext ctx, int pos, List<ParseNode> out) {
			int end = scanner.scan(ctx.getText(), pos);
			if (end == FAIL) {
				ctx.fail(pos, description);
			}
			return end;
		}

		@Override
		protected String describe() {
			return description;
		}
	}

	private static final class EndOfInput extends Rule {
		private static final EndOfInput INSTANCE = new EndOfInput();

		@Override
		protected int match(ParseContext ctx, int pos, List<ParseNode> out) {
			if (pos == ctx.getText().length()) {
				return pos;
			}
			ctx.fail(pos, describe());
			return FAIL;
		}

		@Override
		protected String describe() {
			return "end of input";
		}
	}
}
