package org.metricshub.bashfmt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.metricshub.bashfmt.ast.FunctionStyle;
import org.metricshub.bashfmt.backend.VariableStyle;
import org.metricshub.bashfmt.util.FormatSettings;

/**
 * Fluent builder of formatting test cases.
 *
 * <pre>
 * formatTest("if header").source("if true;then\necho\nfi").indent(2).expect("if true; then\n  echo\nfi").runAndAssert();
 * </pre>
 *
 * Unless told otherwise, a successful case also checks that formatting the
 * expected output again leaves it unchanged.
 */
public final class FormatTestSupport {

	private FormatTestSupport() {}

	/**
	 * Creates a builder for a formatting test.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a new builder
	 */
	public static FormatTestBuilder formatTest(String description) {
		return new FormatTestBuilder(description);
	}

	/**
	 * Builder of a single formatting test case.
	 */
	public static final class FormatTestBuilder {
		private final String description;
		private final FormatSettings settings = new FormatSettings();
		private String source;
		private String expected;
		private boolean expectError;
		private boolean checkIdempotence = true;

		private FormatTestBuilder(String description) {
			this.description = description;
		}

		public FormatTestBuilder source(String text) {
			this.source = text;
			return this;
		}

		public FormatTestBuilder indent(int size) {
			settings.setIndentSize(size);
			return this;
		}

		public FormatTestBuilder tab() {
			settings.setTab(true);
			return this;
		}

		public FormatTestBuilder functionStyle(FunctionStyle style) {
			settings.setFunctionStyle(style);
			return this;
		}

		public FormatTestBuilder variableStyle(VariableStyle style) {
			settings.setVariableStyle(style);
			return this;
		}

		public FormatTestBuilder expect(String text) {
			this.expected = text;
			return this;
		}

		/**
		 * Expect the source to be rejected and returned unchanged.
		 *
		 * @return this builder for method chaining
		 */
		public FormatTestBuilder expectError() {
			this.expectError = true;
			return this;
		}

		/**
		 * Expect the source to come out unchanged.
		 *
		 * @return this builder for method chaining
		 */
		public FormatTestBuilder expectUnchanged() {
			this.expected = source;
			return this;
		}

		public FormatTestBuilder skipIdempotence() {
			this.checkIdempotence = false;
			return this;
		}

		/**
		 * Formats the source and returns the result without asserting anything.
		 *
		 * @return the result of the formatting
		 */
		public FormatResult run() {
			if (source == null) {
				throw new IllegalStateException("No source given for " + description);
			}
			return new BashFmt(settings).format(source, description);
		}

		/**
		 * Formats the source and checks the expectations.
		 */
		public void runAndAssert() {
			FormatResult result = run();
			if (expectError) {
				assertTrue(description + ": expected a parse error", result.hasError());
				assertEquals(description + ": input must be returned as is", source, result.getFormatted());
				return;
			}
			assertFalse(description + ": unexpected parse error", result.hasError());
			if (expected != null) {
				assertEquals(description, expected, result.getFormatted());
			}
			if (checkIdempotence) {
				FormatResult again = new BashFmt(settings).format(result.getFormatted(), description);
				assertFalse(description + ": formatted output does not parse", again.hasError());
				assertEquals(description + ": formatting is not idempotent", result.getFormatted(), again.getFormatted());
			}
		}
	}
}
