/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.stacker;

import static org.stacker.Stacker.logV;

/**
 * A left to right scanner over a single statement line
 * <p>The cursor only ever moves forward. Lookahead methods ({@link #peekLabel()}, {@link #peekDisabled()} and
 * {@link #takeToken(TokenType, boolean)} with required = false) leave the position untouched when the token
 * is not there.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class LineCursor {
	private static final String LOG_TAG = LineCursor.class.getSimpleName ();
	private static final boolean DEBUG = false;

	public static final char LABEL_MARKER = '#';
	public static final char DISABLED_MARKER = '!';
	public static final char QUOTE = '"';
	public static final String ARROW = "->";

	/** Token types the cursor can take */
	public static enum TokenType {
		ARROW,
		PARAMETER,
		LITERAL
	}

	private final String line;
	private int position = 0;

	public LineCursor (String line) {
		this.line = (line == null ? "" : line);
	}

	/**
	 * Takes a leading label if there is one, whitespace before the marker is skipped
	 *
	 * @return The label without its marker, or null if the line does not start with a label
	 * @throws BlockException MISSING_LABEL if the marker is not followed by a name
	 */
	public String peekLabel () throws BlockException {
		int start = skipWhitespace (position);

		if (start >= line.length () || line.charAt (start) != LABEL_MARKER)
			return null;

		int end = start + 1;
		while (end < line.length () && !Character.isWhitespace (line.charAt (end)))
			++end;

		if (end == start + 1)
			throw BlockException.missingLabel ();

		String label = line.substring (start + 1, end);
		position = end;

		if (DEBUG)
			logV (LOG_TAG, "Label: " + label);

		return label;
	}

	/**
	 * Takes a leading disable marker if there is one
	 *
	 * @return True if the marker was present and consumed
	 */
	public boolean peekDisabled () {
		if (position < line.length () && line.charAt (position) == DISABLED_MARKER) {
			++position;
			return true;
		}

		return false;
	}

	/**
	 * Takes a quoted literal
	 *
	 * @param fieldName Name of the field being read, reported on failure
	 * @return The text between the quotes
	 * @throws BlockException MISSING_OPERAND if there is no opening quote, UNTERMINATED_LITERAL if there is no closing one
	 */
	public String takeLiteral (String fieldName) throws BlockException {
		int start = skipWhitespace (position);

		if (start >= line.length () || line.charAt (start) != QUOTE)
			throw BlockException.missingOperand (fieldName);

		int end = line.indexOf (QUOTE, start + 1);
		if (end < 0)
			throw BlockException.unterminatedLiteral (fieldName);

		position = end + 1;
		return line.substring (start + 1, end);
	}

	/**
	 * Takes a token of the given type
	 *
	 * @param type The type of token expected next
	 * @param required Whether absence of the token is a failure
	 * @return The token (the inner text for a literal), or an empty string if it is absent and not required
	 * @throws BlockException MISSING_TOKEN if required and absent, UNTERMINATED_LITERAL for an open literal
	 */
	public String takeToken (TokenType type, boolean required) throws BlockException {
		int start = skipWhitespace (position);
		String token = null;

		if (type == TokenType.ARROW) {
			if (line.startsWith (ARROW, start)) {
				token = ARROW;
				position = start + ARROW.length ();
			}
		} else if (type == TokenType.PARAMETER) {
			int end = start;
			while (end < line.length () && !Character.isWhitespace (line.charAt (end)))
				++end;

			if (end > start) {
				token = line.substring (start, end);
				position = end;
			}
		} else if (type == TokenType.LITERAL) {
			if (start < line.length () && line.charAt (start) == QUOTE)
				token = takeLiteral (type.toString ().toLowerCase ());
		}

		if (token == null) {
			if (required)
				throw BlockException.missingToken (type.toString ().toLowerCase ());

			return "";
		}

		if (DEBUG)
			logV (LOG_TAG, type + ": " + token);

		return token;
	}

	/**
	 * @return The unconsumed text with surrounding whitespace removed
	 */
	public String remaining () {
		return line.substring (position).trim ();
	}

	/**
	 * @return True if nothing but whitespace is left
	 */
	public boolean exhausted () {
		return skipWhitespace (position) >= line.length ();
	}

	private int skipWhitespace (int from) {
		while (from < line.length () && Character.isWhitespace (line.charAt (from)))
			++from;

		return from;
	}
}
