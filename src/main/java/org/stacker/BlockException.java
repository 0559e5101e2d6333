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

/**
 * Raised when a statement line cannot be parsed, or a parsed block cannot be executed
 * <p>The {@link ErrorKind} classifies the failure; {@link #field()} and {@link #value()} carry the name of the
 * offending field (or token type, or block name) and the raw text involved, where the kind has them.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class BlockException extends Exception {
	private static final long serialVersionUID = 1L;

	/** The classes of failure the parser and executor report */
	public static enum ErrorKind {
		MISSING_LABEL,
		MISSING_OPERAND,
		UNTERMINATED_LITERAL,
		MISSING_TOKEN,
		INVALID_OUTPUT_KIND,
		MISSING_OUTPUT_NAME,
		UNKNOWN_BLOCK,
		UNEXPECTED_CONTENT,
		OPERAND_NOT_INTEGER
	}

	private final ErrorKind kind;
	private final String field;
	private final String value;

	public BlockException (ErrorKind kind, String field, String value, String message) {
		this (kind, field, value, message, null);
	}

	public BlockException (ErrorKind kind, String field, String value, String message, Throwable cause) {
		super (message, cause);
		this.kind = kind;
		this.field = field;
		this.value = value;
	}

	public static BlockException missingLabel () {
		return new BlockException (ErrorKind.MISSING_LABEL, null, null, "Label marker is not followed by a name");
	}

	public static BlockException missingOperand (String field) {
		return new BlockException (ErrorKind.MISSING_OPERAND, field, null, "Missing literal for " + field);
	}

	public static BlockException unterminatedLiteral (String field) {
		return new BlockException (ErrorKind.UNTERMINATED_LITERAL, field, null, "Unterminated literal for " + field);
	}

	public static BlockException missingToken (String type) {
		return new BlockException (ErrorKind.MISSING_TOKEN, type, null, "Missing " + type);
	}

	public static BlockException invalidOutputKind (String value, Throwable cause) {
		return new BlockException (ErrorKind.INVALID_OUTPUT_KIND, null, value, "Invalid or missing variable type" + (value == null || value.isEmpty () ? "" : ": " + value), cause);
	}

	public static BlockException missingOutputName (Throwable cause) {
		return new BlockException (ErrorKind.MISSING_OUTPUT_NAME, null, null, "Variable name not specified", cause);
	}

	public static BlockException unknownBlock (String name) {
		return new BlockException (ErrorKind.UNKNOWN_BLOCK, name, null, name == null || name.isEmpty () ? "Missing block name" : "Unknown block: " + name);
	}

	public static BlockException unexpectedContent (String text) {
		return new BlockException (ErrorKind.UNEXPECTED_CONTENT, null, text, "Unexpected content after statement: " + text);
	}

	public static BlockException operandNotInteger (String field, String value, Throwable cause) {
		return new BlockException (ErrorKind.OPERAND_NOT_INTEGER, field, value, field + " is not an integer: " + value, cause);
	}

	/**
	 * @return The class of failure
	 */
	public ErrorKind kind () {
		return kind;
	}

	/**
	 * @return Field name, token type or block name related to the failure, or null if not relevant
	 */
	public String field () {
		return field;
	}

	/**
	 * @return Raw text related to the failure, or null if not relevant
	 */
	public String value () {
		return value;
	}
}
