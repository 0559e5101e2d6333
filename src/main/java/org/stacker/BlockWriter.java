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
 * Writes a {@link Block} back out as a canonical statement line
 * <p>The writer mirrors the {@link BlockParser} grammar token for token, separating tokens with single spaces. A
 * default label is left out, so the text written may differ from the text that was parsed while the parsed
 * block stays the same.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class BlockWriter {
	private static final String INDENT = "\t";

	private final BlockKind kind;
	private final StringBuilder sb = new StringBuilder ();
	private boolean tokenWritten = false;

	/**
	 * @param kind Kind of the block being written, used to recognise its default label
	 * @param indent Whether the line is indented within its surrounding script
	 * @param disabled Whether to mark the line as disabled
	 */
	public BlockWriter (BlockKind kind, boolean indent, boolean disabled) {
		this.kind = kind;

		if (indent)
			sb.append (INDENT);

		if (disabled)
			sb.append (LineCursor.DISABLED_MARKER);
	}

	/**
	 * Writes a block with its own disabled flag
	 */
	public static String write (Block block, boolean indent) {
		return write (block, indent, block.disabled ());
	}

	/**
	 * Writes a block
	 *
	 * @param block The block to write, which is not modified
	 * @param indent Whether the line is indented within its surrounding script
	 * @param disabled Whether to mark the line as disabled
	 * @return The statement line
	 */
	public static String write (Block block, boolean indent, boolean disabled) {
		BlockWriter writer = new BlockWriter (block.kind (), indent, disabled)
				.label (block.label ())
				.token (block.kind ().displayName ());

		for (String operand : block.operands ())
			writer.literal (operand);

		BlockOutput output = block.output ();
		if (output != null) {
			writer.arrow ()
					.token (output.kind ().token ())
					.literal (output.name ());
		}

		return writer.toString ();
	}

	/**
	 * Writes the label, unless it is the default one
	 */
	public BlockWriter label (String label) {
		if (label != null && !label.equals (label.replaceAll ("\\s", "")))
			throw new IllegalArgumentException ("Labels cannot contain whitespace: " + label);

		if (label != null && !label.isEmpty () && !label.equals (kind.displayName ()))
			append (LineCursor.LABEL_MARKER + label);

		return this;
	}

	/**
	 * Writes a bare token
	 */
	public BlockWriter token (String token) {
		return append (token);
	}

	/**
	 * Writes a double quoted literal
	 */
	public BlockWriter literal (String literal) {
		if (literal.indexOf (LineCursor.QUOTE) > -1)
			throw new IllegalArgumentException ("Literals cannot contain " + LineCursor.QUOTE + ": " + literal);

		return append (LineCursor.QUOTE + literal + LineCursor.QUOTE);
	}

	public BlockWriter arrow () {
		return append (LineCursor.ARROW);
	}

	private BlockWriter append (String token) {
		// Only separate from a previous token, not from the indent or the disable marker
		if (tokenWritten)
			sb.append (' ');

		sb.append (token);
		tokenWritten = true;
		return this;
	}

	@Override
	public String toString () {
		return sb.toString ();
	}
}
