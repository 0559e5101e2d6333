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

import static org.stacker.Stacker.logD;

import java.util.ArrayList;
import java.util.List;

import org.stacker.LineCursor.TokenType;

/**
 * Reads a statement line into a {@link Block}
 * <p>Grammar, square brackets meaning optional:</p>
 * <pre>
 * [!] [#LABEL] NAME "OPERAND" "OPERAND" [-&gt; VAR|CAP "NAME"]
 * </pre>
 * <p>By default anything after a complete statement is ignored. A strict parser rejects it instead.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class BlockParser {
	private static final String LOG_TAG = BlockParser.class.getSimpleName ();
	private static final boolean DEBUG = false;

	private final boolean strict;

	public BlockParser () {
		this (false);
	}

	/**
	 * @param strict Whether to reject unconsumed text after the statement
	 */
	public BlockParser (boolean strict) {
		this.strict = strict;
	}

	public boolean strict () {
		return strict;
	}

	/**
	 * Parses a line whose block name selects the statement kind
	 *
	 * @param line A single statement line
	 * @return The parsed block
	 * @throws BlockException UNKNOWN_BLOCK if the name is missing or unknown, or any error of {@link #parse(BlockKind, String)}
	 */
	public Block parse (String line) throws BlockException {
		LineCursor cursor = new LineCursor (line == null ? "" : line.trim ());
		boolean disabled = cursor.peekDisabled ();
		String label = cursor.peekLabel ();
		String name = cursor.takeToken (TokenType.PARAMETER, false);

		BlockKind kind = BlockKind.forName (name);
		if (kind == null)
			throw BlockException.unknownBlock (name);

		return parseBody (kind, cursor, label, disabled);
	}

	/**
	 * Parses a line of a known statement kind
	 *
	 * @param kind The statement kind the line must hold
	 * @param line A single statement line
	 * @return The parsed block
	 * @throws BlockException On malformed input, no block is produced
	 * @throws IllegalArgumentException If the block name in the line is not the name of kind
	 */
	public Block parse (BlockKind kind, String line) throws BlockException {
		LineCursor cursor = new LineCursor (line == null ? "" : line.trim ());
		boolean disabled = cursor.peekDisabled ();
		String label = cursor.peekLabel ();
		String name = cursor.takeToken (TokenType.PARAMETER, false);

		if (!kind.displayName ().equalsIgnoreCase (name))
			throw new IllegalArgumentException ("Expected a " + kind.displayName () + " statement but found: " + (name.isEmpty () ? "nothing" : name));

		return parseBody (kind, cursor, label, disabled);
	}

	private Block parseBody (BlockKind kind, LineCursor cursor, String label, boolean disabled) throws BlockException {
		List<String> operands = new ArrayList<String> ();
		for (BlockField field : kind.operandFields ())
			operands.add (cursor.takeLiteral (field.property ()));

		BlockOutput output = null;

		// No arrow means the block does not store its result
		if (!cursor.takeToken (TokenType.ARROW, false).isEmpty ())
			output = parseOutput (cursor);

		if (strict && !cursor.exhausted ())
			throw BlockException.unexpectedContent (cursor.remaining ());

		Block block = new Block (kind, label, operands, output, disabled);

		if (DEBUG)
			logD (LOG_TAG, "Parsed " + block);

		return block;
	}

	private BlockOutput parseOutput (LineCursor cursor) throws BlockException {
		String token;
		try {
			token = cursor.takeToken (TokenType.PARAMETER, true);
		} catch (BlockException e) {
			throw BlockException.invalidOutputKind (null, e);
		}

		BlockOutput.OutputKind outputKind = BlockOutput.OutputKind.forToken (token);
		if (outputKind == null)
			throw BlockException.invalidOutputKind (token, null);

		String name;
		try {
			name = cursor.takeToken (TokenType.LITERAL, true);
		} catch (BlockException e) {
			throw BlockException.missingOutputName (e);
		}

		if (name.isEmpty ())
			throw BlockException.missingOutputName (null);

		return new BlockOutput (outputKind, name);
	}
}
