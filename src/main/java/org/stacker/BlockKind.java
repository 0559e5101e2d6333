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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The statement kinds the parser, writer and executor understand
 * <p>Each kind carries its block name (also the default label), the host display metadata, the ordered operand
 * fields that fix its arity, and the operation performed on the integer operands.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public enum BlockKind {
	SUM ("SUM", "Cyan", false,
			new BlockField ("First", BlockField.Control.TEXT, "First Number", "The first operand", "1"),
			new BlockField ("Second", BlockField.Control.TEXT, "Second Number", "The second operand", "2")) {
		@Override
		public String evaluate (int[] operands) {
			return String.valueOf ((long) operands[0] + operands[1]);
		}

		@Override
		public String describe (int[] operands, String result) {
			return "Added " + operands[0] + " and " + operands[1] + " with result " + result;
		}
	};

	private final String displayName;
	private final String color;
	private final boolean lightForeground;
	private final List<BlockField> operandFields;

	BlockKind (String displayName, String color, boolean lightForeground, BlockField... operandFields) {
		this.displayName = displayName;
		this.color = color;
		this.lightForeground = lightForeground;
		this.operandFields = Collections.unmodifiableList (Arrays.asList (operandFields));
	}

	/**
	 * Performs the operation of this kind
	 *
	 * @param operands Substituted operand values, exactly {@link #arity()} of them
	 * @return The result as text
	 */
	public abstract String evaluate (int[] operands);

	/**
	 * @param operands Substituted operand values
	 * @param result The value returned by {@link #evaluate(int[])}
	 * @return Human readable line for the execution log
	 */
	public abstract String describe (int[] operands, String result);

	/** The block name written in statements, also the default label */
	public String displayName () {
		return displayName;
	}

	/** Host colour name for the block */
	public String color () {
		return color;
	}

	/** Whether the host should draw the label with a light font */
	public boolean lightForeground () {
		return lightForeground;
	}

	public int arity () {
		return operandFields.size ();
	}

	public List<BlockField> operandFields () {
		return operandFields;
	}

	/**
	 * Every editable field, operands first then the output clause fields
	 *
	 * @return Ordered field table for form drawing
	 */
	public List<BlockField> fields () {
		List<BlockField> fields = new ArrayList<BlockField> (operandFields);
		fields.add (BlockField.VARIABLE_NAME);
		fields.add (BlockField.IS_CAPTURE);
		return Collections.unmodifiableList (fields);
	}

	/**
	 * Looks up a kind by its block name, ignoring case
	 *
	 * @param name Block name as written in a statement
	 * @return The matching kind, or null if there is none
	 */
	public static BlockKind forName (String name) {
		if (name == null)
			return null;

		for (BlockKind kind : values ()) {
			if (kind.displayName.equalsIgnoreCase (name))
				return kind;
		}

		return null;
	}
}
