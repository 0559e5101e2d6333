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
import java.util.Collections;
import java.util.List;

/**
 * One statement line in structured form
 * <p>Operands are kept raw, exactly as written between the quotes; substitution only happens at execution.
 * Blocks are built by {@link BlockParser} or {@link #create(BlockKind)} and afterwards only change through the
 * explicit setters, which editing tools use.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public final class Block {
	private final BlockKind kind;
	private final List<String> operands;
	private String label;
	private BlockOutput output;
	private boolean disabled;

	/**
	 * @param kind Statement kind
	 * @param label Label, or null to use the kind's default name
	 * @param operands Raw operands, exactly {@link BlockKind#arity()} of them
	 * @param output Output clause, or null if the block does not store its result
	 * @param disabled Whether the block is marked inactive
	 */
	public Block (BlockKind kind, String label, List<String> operands, BlockOutput output, boolean disabled) {
		if (kind == null)
			throw new IllegalArgumentException ("Block kind is required");

		if (operands == null || operands.size () != kind.arity ())
			throw new IllegalArgumentException (kind.displayName () + " takes " + kind.arity () + " operands");

		for (String operand : operands) {
			if (operand == null)
				throw new IllegalArgumentException ("Operands must not be null");
		}

		this.kind = kind;
		this.operands = new ArrayList<String> (operands);
		this.output = output;
		this.disabled = disabled;
		labelSet (label);
	}

	/**
	 * Creates a block with the default values of its fields, as a host does when a block is added
	 *
	 * @param kind Statement kind
	 * @return An enabled block with default label and operands and no output
	 */
	public static Block create (BlockKind kind) {
		List<String> operands = new ArrayList<String> ();
		for (BlockField field : kind.operandFields ())
			operands.add (field.defaultValue ());

		return new Block (kind, null, operands, null, false);
	}

	public BlockKind kind () {
		return kind;
	}

	public String label () {
		return label;
	}

	/**
	 * @param label New label, null or empty resets it to the kind's default name
	 * @throws IllegalArgumentException If the label contains whitespace, which a statement line cannot hold
	 */
	public void labelSet (String label) {
		if (label != null && hasWhitespace (label))
			throw new IllegalArgumentException ("Labels cannot contain whitespace: " + label);

		this.label = (label == null || label.isEmpty () ? kind.displayName () : label);
	}

	/**
	 * @return True if the label is the kind's default name and so is not written out
	 */
	public boolean labelIsDefault () {
		return label.equals (kind.displayName ());
	}

	/**
	 * @return Unmodifiable view of the raw operands
	 */
	public List<String> operands () {
		return Collections.unmodifiableList (operands);
	}

	public String operand (int index) {
		return operands.get (index);
	}

	public void operandSet (int index, String value) {
		if (value == null)
			throw new IllegalArgumentException ("Operands must not be null");

		operands.set (index, value);
	}

	/**
	 * @return The output clause, or null if the block does not store its result
	 */
	public BlockOutput output () {
		return output;
	}

	public void outputSet (BlockOutput output) {
		this.output = output;
	}

	public boolean disabled () {
		return disabled;
	}

	public void disabledSet (boolean disabled) {
		this.disabled = disabled;
	}

	private static boolean hasWhitespace (String text) {
		for (int i = 0, j = text.length (); i < j; ++i) {
			if (Character.isWhitespace (text.charAt (i)))
				return true;
		}

		return false;
	}

	@Override
	public boolean equals (Object other) {
		if (this == other)
			return true;

		if (!(other instanceof Block))
			return false;

		Block that = (Block) other;
		return kind == that.kind
				&& label.equals (that.label)
				&& operands.equals (that.operands)
				&& (output == null ? that.output == null : output.equals (that.output))
				&& disabled == that.disabled;
	}

	@Override
	public int hashCode () {
		int hash = kind.hashCode ();
		hash = 31 * hash + label.hashCode ();
		hash = 31 * hash + operands.hashCode ();
		hash = 31 * hash + (output == null ? 0 : output.hashCode ());
		return 31 * hash + (disabled ? 1 : 0);
	}

	@Override
	public String toString () {
		return "Block{kind=" + kind + ", label=" + label + ", operands=" + operands + ", output=" + output + ", disabled=" + disabled + "}";
	}
}
