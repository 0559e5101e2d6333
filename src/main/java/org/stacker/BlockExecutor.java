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

import java.util.List;

/**
 * Executes a {@link Block} against a {@link RuntimeContext}
 * <p>Every operand is substituted, trimmed and parsed as a base 10 integer before anything is written, so a failing
 * operand leaves the context untouched. A block without an output clause is still evaluated and logged.
 * The disabled flag is not consulted here; whoever drives execution decides whether to call it.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class BlockExecutor {
	private static final String LOG_TAG = BlockExecutor.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/**
	 * @param block The block to execute, which is not modified
	 * @param context Source of variable values and destination of the result
	 * @return The result as text
	 * @throws BlockException OPERAND_NOT_INTEGER if a substituted operand is not an integer
	 */
	public String execute (Block block, RuntimeContext context) throws BlockException {
		BlockKind kind = block.kind ();
		List<BlockField> fields = kind.operandFields ();
		int[] values = new int[kind.arity ()];

		for (int i = 0; i < values.length; ++i) {
			String substituted = context.substitute (block.operand (i));

			if (DEBUG)
				logV (LOG_TAG, fields.get (i).property () + ": " + block.operand (i) + " -> " + substituted);

			try {
				values[i] = Integer.parseInt (substituted.trim ());
			} catch (NumberFormatException e) {
				throw BlockException.operandNotInteger (fields.get (i).property (), substituted, e);
			}
		}

		String result = kind.evaluate (values);

		BlockOutput output = block.output ();
		if (output != null)
			context.set (output.name (), result, output.isCapture ());

		context.log (kind.describe (values, result));

		return result;
	}
}
