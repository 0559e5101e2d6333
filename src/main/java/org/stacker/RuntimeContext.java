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
 * The store a block reads its operands from and writes its result to during execution
 *
 * @version 1.0
 * @since 1.0
 */
public interface RuntimeContext {
	/**
	 * Replaces variable references embedded in a raw operand
	 *
	 * @param raw Operand as written in the statement, e.g. <code>&lt;X&gt;</code>
	 * @return The operand with references resolved
	 */
	String substitute (String raw);

	/**
	 * Stores a value, replacing anything already stored under the name
	 *
	 * @param name Variable name
	 * @param value Value to store
	 * @param isCapture True to store it as a capture rather than an ordinary variable
	 */
	void set (String name, String value, boolean isCapture);

	/**
	 * Records a line in the execution log
	 *
	 * @param message The message to log
	 */
	void log (String message);
}
