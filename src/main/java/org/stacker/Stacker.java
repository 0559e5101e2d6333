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
 * Stacker for Java
 * <p>Loads one block statement with {@link #statement(String)}, executes it with {@link #run()} against the
 * instance's {@link VariableStore}, and writes it back out with {@link #line(boolean)}. Methods report failure
 * by returning false (or null) with the reason in {@link #stderr}.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class Stacker {
	// Public information
	public static final int VERSION_MAJOR = 1;
	public static final int VERSION_MINOR = 0;

	// Internal settings
	private static final String LOG_TAG = Stacker.class.getSimpleName ();
	private static final boolean DEBUG = false;

	// Engine internals
	private final BlockExecutor blockExecutor = new BlockExecutor ();
	private final VariableStore variableStore = new VariableStore ();
	private BlockParser blockParser = new BlockParser (false);
	private Block block = null;

	/** Execution normal output, the result of the last successful {@link #run()} */
	public String stdout = "";

	/** Execution error output, populated with {@link #error(String)} */
	public String stderr = "";

	public Stacker () {
		if (DEBUG)
			logD (LOG_TAG, "Instantiating Stacker");
	}

	/**
	 * Gets whether trailing text after a statement is rejected
	 */
	public boolean strictGet () {
		return blockParser.strict ();
	}

	/**
	 * Sets whether trailing text after a statement is rejected
	 *
	 * @param strict True to reject, false to ignore it
	 */
	public void strictSet (boolean strict) {
		blockParser = new BlockParser (strict);

		if (DEBUG)
			logD (LOG_TAG, "Set strict=" + strict);
	}

	/**
	 * Resets the instance between executions, removing all variables, captures and log lines
	 * <p>The loaded statement is kept.</p>
	 */
	public void reset () {
		stdout = stderr = "";
		variableStore.reset ();

		if (DEBUG)
			logD (LOG_TAG, "Stacker reset");
	}

	/**
	 * Parses and loads a statement line, but does not execute it (see {@link #run()})
	 *
	 * @param line A single statement line
	 * @return True if the statement is ready for execution, or false if it is invalid (stderr will contain the reason)
	 */
	public boolean statement (String line) {
		if (DEBUG)
			logV (LOG_TAG, "Statement: " + line);

		stdout = stderr = "";
		block = null;

		try {
			block = blockParser.parse (line);
		} catch (BlockException e) {
			return error ("Parse error: " + e.getMessage ());
		}

		return true;
	}

	/**
	 * Gets the loaded block
	 *
	 * @return The block, or null if no statement is loaded
	 */
	public Block blockGet () {
		return block;
	}

	/**
	 * Loads a block built in code, bypassing the parser
	 */
	public void blockSet (Block block) {
		this.block = block;
	}

	/**
	 * Runs the statement last loaded via {@link #statement(String)} or {@link #blockSet(Block)}
	 * <p>Variables persist across calls, use {@link #reset()} to clear them.</p>
	 *
	 * @return True if executed successfully (stdout holds the result), or false if there was an error
	 */
	public boolean run () {
		stdout = stderr = "";

		if (block == null)
			return error ("No statement has been loaded");

		try {
			stdout = blockExecutor.execute (block, variableStore);
		} catch (BlockException e) {
			return error ("Execution error: " + e.getMessage ());
		}

		return true;
	}

	/**
	 * Writes the loaded block back out as a statement line
	 *
	 * @param indent Whether the line is indented within its surrounding script
	 * @return The statement line, or null if no statement is loaded
	 */
	public String line (boolean indent) {
		if (block == null) {
			error ("No statement has been loaded");
			return null;
		}

		return BlockWriter.write (block, indent);
	}

	/**
	 * Returns whether a variable or capture is set
	 */
	public boolean variableHas (String key) {
		return variableStore.has (key);
	}

	/**
	 * Gets a variable or capture
	 *
	 * @param key Name of variable
	 * @return Variable content or null if variable is not set
	 */
	public String variableGet (String key) {
		return variableStore.get (key);
	}

	/**
	 * Sets a variable
	 */
	public void variableSet (String key, String value) {
		variableStore.set (key, value, false);
	}

	/**
	 * Sets a variable
	 */
	public void variableSet (String key, int value) {
		variableSet (key, String.valueOf (value));
	}

	/**
	 * Sets a capture
	 */
	public void captureSet (String key, String value) {
		variableStore.set (key, value, true);
	}

	/**
	 * Unsets a variable or capture
	 */
	public void variableRemove (String key) {
		variableStore.remove (key);
	}

	/**
	 * Retrieves the complete variable store
	 */
	public VariableStore variableStoreGet () {
		return variableStore;
	}

	/**
	 * Sends an error to stderr
	 *
	 * @param message Optional string or null of the message to display
	 * @return False (used as a placeholder for returns in other methods)
	 */
	private boolean error (String message) {
		stderr = (message != null ? message : "Unknown error");

		if (DEBUG)
			logD (LOG_TAG, stderr);

		return false;
	}

	/**
	 * Implementation specific logging for Verbose messages
	 *
	 * @param msg The message to log
	 */
	protected static void logV (String tag, String msg) {
		System.out.println ("V: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}

	/**
	 * Implementation specific logging for Debug messages
	 *
	 * @param msg The message to log
	 */
	protected static void logD (String tag, String msg) {
		System.out.println ("D: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}
}
