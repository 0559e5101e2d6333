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
import static org.stacker.Stacker.logV;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory {@link RuntimeContext} holding variables and captures
 * <p>Values are strings or lists of strings. A name lives in exactly one of the two partitions; setting it in
 * one removes it from the other. Names are case sensitive.</p>
 * <p>Substitution replaces <code>&lt;NAME&gt;</code> with the value of NAME and <code>&lt;NAME[i]&gt;</code> with
 * element i of a list (negative i counts from the end). Unknown names and out of range indices are left as
 * written.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class VariableStore implements RuntimeContext {
	private static final String LOG_TAG = VariableStore.class.getSimpleName ();
	private static final boolean DEBUG = false;

	private static final Pattern REFERENCE = Pattern.compile ("<([^<>\\[\\]]+)(?:\\[(-?[0-9]+)\\])?>");

	private HashMap<String, Object> variables = new HashMap<String, Object> ();
	private HashMap<String, Object> captures = new HashMap<String, Object> ();
	private ArrayList<String> logLines = new ArrayList<String> ();

	/**
	 * Returns whether a variable or capture is set
	 *
	 * @param name Name of variable
	 * @return True if set in either partition
	 */
	public boolean has (String name) {
		return variables.containsKey (name) || captures.containsKey (name);
	}

	/**
	 * Returns whether a name is set as a capture
	 */
	public boolean isCapture (String name) {
		return captures.containsKey (name);
	}

	/**
	 * Gets a value as text, a list is rendered as <code>[a, b]</code>
	 *
	 * @param name Name of variable
	 * @return Value or null if the name is not set
	 */
	public String get (String name) {
		Object value = lookup (name);
		return value == null ? null : value.toString ();
	}

	/**
	 * Gets a list value
	 *
	 * @param name Name of variable
	 * @return Unmodifiable list, a single element list for a string value, or null if the name is not set
	 */
	@SuppressWarnings ("unchecked")
	public List<String> getList (String name) {
		Object value = lookup (name);

		if (value == null)
			return null;

		if (value instanceof List)
			return Collections.unmodifiableList ((List<String>) value);

		return Collections.singletonList ((String) value);
	}

	@Override
	public void set (String name, String value, boolean isCapture) {
		store (name, value, isCapture);
	}

	/**
	 * Stores a list value, replacing anything already stored under the name
	 */
	public void set (String name, List<String> values, boolean isCapture) {
		store (name, new ArrayList<String> (values), isCapture);
	}

	/**
	 * Sets an ordinary variable
	 */
	public void set (String name, String value) {
		store (name, value, false);
	}

	/**
	 * Unsets a variable or capture
	 */
	public void remove (String name) {
		if (DEBUG)
			logV (LOG_TAG, "Removing variable: " + name);

		variables.remove (name);
		captures.remove (name);
	}

	/**
	 * Unsets all variables and captures and clears the log
	 */
	public void reset () {
		if (DEBUG)
			logV (LOG_TAG, "Removing all variables");

		variables = new HashMap<String, Object> ();
		captures = new HashMap<String, Object> ();
		logLines = new ArrayList<String> ();
	}

	/**
	 * @return Unmodifiable view of the captures, the values reported downstream
	 */
	public Map<String, Object> captures () {
		return Collections.unmodifiableMap (captures);
	}

	/**
	 * @return Unmodifiable view of the ordinary variables
	 */
	public Map<String, Object> variables () {
		return Collections.unmodifiableMap (variables);
	}

	@Override
	public String substitute (String raw) {
		if (raw == null || raw.indexOf ('<') < 0)
			return raw;

		Matcher matcher = REFERENCE.matcher (raw);
		StringBuffer sb = new StringBuffer ();

		while (matcher.find ()) {
			String resolved = resolve (matcher.group (1), matcher.group (2));
			matcher.appendReplacement (sb, Matcher.quoteReplacement (resolved == null ? matcher.group () : resolved));
		}
		matcher.appendTail (sb);

		if (DEBUG)
			logV (LOG_TAG, "Substituted " + raw + " -> " + sb);

		return sb.toString ();
	}

	@Override
	public void log (String message) {
		if (DEBUG)
			logD (LOG_TAG, message);

		logLines.add (message);
	}

	/**
	 * @return Unmodifiable view of the execution log
	 */
	public List<String> logGet () {
		return Collections.unmodifiableList (logLines);
	}

	private void store (String name, Object value, boolean isCapture) {
		if (name == null || name.isEmpty ())
			throw new IllegalArgumentException ("Variable name must not be empty");

		if (value == null)
			throw new IllegalArgumentException ("Variable value must not be null: " + name);

		if (DEBUG)
			logV (LOG_TAG, "Setting " + (isCapture ? "capture" : "variable") + ": " + name + "=" + value);

		(isCapture ? variables : captures).remove (name);
		(isCapture ? captures : variables).put (name, value);
	}

	private Object lookup (String name) {
		Object value = variables.get (name);
		return value != null ? value : captures.get (name);
	}

	private String resolve (String name, String index) {
		Object value = lookup (name);

		if (value == null)
			return null;

		if (index == null)
			return value.toString ();

		List<String> list = getList (name);
		int i;
		try {
			i = Integer.parseInt (index);
		} catch (NumberFormatException e) {
			return null;
		}

		if (i < 0)
			i += list.size ();

		return (i < 0 || i >= list.size () ? null : list.get (i));
	}
}
