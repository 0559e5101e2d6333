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

package org.stacker.example;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.stacker.BlockField;
import org.stacker.BlockKind;
import org.stacker.Stacker;

/**
 * Stacker for Java
 *
 * @version 1.0
 * @since 1.0
 */
public class Main {
	/**
	 * @param args The command line options when invoked
	 */
	public static void main (String[] args) {
		System.exit (run (args));
	}

	/**
	 * Runs the command line without exiting the JVM
	 *
	 * @param args The command line options
	 * @return The return code for the invoking shell
	 */
	public static int run (String[] args) {
		/** The return code sent to the invoking shell */
		int returnCode = -1;

		/** The statement to run (from the command line or internal example) */
		String statement = null;

		// Process command line flags
		List <String> params = Arrays.asList (args);
		boolean paramVersion = params.contains ("--v");
		boolean paramHelp = params.contains ("--help");
		boolean paramExample = params.contains ("--hello");
		boolean paramFields = params.contains ("--fields");

		if (paramFields) { // Show the form fields a host would draw for each block
			for (BlockKind kind : BlockKind.values ()) {
				System.out.println (kind.displayName () + " (color=" + kind.color () + ", lightForeground=" + kind.lightForeground () + ")");
				for (BlockField field : kind.fields ())
					System.out.println ("    " + field);
			}

			returnCode = 0;
		} else if (args.length == 0 || paramVersion || paramHelp) { // Called with wrong arguments, version or help
			// Show version
			System.out.println ("Stacker for Java (v " + Stacker.VERSION_MAJOR + "." + Stacker.VERSION_MINOR + ")\n");

			// Show usage information
			if (paramHelp || args.length == 0) {
				System.out.println ("Usage:  java -jar stacker.jar 'STATEMENT' [NAME=value ...]");
				System.out.println ("        (to execute a block statement with optional preset variables)");
				System.out.println ("Example: java -jar stacker.jar 'SUM \"<X>\" \"6\" -> VAR \"Y\"' X=4");
				System.out.println ("");
				System.out.println ("Options:");
				System.out.println ("    --help     Show this help");
				System.out.println ("       --v     Show version information");
				System.out.println ("   --hello     Run internal example statement");
				System.out.println ("  --fields     Show the fields of every block");
			}

			returnCode = 2;
		} else if (paramExample) { // Called to execute the internal example statement
			statement = "SUM \"2\" \"2\" -> VAR \"ANSWER\"";
		} else {
			statement = args[0];
		}

		// If a statement is in this variable, execute it
		if (statement != null) {
			Stacker stacker = new Stacker ();

			// Preset variables given as NAME=value
			for (int i = (paramExample ? 0 : 1); i < args.length; ++i) {
				int equals = args[i].indexOf ('=');
				if (equals > 0) {
					stacker.variableSet (args[i].substring (0, equals), args[i].substring (equals + 1));
				} else if (!args[i].startsWith ("--")) {
					System.err.println ("Ignoring argument, expected NAME=value: " + args[i]);
				}
			}

			boolean success = stacker.statement (statement);
			if (success) {
				// Show the canonical form of what was parsed
				System.out.println (stacker.line (false));

				success = stacker.run ();

				for (String logLine : stacker.variableStoreGet ().logGet ())
					System.out.println (logLine);

				for (Map.Entry<String, Object> capture : stacker.variableStoreGet ().captures ().entrySet ())
					System.out.println ("CAP " + capture.getKey () + " = " + capture.getValue ());
			}

			// Set the return code for the shell (0=success)
			returnCode = (success ? 0 : 1);

			// Write the standard out if there is any
			if (!stacker.stdout.isEmpty ())
				System.out.println (stacker.stdout);

			// Write the standard error if there is any
			if (!stacker.stderr.isEmpty ())
				System.out.println (stacker.stderr);
		}

		return returnCode;
	}
}
