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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Pattern;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.BeforeClass;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Unit testing for the Stacker engine, plus the statement suite listed in StackerTestSuite/test_list.json
 *
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class StackerUnitTest {
	private static JSONObject testList;

	/**
	 * Runs before testing to ensure the statement suite is loaded and sane
	 */
	@BeforeClass
	public static void setUp () throws Exception {
		String testListStr = readResourceFile ("StackerTestSuite/test_list.json");
		assertNotNull ("StackerTestSuite/test_list.json is missing", testListStr);

		// Block-style comments are not official JSON so remove them before parsing it
		Pattern blockComments = Pattern.compile ("/\\*.*?\\*/", Pattern.DOTALL);
		testListStr = blockComments.matcher (testListStr).replaceAll ("");

		testList = new JSONObject (testListStr);
		assertEquals ("✓", testList.getString ("utf8"));
		assertEquals (true, testList.has ("tests"));
	}

	/**
	 * A statement can be loaded, run and written back out
	 */
	@Test
	public void _01_StatementRun () {
		Stacker stacker = new Stacker ();
		boolean success;

		stacker.variableSet ("X", 4);

		success = stacker.statement ("SUM \"<X>\" \"6\" -> VAR \"Y\"");
		assertEquals (true, success);
		assertEquals ("", stacker.stderr);

		success = stacker.run ();
		assertEquals (true, success);
		assertEquals ("10", stacker.stdout);
		assertEquals ("", stacker.stderr);
		assertEquals ("10", stacker.variableGet ("Y"));
		assertEquals ("Added 4 and 6 with result 10", stacker.variableStoreGet ().logGet ().get (0));

		assertEquals ("SUM \"<X>\" \"6\" -> VAR \"Y\"", stacker.line (false));
		assertEquals ("\tSUM \"<X>\" \"6\" -> VAR \"Y\"", stacker.line (true));
	}

	/**
	 * A statement that fails to parse leaves nothing to run
	 */
	@Test
	public void _02_ParseErrorRerun () {
		Stacker stacker = new Stacker ();
		boolean success;

		success = stacker.statement ("SUM \"1\"");
		assertEquals (false, success);
		assertEquals ("", stacker.stdout);
		assertEquals ("Parse error: Missing literal for Second", stacker.stderr);
		assertNull (stacker.blockGet ());

		success = stacker.run ();
		assertEquals (false, success);
		assertEquals ("No statement has been loaded", stacker.stderr);
	}

	/**
	 * Call {@link Stacker#run()} and {@link Stacker#line(boolean)} before any statement is loaded
	 */
	@Test
	public void _03_NoStatement () {
		Stacker stacker = new Stacker ();

		assertEquals (false, stacker.run ());
		assertEquals ("No statement has been loaded", stacker.stderr);

		assertNull (stacker.line (false));
		assertEquals ("No statement has been loaded", stacker.stderr);
	}

	/**
	 * An operand that is not an integer fails the run without writing the output
	 */
	@Test
	public void _04_ExecutionError () {
		Stacker stacker = new Stacker ();

		stacker.variableSet ("X", "abc");
		assertEquals (true, stacker.statement ("SUM \"<X>\" \"6\" -> VAR \"Y\""));

		assertEquals (false, stacker.run ());
		assertEquals ("", stacker.stdout);
		assertEquals ("Execution error: First is not an integer: abc", stacker.stderr);
		assertEquals (false, stacker.variableHas ("Y"));
		assertEquals (0, stacker.variableStoreGet ().logGet ().size ());
	}

	/**
	 * Able to re-run and reset a single instance, variables persist until reset
	 */
	@Test
	public void _05_RerunReset () {
		Stacker stacker = new Stacker ();

		stacker.variableSet ("N", 0);
		assertEquals (true, stacker.statement ("SUM \"<N>\" \"1\" -> VAR \"N\""));

		assertEquals (true, stacker.run ());
		assertEquals ("1", stacker.stdout);

		assertEquals (true, stacker.run ());
		assertEquals ("2", stacker.stdout);
		assertEquals ("2", stacker.variableGet ("N"));

		// N has now gone, so the reference is left as written
		stacker.reset ();
		assertEquals (false, stacker.run ());
		assertEquals ("Execution error: First is not an integer: <N>", stacker.stderr);
	}

	/**
	 * Trailing text is only rejected once strict mode is switched on
	 */
	@Test
	public void _06_Strict () {
		Stacker stacker = new Stacker ();

		assertEquals (false, stacker.strictGet ());
		assertEquals (true, stacker.statement ("SUM \"1\" \"2\" -> CAP \"C\" ignored"));

		stacker.strictSet (true);
		assertEquals (true, stacker.strictGet ());
		assertEquals (false, stacker.statement ("SUM \"1\" \"2\" -> CAP \"C\" ignored"));
		assertEquals ("Parse error: Unexpected content after statement: ignored", stacker.stderr);
	}

	/**
	 * A block built in code runs like a parsed one, and its capture is reported as such
	 */
	@Test
	public void _07_BlockSet () {
		Stacker stacker = new Stacker ();
		Block block = Block.create (BlockKind.SUM);
		block.outputSet (BlockOutput.capture ("TOTAL"));
		stacker.blockSet (block);

		assertEquals (true, stacker.run ());
		assertEquals ("3", stacker.stdout);
		assertEquals ("3", stacker.variableStoreGet ().captures ().get ("TOTAL"));
		assertEquals ("SUM \"1\" \"2\" -> CAP \"TOTAL\"", stacker.line (false));
	}

	/**
	 * Every statement listed in test_list.json parses to the expected block or fails with the expected error,
	 * and every parsed block survives being written out and parsed again
	 */
	@Test
	public void _08_StackerTestSuite () throws Exception {
		JSONArray testListTests = testList.getJSONArray ("tests");

		for (int i = 0, j = testListTests.length (); i < j; ++i) {
			JSONObject testEntry = testListTests.getJSONObject (i);
			String line = testEntry.getString ("line");
			BlockParser parser = new BlockParser (testEntry.optBoolean ("strict", false));
			String message = "[" + (i + 1) + " of " + j + "] " + line;

			if (testEntry.has ("error")) {
				try {
					parser.parse (line);
					fail (message + " should fail with " + testEntry.getString ("error"));
				} catch (BlockException e) {
					assertEquals (message, testEntry.getString ("error"), e.kind ().toString ());
					if (testEntry.has ("field"))
						assertEquals (message, testEntry.getString ("field"), e.field ());
				}

				continue;
			}

			Block block = parser.parse (line);
			assertEquals (message, testEntry.getString ("label"), block.label ());
			assertEquals (message, testEntry.getBoolean ("disabled"), block.disabled ());

			JSONArray operands = testEntry.getJSONArray ("operands");
			assertEquals (message, operands.length (), block.operands ().size ());
			for (int k = 0, l = operands.length (); k < l; ++k)
				assertEquals (message, operands.getString (k), block.operand (k));

			if (testEntry.has ("output")) {
				JSONObject output = testEntry.getJSONObject ("output");
				assertNotNull (message, block.output ());
				assertEquals (message, output.getString ("kind"), block.output ().kind ().toString ());
				assertEquals (message, output.getString ("name"), block.output ().name ());
			} else {
				assertNull (message, block.output ());
			}

			String canonical = BlockWriter.write (block, false);
			assertEquals (message, testEntry.getString ("canonical"), canonical);
			assertEquals (message, block, parser.parse (canonical));
		}
	}

	/**
	 * Reads a resource file from disk and returns it as a string
	 *
	 * @param fileName The path and filename to load (relative to the resources directory)
	 * @return String containing the file contents, or null if file cannot be read
	 */
	private static String readResourceFile (String fileName) throws IOException {
		InputStream inputStream = Thread.currentThread ().getContextClassLoader ().getResourceAsStream (fileName);
		if (inputStream == null)
			return null;

		ByteArrayOutputStream outputStream = new ByteArrayOutputStream ();
		byte buf[] = new byte[1024];
		int len;

		try {
			while ((len = inputStream.read (buf)) != -1)
				outputStream.write (buf, 0, len);
		} finally {
			inputStream.close ();
		}

		return outputStream.toString ("UTF-8");
	}
}
