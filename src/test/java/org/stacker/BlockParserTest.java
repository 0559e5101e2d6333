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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Parser behaviour not covered by the statement suite
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class BlockParserTest {
	private final BlockParser parser = new BlockParser ();

	@Test
	public void _01_DefaultLabel () throws Exception {
		Block block = parser.parse (BlockKind.SUM, "SUM \"1\" \"2\"");

		assertEquals ("SUM", block.label ());
		assertEquals (true, block.labelIsDefault ());
		assertEquals (Arrays.asList ("1", "2"), block.operands ());
		assertNull (block.output ());
		assertEquals (false, block.disabled ());
	}

	@Test
	public void _02_OutputKindAnyCase () throws Exception {
		for (String token : new String[] {"var", "VAR", "Var", "vAr"}) {
			Block block = parser.parse ("SUM \"1\" \"2\" -> " + token + " \"Y\"");
			assertEquals (token, BlockOutput.OutputKind.VARIABLE, block.output ().kind ());
		}

		for (String token : new String[] {"cap", "CAP", "Cap"}) {
			Block block = parser.parse ("SUM \"1\" \"2\" -> " + token + " \"Y\"");
			assertEquals (token, BlockOutput.OutputKind.CAPTURE, block.output ().kind ());
			assertEquals (true, block.output ().isCapture ());
		}
	}

	@Test
	public void _03_ArityEnforced () {
		for (String line : new String[] {"SUM", "SUM \"1\"", "SUM \"1\" 2", "#L SUM \"1\" -> VAR \"Y\""}) {
			try {
				parser.parse (BlockKind.SUM, line);
				fail (line + " has fewer than two literals");
			} catch (BlockException e) {
				assertEquals (line, BlockException.ErrorKind.MISSING_OPERAND, e.kind ());
			}
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void _04_WrongBlockNameIsCallerError () throws Exception {
		parser.parse (BlockKind.SUM, "PRODUCT \"1\" \"2\"");
	}

	@Test
	public void _05_InvalidOutputKindKeepsToken () {
		try {
			parser.parse ("SUM \"1\" \"2\" -> LIST \"Y\"");
			fail ("LIST is not an output kind");
		} catch (BlockException e) {
			assertEquals (BlockException.ErrorKind.INVALID_OUTPUT_KIND, e.kind ());
			assertEquals ("LIST", e.value ());
			assertEquals ("Invalid or missing variable type: LIST", e.getMessage ());
		}
	}

	@Test
	public void _06_MissingOutputNameCause () {
		try {
			parser.parse ("SUM \"1\" \"2\" -> CAP");
			fail ("The output name is required after the kind");
		} catch (BlockException e) {
			assertEquals (BlockException.ErrorKind.MISSING_OUTPUT_NAME, e.kind ());
			assertEquals (BlockException.ErrorKind.MISSING_TOKEN, ((BlockException) e.getCause ()).kind ());
		}
	}

	@Test
	public void _07_StrictAcceptsCompleteStatement () throws Exception {
		BlockParser strict = new BlockParser (true);

		assertEquals (true, strict.strict ());
		assertEquals (parser.parse ("SUM \"1\" \"2\""), strict.parse ("  SUM \"1\" \"2\"  "));
	}

	@Test
	public void _08_ParsedBlocksAreIndependent () throws Exception {
		Block first = parser.parse ("SUM \"1\" \"2\"");
		Block second = parser.parse ("SUM \"1\" \"2\"");

		first.operandSet (0, "5");
		assertEquals ("1", second.operand (0));
	}

	@Test
	public void _09_NullLine () {
		try {
			parser.parse (null);
			fail ("Nothing to parse");
		} catch (BlockException e) {
			assertEquals (BlockException.ErrorKind.UNKNOWN_BLOCK, e.kind ());
			assertEquals ("Missing block name", e.getMessage ());
		}
	}
}
