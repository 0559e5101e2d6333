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

import static org.junit.Assert.assertEquals;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Return codes of the command line
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class MainTest {
	@Test
	public void _01_Usage () {
		assertEquals (2, Main.run (new String[0]));
		assertEquals (2, Main.run (new String[] {"--help"}));
		assertEquals (2, Main.run (new String[] {"--v"}));
	}

	@Test
	public void _02_Example () {
		assertEquals (0, Main.run (new String[] {"--hello"}));
	}

	@Test
	public void _03_Fields () {
		assertEquals (0, Main.run (new String[] {"--fields"}));
	}

	@Test
	public void _04_StatementWithVariables () {
		assertEquals (0, Main.run (new String[] {"SUM \"<X>\" \"6\" -> CAP \"Y\"", "X=4"}));
	}

	@Test
	public void _05_Failures () {
		assertEquals (1, Main.run (new String[] {"SUM \"1\""}));
		assertEquals (1, Main.run (new String[] {"SUM \"<X>\" \"6\"", "X=abc"}));
	}
}
