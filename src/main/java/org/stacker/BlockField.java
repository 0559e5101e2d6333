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
 * Describes one editable property of a block for a host that draws configuration forms
 *
 * @version 1.0
 * @since 1.0
 */
public final class BlockField {
	/** Form controls a host can draw */
	public static enum Control {
		TEXT,
		CHECKBOX
	}

	/** Output name field, shared by every block kind with an output clause */
	public static final BlockField VARIABLE_NAME = new BlockField ("VariableName", Control.TEXT, "Variable Name", "The output variable name", "");

	/** Capture flag field, shared by every block kind with an output clause */
	public static final BlockField IS_CAPTURE = new BlockField ("IsCapture", Control.CHECKBOX, "Is Capture", "Should the output variable be marked as capture?", "false");

	private final String property;
	private final Control control;
	private final String label;
	private final String tooltip;
	private final String defaultValue;

	public BlockField (String property, Control control, String label, String tooltip, String defaultValue) {
		this.property = property;
		this.control = control;
		this.label = label;
		this.tooltip = tooltip;
		this.defaultValue = defaultValue;
	}

	/** Property name, also used in error messages about the field */
	public String property () {
		return property;
	}

	public Control control () {
		return control;
	}

	/** Text shown next to the control */
	public String label () {
		return label;
	}

	/** Text shown on hover */
	public String tooltip () {
		return tooltip;
	}

	/** Value a freshly created block starts with */
	public String defaultValue () {
		return defaultValue;
	}

	@Override
	public String toString () {
		return property + " (" + control.toString ().toLowerCase () + ") \"" + label + "\": " + tooltip + " [default=" + defaultValue + "]";
	}
}
