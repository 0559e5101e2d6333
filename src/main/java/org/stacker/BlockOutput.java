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
 * Where a block stores its result: <code>-&gt; VAR "NAME"</code> or <code>-&gt; CAP "NAME"</code>
 *
 * @version 1.0
 * @since 1.0
 */
public final class BlockOutput {
	/** An ordinary variable, or a capture which downstream reporting picks out */
	public static enum OutputKind {
		VARIABLE ("VAR"),
		CAPTURE ("CAP");

		private final String token;

		OutputKind (String token) {
			this.token = token;
		}

		/** The token written after the arrow */
		public String token () {
			return token;
		}

		/**
		 * @param token Token as written, any case
		 * @return The matching kind, or null if the token is neither VAR nor CAP
		 */
		public static OutputKind forToken (String token) {
			if (token == null)
				return null;

			for (OutputKind kind : values ()) {
				if (kind.token.equalsIgnoreCase (token))
					return kind;
			}

			return null;
		}
	}

	private final OutputKind kind;
	private final String name;

	public BlockOutput (OutputKind kind, String name) {
		if (kind == null)
			throw new IllegalArgumentException ("Output kind is required");

		if (name == null || name.isEmpty ())
			throw new IllegalArgumentException ("Output name must not be empty");

		this.kind = kind;
		this.name = name;
	}

	public static BlockOutput variable (String name) {
		return new BlockOutput (OutputKind.VARIABLE, name);
	}

	public static BlockOutput capture (String name) {
		return new BlockOutput (OutputKind.CAPTURE, name);
	}

	public OutputKind kind () {
		return kind;
	}

	public String name () {
		return name;
	}

	public boolean isCapture () {
		return kind == OutputKind.CAPTURE;
	}

	@Override
	public boolean equals (Object other) {
		if (this == other)
			return true;

		if (!(other instanceof BlockOutput))
			return false;

		BlockOutput that = (BlockOutput) other;
		return kind == that.kind && name.equals (that.name);
	}

	@Override
	public int hashCode () {
		return 31 * kind.hashCode () + name.hashCode ();
	}

	@Override
	public String toString () {
		return kind.token () + " " + name;
	}
}
