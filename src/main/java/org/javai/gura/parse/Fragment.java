package org.javai.gura.parse;

import org.javai.gura.value.GuraObject;
import org.javai.gura.value.GuraValue;

/**
 * What a structural grammar rule produces. Only {@link Value} and
 * {@link IndentedObject} end up in the value tree; the other fragments steer
 * the rules that collect them.
 */
public sealed interface Fragment
		permits Fragment.Value, Fragment.Pair, Fragment.IndentedObject, Fragment.Import, Fragment.Marker {

	record Value(GuraValue value) implements Fragment {
	}

	/**
	 * A key and its value, with the indentation the pair was written at and the
	 * location of the key.
	 */
	record Pair(String key, GuraValue value, int indentation, int position, int line) implements Fragment {
	}

	/**
	 * An object together with the indentation level of its pairs.
	 */
	record IndentedObject(GuraObject object, int indentation) implements Fragment {
	}

	record Import(String path, int position, int line) implements Fragment {
	}

	enum Marker implements Fragment {
		/** A blank or comment-only line. */
		USELESS_LINE,
		/** A variable definition was stored. */
		VARIABLE_DEFINED,
		/** The current block ended, or an object had no pairs. */
		BREAK_PARENT
	}
}
