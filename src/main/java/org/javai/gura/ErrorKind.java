package org.javai.gura;

/**
 * Category of a {@link GuraParseException}.
 */
public enum ErrorKind {

	/** The input does not match the grammar. */
	SYNTAX,
	/** Tabs used for indentation, or indentation levels that do not follow the 4-space rule. */
	INVALID_INDENTATION,
	/** The same key appears twice in one object. */
	DUPLICATED_KEY,
	/** The same variable is defined twice anywhere in the flattened document. */
	DUPLICATED_VARIABLE,
	/** A referenced variable is neither defined in the document nor in the environment. */
	VARIABLE_NOT_DEFINED,
	/** An imported file does not exist or cannot be read. */
	FILE_NOT_FOUND,
	/** The same file is imported more than once. */
	DUPLICATED_IMPORT;

	/**
	 * Returns whether a failure of this kind lets the parser backtrack and try
	 * another alternative. Only syntax mismatches do.
	 */
	public boolean isRecoverable() {
		return this == SYNTAX;
	}
}
