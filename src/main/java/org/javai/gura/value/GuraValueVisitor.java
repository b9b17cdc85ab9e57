package org.javai.gura.value;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Visitor interface for traversing Gura value trees.
 *
 * This interface enables operations like serialization and conversion to
 * other tree models.
 *
 * @param <R> the return type of the visitor operations
 */
public interface GuraValueVisitor<R> {

	R visitNull();

	R visitBool(boolean value);

	R visitInteger(long value);

	R visitBigInteger(BigInteger value);

	R visitFloat(double value);

	R visitString(String value);

	/**
	 * Visits an array.
	 *
	 * @param elements the elements in order
	 * @return the result of visiting this value
	 */
	R visitArray(List<GuraValue> elements);

	/**
	 * Visits an object.
	 *
	 * @param members the members in insertion order
	 * @return the result of visiting this value
	 */
	R visitObject(Map<String, GuraValue> members);
}
