package org.javai.gura.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Indentation levels of the blocks currently open, innermost last.
 *
 * <p>Levels are strictly increasing from bottom to top. The stack is shared by
 * the whole parse because objects nest by indentation rather than by explicit
 * delimiters.</p>
 */
public final class IndentationStack {

	private final List<Integer> levels = new ArrayList<>();

	public boolean isEmpty() {
		return levels.isEmpty();
	}

	/**
	 * Returns the innermost level, or {@code null} when no block is open.
	 */
	public Integer peek() {
		return levels.isEmpty() ? null : levels.get(levels.size() - 1);
	}

	public void push(int level) {
		Integer top = peek();
		if (top != null && level <= top) {
			throw new IllegalStateException("Indentation level " + level + " is not deeper than " + top);
		}
		levels.add(level);
	}

	/**
	 * Removes the innermost level, if any.
	 */
	public void pop() {
		if (!levels.isEmpty()) {
			levels.remove(levels.size() - 1);
		}
	}

	/**
	 * Makes {@code level} the innermost level again after a list value, dropping
	 * whatever levels the list elements left at or above it.
	 */
	public void restore(int level) {
		while (!levels.isEmpty() && peek() >= level) {
			pop();
		}
		levels.add(level);
	}

	public int depth() {
		return levels.size();
	}

	List<Integer> snapshot() {
		return List.copyOf(levels);
	}

	void reset(List<Integer> snapshot) {
		levels.clear();
		levels.addAll(snapshot);
	}

	@Override
	public String toString() {
		return levels.toString();
	}
}
