package de.codesourcery.rebecca.ast;

/**
 * Thrown when a tree operation would break or has detected a broken tree structure.
 */
public class TreeException extends RuntimeException {

	public TreeException(String message) {
		super(message);
	}
}
