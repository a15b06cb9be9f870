package org.javai.mathexpr.ast;

/**
 * Raised when a tree node is built with operands that its operator does not accept,
 * or when a serialized tree cannot be decoded.
 */
public class InvalidTreeException extends RuntimeException {

	public InvalidTreeException(String message) {
		super(message);
	}

	public InvalidTreeException(String message, Throwable cause) {
		super(message, cause);
	}
}
