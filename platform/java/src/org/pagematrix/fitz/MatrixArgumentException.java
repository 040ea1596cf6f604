package org.pagematrix.fitz;

import java.util.Arrays;

// Thrown when a Matrix is constructed from arguments that have no matrix
// shape: not empty, not six values, not a 3x3 grid, not another Matrix.
public class MatrixArgumentException extends IllegalArgumentException
{
	private final Object[] arguments;

	public MatrixArgumentException(Object... arguments)
	{
		super("invalid arguments: " + Arrays.deepToString(arguments));
		this.arguments = arguments == null ? new Object[0] : arguments.clone();
	}

	public Object[] getArguments()
	{
		return arguments.clone();
	}
}
