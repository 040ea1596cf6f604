package org.pagematrix.fitz;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.List;

// A PDF content stream matrix. The full 3x3 form is summarized by the
// shorthand (a, b, c, d, e, f); the last column is (0, 0, 1) since these
// are homogeneous coordinates.
//
// PDF uses row vectors, so a point (x, y, 1) is transformed as p * M.
// Matrices are immutable; every transformation returns a new Matrix.
public class Matrix
{
	public final double a;
	public final double b;
	public final double c;
	public final double d;
	public final double e;
	public final double f;

	private final double[][] values;

	public Matrix()
	{
		this(grid(1, 0, 0, 1, 0, 0));
	}

	// Six scalars, or a shorthand array; any other length is rejected.
	public Matrix(double... shorthand)
	{
		this(shorthandGrid(shorthand));
	}

	// The third column is copied as given and not checked against (0, 0, 1).
	public Matrix(double[][] grid)
	{
		if (grid == null || grid.length != 3)
			throw new MatrixArgumentException((Object) grid);
		values = new double[3][];
		for (int i = 0; i < 3; i++)
		{
			if (grid[i] == null || grid[i].length != 3)
				throw new MatrixArgumentException((Object) grid);
			values[i] = grid[i].clone();
		}

		a = values[0][0];
		b = values[0][1];
		c = values[1][0];
		d = values[1][1];
		e = values[2][0];
		f = values[2][1];
	}

	public Matrix(Matrix m)
	{
		this(copyOf(m));
	}

	public static Matrix identity()
	{
		return new Matrix();
	}

	// Build from an operand list such as the contents of a /Matrix array.
	public static Matrix of(List<? extends Number> shorthand)
	{
		if (shorthand == null || shorthand.size() != 6)
			throw new MatrixArgumentException(shorthand);
		double[] v = new double[6];
		for (int i = 0; i < 6; i++)
		{
			Number n = shorthand.get(i);
			if (n == null)
				throw new MatrixArgumentException(shorthand);
			v[i] = n.doubleValue();
		}
		return new Matrix(v);
	}

	public static Matrix scale(double x, double y)
	{
		return identity().scaled(x, y);
	}

	public static Matrix rotate(double degrees)
	{
		return identity().rotated(degrees);
	}

	public static Matrix translate(double x, double y)
	{
		return identity().translated(x, y);
	}

	// Concatenate m onto this matrix, returning this * m: the result
	// applies this matrix first, then m.
	public Matrix compose(Matrix m)
	{
		double[][] r = new double[3][3];
		for (int i = 0; i < 3; i++)
			for (int j = 0; j < 3; j++)
			{
				double sum = 0;
				for (int k = 0; k < 3; k++)
					sum += values[i][k] * m.values[k][j];
				r[i][j] = sum;
			}
		return new Matrix(r);
	}

	public Matrix scaled(double x, double y)
	{
		return compose(new Matrix(x, 0, 0, y, 0, 0));
	}

	// Positive angles are counter-clockwise.
	public Matrix rotated(double degrees)
	{
		double angle = degrees / 180.0 * Math.PI;
		double cos = Math.cos(angle);
		double sin = Math.sin(angle);
		return compose(new Matrix(cos, sin, -sin, cos, 0, 0));
	}

	public Matrix translated(double x, double y)
	{
		return compose(new Matrix(1, 0, 0, 1, x, y));
	}

	public Point transform(Point p)
	{
		return p.transform(this);
	}

	public double[] shorthand()
	{
		return new double[] { a, b, c, d, e, f };
	}

	public double[][] values()
	{
		return copyOf(this);
	}

	// Operand list for a cm operator: six space separated numbers with
	// six decimal places, in ASCII.
	public byte[] encode()
	{
		StringBuilder s = new StringBuilder();
		for (double v : shorthand())
		{
			if (s.length() > 0)
				s.append(' ');
			s.append(fixed(v));
		}
		return s.toString().getBytes(StandardCharsets.US_ASCII);
	}

	public boolean equals(Object obj)
	{
		if (this == obj)
			return true;
		if (!(obj instanceof Matrix))
			return false;
		Matrix m = (Matrix) obj;
		return a == m.a && b == m.b && c == m.c && d == m.d && e == m.e && f == m.f;
	}

	public int hashCode()
	{
		int h = 17;
		for (double v : shorthand())
		{
			// 0.0 and -0.0 compare equal
			long bits = Double.doubleToLongBits(v == 0 ? 0.0 : v);
			h = 31 * h + (int) (bits ^ (bits >>> 32));
		}
		return h;
	}

	public String toString()
	{
		StringBuilder s = new StringBuilder("Matrix(");
		for (int i = 0; i < 3; i++)
		{
			s.append('[');
			for (int j = 0; j < 3; j++)
			{
				if (j > 0)
					s.append(' ');
				s.append(values[i][j]);
			}
			s.append(']');
		}
		s.append(')');
		return s.toString();
	}

	private static double[][] grid(double a, double b, double c, double d, double e, double f)
	{
		return new double[][] {
			{ a, b, 0 },
			{ c, d, 0 },
			{ e, f, 1 }
		};
	}

	private static double[][] shorthandGrid(double[] v)
	{
		if (v == null)
			throw new MatrixArgumentException((Object) null);
		if (v.length != 6)
			throw new MatrixArgumentException(box(v));
		return grid(v[0], v[1], v[2], v[3], v[4], v[5]);
	}

	// Rounds from the exact binary value, as printf("%.6f") does, rather
	// than from the shortest decimal that Formatter starts from.
	private static String fixed(double v)
	{
		if (Double.isNaN(v))
			return "nan";
		if (Double.isInfinite(v))
			return v > 0 ? "inf" : "-inf";
		String digits = new BigDecimal(Math.abs(v)).setScale(6, RoundingMode.HALF_EVEN).toPlainString();
		return Double.doubleToRawLongBits(v) < 0 ? "-" + digits : digits;
	}

	private static double[][] copyOf(Matrix m)
	{
		if (m == null)
			throw new MatrixArgumentException((Object) null);
		double[][] v = new double[3][];
		for (int i = 0; i < 3; i++)
			v[i] = m.values[i].clone();
		return v;
	}

	private static Object[] box(double[] v)
	{
		Object[] o = new Object[v.length];
		for (int i = 0; i < v.length; i++)
			o[i] = v[i];
		return o;
	}
}
