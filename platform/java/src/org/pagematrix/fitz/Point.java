package org.pagematrix.fitz;

public class Point
{
	public final double x;
	public final double y;

	public Point(double x, double y) {
		this.x = x;
		this.y = y;
	}

	public Point(Point p) {
		this(p.x, p.y);
	}

	public Point transform(Matrix tm) {
		return new Point(x * tm.a + y * tm.c + tm.e, x * tm.b + y * tm.d + tm.f);
	}

	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Point))
			return false;
		Point p = (Point) obj;
		return x == p.x && y == p.y;
	}

	public int hashCode() {
		long bx = Double.doubleToLongBits(x == 0 ? 0.0 : x);
		long by = Double.doubleToLongBits(y == 0 ? 0.0 : y);
		return 31 * (int)(bx ^ (bx >>> 32)) + (int)(by ^ (by >>> 32));
	}

	public String toString() {
		return "[" + x + " " + y + "]";
	}
}
