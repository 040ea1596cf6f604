package org.pagematrix.fitz;

public class Rect
{
	public final double x0;
	public final double y0;
	public final double x1;
	public final double y1;

	public Rect(double x0, double y0, double x1, double y1) {
		this.x0 = x0;
		this.y0 = y0;
		this.x1 = x1;
		this.y1 = y1;
	}

	public Rect(Rect r) {
		this(r.x0, r.y0, r.x1, r.y1);
	}

	public boolean isEmpty() {
		return x0 >= x1 || y0 >= y1;
	}

	public String toString() {
		return "[" + x0 + " " + y0 + " " + x1 + " " + y1 + "]";
	}

	// Bounding box of the transformed rectangle. Each coefficient scales
	// both edges and contributes whichever product is smaller to the low
	// edge, so flips and rotations keep the result ordered.
	public Rect transform(Matrix tm) {
		double nx0 = lo(x0 * tm.a, x1 * tm.a) + lo(y0 * tm.c, y1 * tm.c) + tm.e;
		double nx1 = hi(x0 * tm.a, x1 * tm.a) + hi(y0 * tm.c, y1 * tm.c) + tm.e;
		double ny0 = lo(x0 * tm.b, x1 * tm.b) + lo(y0 * tm.d, y1 * tm.d) + tm.f;
		double ny1 = hi(x0 * tm.b, x1 * tm.b) + hi(y0 * tm.d, y1 * tm.d) + tm.f;
		return new Rect(nx0, ny0, nx1, ny1);
	}

	private static double lo(double p, double q) {
		return p < q ? p : q;
	}

	private static double hi(double p, double q) {
		return p < q ? q : p;
	}
}
