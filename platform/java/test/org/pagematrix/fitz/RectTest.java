package org.pagematrix.fitz;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RectTest {

	private static final double EPSILON = 1e-9;

	@Test
	@DisplayName("rotation gives the bounding box of the turned rectangle")
	void transform_rotate_givesBoundingBox() {
		Rect r = new Rect(0, 0, 10, 20).transform(Matrix.rotate(90));

		assertEquals(-20, r.x0, EPSILON);
		assertEquals(0, r.y0, EPSILON);
		assertEquals(0, r.x1, EPSILON);
		assertEquals(10, r.y1, EPSILON);
	}

	@Test
	@DisplayName("a horizontal flip keeps the edges ordered")
	void transform_flip_keepsOrder() {
		Rect r = new Rect(1, 2, 3, 4).transform(Matrix.scale(-1, 1));

		assertEquals("[-3.0 2.0 -1.0 4.0]", r.toString());
		assertFalse(r.isEmpty());
	}

	@Test
	@DisplayName("translation and scale move the page box")
	void transform_scaleAndTranslate() {
		Rect r = new Rect(0, 0, 612, 792).transform(Matrix.scale(0.5, 0.5).translated(10, 20));

		assertEquals("[10.0 20.0 316.0 416.0]", r.toString());
	}

	@Test
	@DisplayName("zero width is empty")
	void isEmpty_zeroWidth() {
		assertTrue(new Rect(5, 5, 5, 10).isEmpty());
		assertFalse(new Rect(new Rect(0, 0, 1, 1)).isEmpty());
	}
}
