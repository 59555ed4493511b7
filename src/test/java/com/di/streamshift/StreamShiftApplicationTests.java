package com.di.streamshift;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic smoke test for StreamShiftApplication.
 */
@DisplayName("StreamShiftApplication Tests")
class StreamShiftApplicationTests {

	@Test
	@DisplayName("Should have main class")
	void testMainClassExists() {
		Class<?> mainClass = StreamShiftApplication.class;
		assertNotNull(mainClass);
		assertEquals("StreamShiftApplication", mainClass.getSimpleName());
	}

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = StreamShiftApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}

}
