package com.msd.gin.bowline.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.junit.jupiter.api.Test;

public class InterningValueFactoryTest {
	@Test
	public void testSameInstance() {
		InterningValueFactory vf = new InterningValueFactory(10);
		IRI iri = vf.createIRI("http://example.org/a");
		assertSame(iri, vf.createIRI("http://example.org/a"));
		assertSame(iri, vf.createIRI("http://example.org/", "a"));
		assertEquals(SimpleValueFactory.getInstance().createIRI("http://example.org/a"), iri);
		assertEquals(1, vf.cachedIRICount());
	}

	@Test
	public void testInvalidIRI() {
		InterningValueFactory vf = new InterningValueFactory(10);
		assertThrows(IllegalArgumentException.class, () -> vf.createIRI("no-scheme"));
	}
}
