package com.msd.gin.bowline.rio;

import java.util.List;
import java.util.function.Consumer;

import org.eclipse.rdf4j.model.BNode;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.vocabulary.RDF;

/**
 * Expands the members of a Turtle collection into an RDF list of blank node cells.
 */
final class CollectionDesugarer {
	private CollectionDesugarer() {}

	/**
	 * Builds the list tail first, emitting rdf:first and rdf:rest for each cell.
	 *
	 * @return the head cell, or rdf:nil for an empty collection
	 */
	static Resource desugar(List<? extends Value> members, ValueFactory vf, Consumer<Statement> out) {
		Resource tail = RDF.NIL;
		for (int i = members.size() - 1; i >= 0; i--) {
			BNode cell = vf.createBNode();
			out.accept(vf.createStatement(cell, RDF.FIRST, members.get(i)));
			out.accept(vf.createStatement(cell, RDF.REST, tail));
			tail = cell;
		}
		return tail;
	}
}
