package com.msd.gin.bowline.rio;

import java.net.URISyntaxException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import org.eclipse.rdf4j.common.net.ParsedIRI;

/**
 * Namespace table and base IRI of a single document parse.
 * A new instance is created for every parse call and never shared.
 */
@NotThreadSafe
final class ParserState {
	private final Map<String,String> namespaces = new HashMap<>();
	@Nullable
	private ParsedIRI base;

	/**
	 * Binds a prefix, replacing any earlier binding.
	 */
	void setNamespace(String prefix, String iri) {
		namespaces.put(prefix, iri);
	}

	@Nullable
	String getNamespace(String prefix) {
		return namespaces.get(prefix);
	}

	Map<String,String> getNamespaces() {
		return Collections.unmodifiableMap(namespaces);
	}

	/**
	 * Sets the base IRI, resolving it against the current base first.
	 */
	void setBase(String iri) throws URISyntaxException {
		base = new ParsedIRI(resolve(iri));
	}

	@Nullable
	String getBase() {
		return base != null ? base.toString() : null;
	}

	/**
	 * Resolves a possibly relative IRI against the base. Without a base, or for an absolute IRI, the input is returned unchanged.
	 */
	String resolve(String iri) throws URISyntaxException {
		if (base == null) {
			return iri;
		}
		ParsedIRI parsed = new ParsedIRI(iri);
		if (parsed.isAbsolute()) {
			return iri;
		}
		return base.resolve(parsed).toString();
	}
}
