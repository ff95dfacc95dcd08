package com.msd.gin.bowline.common;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;

import javax.annotation.concurrent.ThreadSafe;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;

/**
 * Value factory that hands out the same {@link IRI} instance for repeated IRI strings.
 * Text formats repeat predicate, type and namespace IRIs on nearly every line, so parsers use this by default.
 */
@ThreadSafe
public final class InterningValueFactory extends SimpleValueFactory {
	public static final int DEFAULT_CACHE_SIZE = 10_000;

	private final LoadingCache<String,IRI> iriCache;

	public InterningValueFactory() {
		this(DEFAULT_CACHE_SIZE);
	}

	public InterningValueFactory(int cacheSize) {
		iriCache = CacheBuilder.newBuilder().maximumSize(cacheSize).build(CacheLoader.from(super::createIRI));
	}

	@Override
	public IRI createIRI(String iri) {
		try {
			return iriCache.getUnchecked(iri);
		} catch (UncheckedExecutionException e) {
			// surface the factory's own validation error
			if (e.getCause() instanceof IllegalArgumentException) {
				throw (IllegalArgumentException) e.getCause();
			}
			throw e;
		}
	}

	@Override
	public IRI createIRI(String namespace, String localName) {
		return createIRI(namespace + localName);
	}

	public long cachedIRICount() {
		return iriCache.size();
	}
}
