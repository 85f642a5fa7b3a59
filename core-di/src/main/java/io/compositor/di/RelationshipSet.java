package io.compositor.di;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import static io.compositor.di.util.Utils.checkNotNull;

/**
 * De-duplicating set of relationships guarded by a single lock.
 * Readers always get a copy, and replacement clears and refills the set under the same lock.
 */
public final class RelationshipSet {
	private static final KnownRelationship[] NO_RELATIONSHIPS = new KnownRelationship[0];

	private final Set<KnownRelationship> relationships = new LinkedHashSet<>();
	private final Object lock = new Object();

	public KnownRelationship[] toArray() {
		synchronized (lock) {
			return relationships.toArray(NO_RELATIONSHIPS);
		}
	}

	public void add(KnownRelationship relationship) {
		checkNotNull(relationship, "relationship");
		synchronized (lock) {
			relationships.add(relationship);
		}
	}

	public void replace(Collection<KnownRelationship> replacement) {
		for (KnownRelationship relationship : replacement) {
			checkNotNull(relationship, "relationship");
		}
		synchronized (lock) {
			relationships.clear();
			relationships.addAll(replacement);
		}
	}

	public int size() {
		synchronized (lock) {
			return relationships.size();
		}
	}
}
