/*
 * KeyChain.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

/**
 * The ordering side of a {@link PureLinkedHashMap}: a pure singly linked list of
 * keys, most recently added first, so that adding a key is O(1).  The empty chain
 * is <code>null</code>.  Chains share structure: <code>less</code> copies only the
 * links in front of the key it removes.
 */

final class KeyChain {

    KeyChain(Object _key, KeyChain _next) {
	key = _key;
	next = _next;
    }

    final Object key;
    final KeyChain next;

    static KeyChain withFirst(KeyChain chain, Object key) {
	return new KeyChain(key, chain);
    }

    /**
     * Returns a chain without the first link holding <code>key</code>, or
     * <code>chain</code> itself if there is none.
     */
    static KeyChain less(KeyChain chain, Object key) {
	int depth = 0;
	KeyChain link = chain;
	while (link != null && !HashTree.eql(key, link.key)) {
	    link = link.next;
	    ++depth;
	}
	if (link == null) return chain;
	// Copy the `depth' links in front of `link' onto its tail.
	Object[] prefix = new Object[depth];
	KeyChain p = chain;
	for (int i = 0; i < depth; ++i, p = p.next) prefix[i] = p.key;
	KeyChain res = link.next;
	for (int i = depth - 1; i >= 0; --i) res = new KeyChain(prefix[i], res);
	return res;
    }

    static int length(KeyChain chain) {
	int len = 0;
	for (; chain != null; chain = chain.next) ++len;
	return len;
    }

    /**
     * Returns the keys of <code>chain</code>, which has <code>size</code> links,
     * oldest first (the reverse of chain order).
     */
    static Object[] toInsertionOrder(KeyChain chain, int size) {
	Object[] res = new Object[size];
	for (int i = size - 1; chain != null; --i, chain = chain.next) res[i] = chain.key;
	return res;
    }

}
