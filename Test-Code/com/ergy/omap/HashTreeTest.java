/*
 * HashTreeTest.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

import java.util.*;
import org.testng.annotations.Test;

public class HashTreeTest {

    /* All instances have the same hash code. */
    private static final class Colliding {
	Colliding(String _name) { name = _name; }
	final String name;
	public boolean equals(Object obj) {
	    return obj instanceof Colliding && ((Colliding)obj).name.equals(name);
	}
	public int hashCode() { return 42; }
	public String toString() { return name; }
    }

    @Test
    public void emptyTree() {
	assertEquals(HashTree.size(null), 0);
	assertSame(HashTree.lookup(null, "k"), HashTree.NOT_FOUND);
	assertNull(HashTree.less(null, "k"));
	assertTrue(HashTree.verify(null));
    }

    @Test
    public void unchangedTreeIsReturnedAsIs() {
	HashTree.Node t = HashTree.with(HashTree.with(null, "a", 1), "b", null);
	assertSame(HashTree.with(t, "a", 1), t);
	assertSame(HashTree.with(t, "b", null), t);
	assertSame(HashTree.less(t, "c"), t);
    }

    @Test
    public void nullValueIsFound() {
	HashTree.Node t = HashTree.with(null, "a", null);
	assertNull(HashTree.lookup(t, "a"));
	assertSame(HashTree.lookup(t, "b"), HashTree.NOT_FOUND);
	assertEquals(HashTree.size(t), 1);
    }

    @Test
    public void collidingKeysShareANode() {
	Colliding a = new Colliding("a"), b = new Colliding("b"), c = new Colliding("c");
	HashTree.Node t = HashTree.with(HashTree.with(HashTree.with(null, a, 1), b, 2), c, 3);
	assertEquals(HashTree.size(t), 3);
	assertEquals(t.keys.length, 3);
	assertTrue(HashTree.verify(t));
	assertEquals(HashTree.lookup(t, new Colliding("b")), Integer.valueOf(2));
	t = HashTree.with(t, b, 20);
	assertEquals(HashTree.size(t), 3);
	assertEquals(HashTree.lookup(t, b), Integer.valueOf(20));
	t = HashTree.less(t, a);
	assertEquals(HashTree.size(t), 2);
	assertSame(HashTree.lookup(t, a), HashTree.NOT_FOUND);
	assertEquals(HashTree.lookup(t, c), Integer.valueOf(3));
	assertTrue(HashTree.verify(t));
	t = HashTree.less(HashTree.less(t, b), c);
	assertNull(t);
    }

    @Test
    public void staysConsistentUnderManyUpdates() {
	Random rand = new Random(0x5eedL);
	HashTree.Node t = null;
	HashMap<Integer, Integer> model = new HashMap<Integer, Integer>();
	for (int j = 0; j < 5000; ++j) {
	    Integer k = rand.nextInt(1000);
	    if (rand.nextInt(3) == 0) {
		t = HashTree.less(t, k);
		model.remove(k);
	    } else {
		t = HashTree.with(t, k, j);
		model.put(k, j);
	    }
	}
	assertTrue(HashTree.verify(t), HashTree.dump(t));
	assertEquals(HashTree.size(t), model.size());
	for (int k = 0; k < 1000; ++k) {
	    Object v = HashTree.lookup(t, k);
	    if (model.containsKey(k)) assertEquals(v, model.get(k));
	    else assertSame(v, HashTree.NOT_FOUND);
	}
	assertTrue(depth(t) <= 4 * (32 - Integer.numberOfLeadingZeros(model.size())),
		   "depth " + depth(t) + " for " + model.size() + " keys");
    }

    private static int depth(HashTree.Node t) {
	return t == null ? 0 : 1 + Math.max(depth(t.left), depth(t.right));
    }

    @Test
    public void keyChainRemovesOneLinkAndSharesTheTail() {
	KeyChain chain = null;
	for (String k : Arrays.asList("a", "b", "c", "d")) chain = KeyChain.withFirst(chain, k);
	assertEquals(KeyChain.length(chain), 4);
	assertEquals(Arrays.asList(KeyChain.toInsertionOrder(chain, 4)), Arrays.asList("a", "b", "c", "d"));
	KeyChain less_c = KeyChain.less(chain, "c");
	assertEquals(Arrays.asList(KeyChain.toInsertionOrder(less_c, 3)), Arrays.asList("a", "b", "d"));
	// The links older than "c" are shared.
	assertSame(less_c.next, chain.next.next);
	assertSame(KeyChain.less(chain, "z"), chain);
	assertNull(KeyChain.less(KeyChain.withFirst(null, "x"), "x"));
	assertNull(KeyChain.less(null, "x"));
    }

}
