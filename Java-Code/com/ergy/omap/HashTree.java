/*
 * HashTree.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

/**
 * The lookup side of a {@link PureLinkedHashMap}: a pure binary tree of key/value
 * pairs ordered by the hash codes of the keys.  Keys need not implement {@link
 * Comparable}.  Distinct keys with the same hash code share a node.
 *
 * <p>A tree is represented by its root {@link Node}; the empty tree is
 * <code>null</code>.  Every update returns a new root, sharing all untouched
 * subtrees with the old one, or the old root itself if nothing changed.
 *
 * <p>Time costs: <code>size</code> is O(1); <code>lookup</code>,
 * <code>with</code> and <code>less</code> are O(log <i>n</i>).
 */

final class HashTree {

    private HashTree() { }

    /**
     * Returned by <code>lookup</code> for a key which is not in the tree.  Never
     * stored as a value.
     */
    static final Object NOT_FOUND = new Object() {
	public String toString() { return "NOT_FOUND"; }
    };

    /******************************************************************************/
    /* Internals */

    // Inspired by Stephen Adams' paper on weight-balanced binary trees, with the
    // balance parameters of Hirai and Yamamoto, "Balancing weight-balanced trees"
    // (JFP 2011).  Weights are subtree sizes plus one.

    /* The factor by which one subtree may outweigh another. */
    private static final int DELTA = 3;

    /* Decides between a single and a double rotation. */
    private static final int RATIO = 2;

    /* `keys' and `vals' are parallel; all keys have hash code `hash'.  Their length
     * is 1 except when distinct keys collide. */
    static final class Node {
	Node(int _hash, Object[] _keys, Object[] _vals, Node _left, Node _right) {
	    hash = _hash;
	    keys = _keys;
	    vals = _vals;
	    left = _left;
	    right = _right;
	    size = size(_left) + size(_right) + _keys.length;
	}
	final int hash;
	final Object[] keys;
	final Object[] vals;
	final Node left;
	final Node right;
	final int size;		// the number of pairs in the subtree
    }

    static int hashCode(Object key) {
	return key == null ? 0 : key.hashCode();
    }

    static int size(Node subtree) {
	return subtree == null ? 0 : subtree.size;
    }

    /**
     * Returns the value of <code>key</code>, or <code>NOT_FOUND</code>.
     */
    static Object lookup(Node subtree, Object key) {
	int khash = hashCode(key);
	while (subtree != null) {
	    if (khash < subtree.hash) subtree = subtree.left;
	    else if (khash > subtree.hash) subtree = subtree.right;
	    else {
		int idx = indexOf(subtree.keys, key);
		return idx < 0 ? NOT_FOUND : subtree.vals[idx];
	    }
	}
	return NOT_FOUND;
    }

    static Node with(Node subtree, Object key, Object value) {
	return with(subtree, key, hashCode(key), value);
    }

    private static Node with(Node subtree, Object key, int khash, Object value) {
	if (subtree == null)
	    return new Node(khash, new Object[] { key }, new Object[] { value }, null, null);
	else if (khash == subtree.hash) {
	    Object[] keys = subtree.keys, vals = subtree.vals;
	    int idx = indexOf(keys, key);
	    if (idx >= 0) {
		if (eql(vals[idx], value)) return subtree;
		Object[] new_vals = vals.clone();
		new_vals[idx] = value;
		return new Node(khash, keys, new_vals, subtree.left, subtree.right);
	    } else {
		int len = keys.length;
		Object[] new_keys = new Object[len + 1], new_vals = new Object[len + 1];
		System.arraycopy(keys, 0, new_keys, 0, len);
		System.arraycopy(vals, 0, new_vals, 0, len);
		new_keys[len] = key;
		new_vals[len] = value;
		return new Node(khash, new_keys, new_vals, subtree.left, subtree.right);
	    }
	} else if (khash < subtree.hash) {
	    Node new_left = with(subtree.left, key, khash, value);
	    if (new_left == subtree.left) return subtree;
	    else return buildNode(subtree, new_left, subtree.right);
	} else {
	    Node new_right = with(subtree.right, key, khash, value);
	    if (new_right == subtree.right) return subtree;
	    else return buildNode(subtree, subtree.left, new_right);
	}
    }

    static Node less(Node subtree, Object key) {
	return less(subtree, key, hashCode(key));
    }

    private static Node less(Node subtree, Object key, int khash) {
	if (subtree == null) return null;
	else if (khash == subtree.hash) {
	    Object[] keys = subtree.keys, vals = subtree.vals;
	    int idx = indexOf(keys, key);
	    if (idx < 0) return subtree;
	    else if (keys.length == 1) return join(subtree.left, subtree.right);
	    else {
		int len = keys.length;
		Object[] new_keys = new Object[len - 1], new_vals = new Object[len - 1];
		System.arraycopy(keys, 0, new_keys, 0, idx);
		System.arraycopy(keys, idx + 1, new_keys, idx, len - idx - 1);
		System.arraycopy(vals, 0, new_vals, 0, idx);
		System.arraycopy(vals, idx + 1, new_vals, idx, len - idx - 1);
		return new Node(khash, new_keys, new_vals, subtree.left, subtree.right);
	    }
	} else if (khash < subtree.hash) {
	    Node new_left = less(subtree.left, key, khash);
	    if (new_left == subtree.left) return subtree;
	    else return buildNode(subtree, new_left, subtree.right);
	} else {
	    Node new_right = less(subtree.right, key, khash);
	    if (new_right == subtree.right) return subtree;
	    else return buildNode(subtree, subtree.left, new_right);
	}
    }

    private static boolean isBalanced(Node a, Node b) {
	return DELTA * (size(a) + 1) >= size(b) + 1;
    }

    private static boolean isSingle(Node a, Node b) {
	return size(a) + 1 < RATIO * (size(b) + 1);
    }

    private static Node makeNode(Node pivot, Node left, Node right) {
	return new Node(pivot.hash, pivot.keys, pivot.vals, left, right);
    }

    // Builds a node holding the pairs of `pivot' over `left' and `right', where at
    // most one pair has been added to or removed from one side since the two were
    // last in balance.  Hence at most one rotation is needed.
    private static Node buildNode(Node pivot, Node left, Node right) {
	if (!isBalanced(left, right)) {
	    Node rl = right.left, rr = right.right;
	    if (isSingle(rl, rr))
		return makeNode(right, makeNode(pivot, left, rl), rr);
	    else return makeNode(rl, makeNode(pivot, left, rl.left),
				 makeNode(right, rl.right, rr));
	} else if (!isBalanced(right, left)) {
	    Node ll = left.left, lr = left.right;
	    if (isSingle(lr, ll))
		return makeNode(left, ll, makeNode(pivot, lr, right));
	    else return makeNode(lr, makeNode(left, ll, lr.left),
				 makeNode(pivot, lr.right, right));
	} else return makeNode(pivot, left, right);
    }

    private static Node join(Node left, Node right) {
	if (left == null) return right;
	else if (right == null) return left;
	else return buildNode(min(right), left, lessMin(right));
    }

    /* Assumes `subtree' is nonempty. */
    private static Node min(Node subtree) {
	while (subtree.left != null) subtree = subtree.left;
	return subtree;
    }

    /* Assumes `subtree' is nonempty. */
    private static Node lessMin(Node subtree) {
	if (subtree.left == null) return subtree.right;
	else return buildNode(subtree, lessMin(subtree.left), subtree.right);
    }

    private static int indexOf(Object[] keys, Object key) {
	for (int i = 0; i < keys.length; ++i)
	    if (eql(key, keys[i])) return i;
	return -1;
    }

    static boolean eql(Object x, Object y) {
	return x == null ? y == null : x.equals(y);
    }

    /* Checking */

    /**
     * Checks that hash codes are strictly ordered, that sizes are right, that no
     * node is empty or holds a key twice, and that no key sits in a node whose
     * hash code differs from its own.
     */
    static boolean verify(Node subtree) {
	return verify(subtree, Long.MIN_VALUE, Long.MAX_VALUE);
    }

    private static boolean verify(Node subtree, long lo, long hi) {
	if (subtree == null) return true;
	Object[] keys = subtree.keys;
	if (keys.length == 0 || keys.length != subtree.vals.length) return false;
	if (subtree.hash <= lo || subtree.hash >= hi) return false;
	if (subtree.size != size(subtree.left) + size(subtree.right) + keys.length)
	    return false;
	for (int i = 0; i < keys.length; ++i) {
	    if (hashCode(keys[i]) != subtree.hash) return false;
	    if (indexOf(keys, keys[i]) != i) return false;
	}
	return verify(subtree.left, lo, subtree.hash) &&
	       verify(subtree.right, subtree.hash, hi);
    }

    // For debugging.
    static String dump(Node subtree) {
	if (subtree == null) return "null";
	StringBuilder str_buf = new StringBuilder("(");
	str_buf.append(subtree.size);
	str_buf.append(", ");
	for (int i = 0; i < subtree.keys.length; ++i) {
	    if (i > 0) str_buf.append(" | ");
	    str_buf.append(subtree.keys[i]);
	    str_buf.append(" -> ");
	    str_buf.append(subtree.vals[i]);
	}
	str_buf.append(";\n");
	str_buf.append(indent(dump(subtree.left), "  "));
	str_buf.append(",\n");
	str_buf.append(indent(dump(subtree.right), "  "));
	str_buf.append(")");
	return str_buf.toString();
    }

    private static String indent(String str, String prefix) {
	StringBuilder res = new StringBuilder(prefix);
	for (int i = 0, len = str.length(); i < len; ++i) {
	    char c = str.charAt(i);
	    res.append(c);
	    if (c == '\n' && i < len - 1) res.append(prefix);
	}
	return res.toString();
    }

}
