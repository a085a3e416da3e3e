/*
 * Lookup.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

/**
 * The result of looking up a key in a {@link PureMap}: either the key is present,
 * with some value (which may be <code>null</code>), or it is absent.
 *
 * @author Scott L. Burson
 */

public final class Lookup<Val> {

    private static final Lookup ABSENT = new Lookup(false, null);

    private Lookup(boolean _present, Val _value) {
	present = _present;
	value = _value;
    }

    private final boolean present;
    private final Val value;

    /**
     * Returns a result for a key which is present with value <code>value</code>.
     */
    public static <Val> Lookup<Val> of(Val value) {
	return new Lookup<Val>(true, value);
    }

    /**
     * Returns the result for a key which is absent.
     */
    public static <Val> Lookup<Val> absent() {
	return (Lookup<Val>)ABSENT;
    }

    public boolean isPresent() {
	return present;
    }

    /**
     * Returns the value found.
     *
     * @throws java.util.NoSuchElementException if the key was absent
     */
    public Val getValue() {
	if (!present) throw new java.util.NoSuchElementException("key not present");
	return value;
    }

    /**
     * Returns the value found, or <code>dflt</code> if the key was absent.
     */
    public Val orElse(Val dflt) {
	return present ? value : dflt;
    }

    public boolean equals(Object obj) {
	if (obj == this) return true;
	else if (!(obj instanceof Lookup)) return false;
	else {
	    Lookup<?> lk = (Lookup<?>)obj;
	    return present == lk.present &&
		   (value == null ? lk.value == null : value.equals(lk.value));
	}
    }

    public int hashCode() {
	if (!present) return 0;
	else return 31 + (value == null ? 0 : value.hashCode());
    }

    public String toString() {
	return present ? "Lookup[" + value + "]" : "Lookup.absent";
    }

}
