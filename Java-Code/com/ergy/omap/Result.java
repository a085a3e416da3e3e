/*
 * Result.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

/**
 * A value returned by an update operation, together with the map the update
 * produced.  Returned by {@link PureMap#pop} and {@link PureMap#getAndUpdate}.
 *
 * @author Scott L. Burson
 */

public class Result<R, Key, Val> {

    Result(R _value, PureMap<Key, Val> _map) {
	value = _value;
	map = _map;
    }

    private final R value;
    private final PureMap<Key, Val> map;

    /**
     * Returns the value the operation hands back to the caller.
     */
    public R getValue() {
	return value;
    }

    /**
     * Returns the updated map.
     */
    public PureMap<Key, Val> getMap() {
	return map;
    }

    public boolean equals(Object obj) {
	if (obj == this) return true;
	else if (!(obj instanceof Result)) return false;
	else {
	    Result<?, ?, ?> res = (Result<?, ?, ?>)obj;
	    return (value == null ? res.value == null : value.equals(res.value)) &&
		   map.equals(res.map);
	}
    }

    public int hashCode() {
	return (value == null ? 0 : value.hashCode()) * 31 + map.hashCode();
    }

    public String toString() {
	return "(" + value + ", " + map + ")";
    }

}
