/*
 * KeyConflictException.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

/**
 * Thrown by {@link PureMap#withNew} when the key is already in the map.  The
 * message names the key and the contents of the map.
 *
 * @author Scott L. Burson
 */

public class KeyConflictException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public KeyConflictException(Object _key, PureMap<?, ?> _map) {
	super("key " + describe(_key) + " already exists in: " + _map);
	key = _key;
	map = _map;
    }

    private final transient Object key;
    private final transient PureMap<?, ?> map;

    /**
     * Returns the key that was already present.
     */
    public Object getKey() {
	return key;
    }

    /**
     * Returns the map the key was already present in.
     */
    public PureMap<?, ?> getMap() {
	return map;
    }

    private static String describe(Object key) {
	if (key instanceof CharSequence) return "\"" + key + "\"";
	else return String.valueOf(key);
    }

}
